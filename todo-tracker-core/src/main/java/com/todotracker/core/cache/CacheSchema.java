package com.todotracker.core.cache;

/**
 * Layout of the fingerprint store.
 *
 * <p>Bump {@link #VERSION} whenever the stored findings would differ for unchanged input
 * (new finding fields, different extraction rules); stores written with another version are
 * emptied on open.
 *
 * <p>Tables: {@code meta} (schema version and scan profile) and {@code entries} (one row per
 * file).
 */
public final class CacheSchema {

    public static final int VERSION = 1;

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String PROFILE_KEY = "profile";

    static final String CREATE_META =
        "CREATE TABLE IF NOT EXISTS meta (key TEXT PRIMARY KEY, value TEXT NOT NULL)";

    static final String CREATE_ENTRIES =
        "CREATE TABLE IF NOT EXISTS entries ("
            + "path TEXT PRIMARY KEY, "
            + "mtime INTEGER NOT NULL, "
            + "size INTEGER NOT NULL, "
            + "schema_version INTEGER NOT NULL, "
            + "findings TEXT NOT NULL)";

    static final String SELECT_META = "SELECT value FROM meta WHERE key = ?";
    static final String UPSERT_META = "INSERT OR REPLACE INTO meta (key, value) VALUES (?, ?)";
    static final String SELECT_ENTRY = "SELECT mtime, size, schema_version, findings FROM entries WHERE path = ?";
    static final String UPSERT_ENTRY =
        "INSERT OR REPLACE INTO entries (path, mtime, size, schema_version, findings) VALUES (?, ?, ?, ?, ?)";
    static final String DELETE_ENTRIES = "DELETE FROM entries";
    static final String COUNT_ENTRIES = "SELECT COUNT(*) FROM entries";

    private CacheSchema() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
