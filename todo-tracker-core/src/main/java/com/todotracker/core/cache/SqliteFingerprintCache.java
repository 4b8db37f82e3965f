package com.todotracker.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.todotracker.core.model.FileFingerprint;
import com.todotracker.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link FingerprintCache} backed by a SQLite database in WAL mode.
 *
 * <p>One row per file holds the fingerprint (mtime, size), the schema version and the
 * findings serialized as JSON. Each row is written with a single {@code INSERT OR REPLACE},
 * which SQLite commits atomically.
 *
 * <p><b>Concurrency:</b></p>
 * <p>Each operation borrows a connection from a small pool and returns it when done, so
 * concurrent workers never share a connection and the number of open connections stays
 * bounded however many scans reuse the cache. SQLite serialises commits itself; a
 * {@code busy_timeout} lets a writer wait for a concurrent commit instead of failing.</p>
 *
 * <p><b>Cold-cache behaviour:</b></p>
 * <ul>
 *   <li>A store written with another {@link CacheSchema#VERSION}, or for another scan
 *       profile (see {@link #open(Path, String)}), is emptied on open.</li>
 *   <li>A database file SQLite reports as corrupt, or that is not a database at all, is
 *       deleted and recreated.</li>
 *   <li>A row whose findings cannot be decoded is treated as absent.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * try (FingerprintCache cache = SqliteFingerprintCache.openInRoot(projectRoot)) {
 *     IncrementalScanner scanner = new IncrementalScanner(extractor, cache, reader);
 *     ...
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class SqliteFingerprintCache implements FingerprintCache {

    private static final Logger log = LoggerFactory.getLogger(SqliteFingerprintCache.class);

    /** Cache directory created under the scanned root. */
    public static final String CACHE_DIRECTORY = ".todo-tracker";

    /** Database file name inside {@link #CACHE_DIRECTORY}. */
    public static final String DATABASE_FILE = "cache.db";

    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    /** Idle connections kept for reuse; further returned connections are closed. */
    static final int MAX_IDLE_CONNECTIONS = 8;

    private static final TypeReference<List<Finding>> FINDINGS_TYPE = new TypeReference<>() { };

    private final Path databaseFile;
    private final String profile; // null: keep whatever profile is stored
    private final String url;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<Connection> idleConnections = new ArrayBlockingQueue<>(MAX_IDLE_CONNECTIONS);
    private final AtomicInteger openConnections = new AtomicInteger();
    private volatile boolean closed;

    private SqliteFingerprintCache(Path databaseFile, String profile) {
        this.databaseFile = databaseFile;
        this.profile = profile;
        this.url = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Opens (creating if needed) the store at {@code <root>/.todo-tracker/cache.db}.
     *
     * @param root scanned root directory
     * @return opened cache
     * @throws CacheException if the store cannot be created
     */
    public static SqliteFingerprintCache openInRoot(Path root) {
        return openInRoot(root, "");
    }

    /**
     * Opens the store at {@code <root>/.todo-tracker/cache.db} for a scan profile.
     *
     * @param root scanned root directory
     * @param profile scan profile, see {@link #open(Path, String)}
     * @return opened cache
     * @throws CacheException if the store cannot be created
     */
    public static SqliteFingerprintCache openInRoot(Path root, String profile) {
        return open(root.resolve(CACHE_DIRECTORY).resolve(DATABASE_FILE), profile);
    }

    /**
     * Opens (creating if needed) the store in a database file.
     *
     * @param databaseFile SQLite database file
     * @return opened cache
     * @throws CacheException if the store cannot be created
     */
    public static SqliteFingerprintCache open(Path databaseFile) {
        return open(databaseFile, "");
    }

    /**
     * Opens the store in a database file for a scan profile.
     *
     * <p>The profile describes everything besides file content that determines the findings
     * (extraction strategy, tag vocabulary). Entries written under another profile are
     * discarded on open, like entries of another schema version.
     *
     * @param databaseFile SQLite database file
     * @param profile scan profile identifier
     * @return opened cache
     * @throws CacheException if the store cannot be created
     */
    public static SqliteFingerprintCache open(Path databaseFile, String profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return openStore(databaseFile, profile);
    }

    /**
     * Opens an existing store for maintenance (counting, clearing) whatever profile it was
     * written for. Entries of another schema version are still discarded.
     *
     * @param databaseFile SQLite database file
     * @return opened cache
     * @throws CacheException if the store cannot be opened
     */
    public static SqliteFingerprintCache inspect(Path databaseFile) {
        return openStore(databaseFile, null);
    }

    private static SqliteFingerprintCache openStore(Path databaseFile, String profile) {
        Objects.requireNonNull(databaseFile, "databaseFile must not be null");
        try {
            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new CacheException("Cannot create cache directory for " + databaseFile, e);
        }

        SqliteFingerprintCache cache = new SqliteFingerprintCache(databaseFile, profile);
        try {
            cache.initialize();
        } catch (SQLException e) {
            if (!isCorruption(e)) {
                cache.close();
                throw new CacheException("Cannot open cache " + databaseFile, e);
            }
            log.warn("Cache {} is corrupt ({}), recreating it", databaseFile, e.getMessage());
            cache.close();
            deleteDatabaseFiles(databaseFile);
            cache = new SqliteFingerprintCache(databaseFile, profile);
            try {
                cache.initialize();
            } catch (SQLException retry) {
                cache.close();
                throw new CacheException("Cannot recreate cache " + databaseFile, retry);
            }
        }
        return cache;
    }

    // ==================== Setup ====================

    private void initialize() throws SQLException {
        withConnection(connection -> {
            createSchema(connection);
            return null;
        });
        log.debug("Opened cache {}", databaseFile);
    }

    private void createSchema(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute(CacheSchema.CREATE_META);
            st.execute(CacheSchema.CREATE_ENTRIES);
        }

        String storedVersion = readMeta(connection, CacheSchema.SCHEMA_VERSION_KEY);
        String storedProfile = readMeta(connection, CacheSchema.PROFILE_KEY);
        String currentVersion = Integer.toString(CacheSchema.VERSION);
        boolean profileChanged = profile != null && !profile.equals(storedProfile);
        if (!currentVersion.equals(storedVersion) || profileChanged) {
            if (storedVersion != null && !currentVersion.equals(storedVersion)) {
                log.info("Cache schema version changed ({} -> {}), discarding cached results",
                    storedVersion, currentVersion);
            } else if (storedProfile != null) {
                log.info("Scan profile changed ('{}' -> '{}'), discarding cached results",
                    storedProfile, profile);
            }
            resetMeta(connection, currentVersion);
        }
    }

    private static String readMeta(Connection connection, String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(CacheSchema.SELECT_META)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private void resetMeta(Connection connection, String version) throws SQLException {
        connection.setAutoCommit(false);
        try (Statement st = connection.createStatement();
             PreparedStatement ps = connection.prepareStatement(CacheSchema.UPSERT_META)) {
            st.executeUpdate(CacheSchema.DELETE_ENTRIES);
            ps.setString(1, CacheSchema.SCHEMA_VERSION_KEY);
            ps.setString(2, version);
            ps.addBatch();
            ps.setString(1, CacheSchema.PROFILE_KEY);
            ps.setString(2, profile != null ? profile : "");
            ps.addBatch();
            ps.executeBatch();
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    // ==================== Connection Pool ====================

    @FunctionalInterface
    private interface ConnectionCallback<T> {
        T apply(Connection connection) throws SQLException;
    }

    private <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        Connection connection = borrow();
        try {
            return callback.apply(connection);
        } finally {
            release(connection);
        }
    }

    private Connection borrow() throws SQLException {
        if (closed) {
            throw new CacheException("Cache " + databaseFile + " is closed");
        }
        Connection connection = idleConnections.poll();
        return connection != null ? connection : connect();
    }

    private void release(Connection connection) {
        if (closed || !idleConnections.offer(connection)) {
            closeQuietly(connection);
        }
    }

    private Connection connect() throws SQLException {
        Connection connection = DriverManager.getConnection(url);
        openConnections.incrementAndGet();
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw e;
        }
        return connection;
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close cache connection for {}: {}", databaseFile, e.getMessage());
        } finally {
            openConnections.decrementAndGet();
        }
    }

    /** Number of connections currently open, idle or borrowed. */
    int openConnectionCount() {
        return openConnections.get();
    }

    private static boolean isCorruption(SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        return primary == SQLiteErrorCode.SQLITE_CORRUPT.code
            || primary == SQLiteErrorCode.SQLITE_NOTADB.code;
    }

    private static void deleteDatabaseFiles(Path databaseFile) {
        for (String suffix : List.of("", "-wal", "-shm")) {
            Path file = databaseFile.resolveSibling(databaseFile.getFileName() + suffix);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new CacheException("Cannot delete corrupt cache file " + file, e);
            }
        }
    }

    // ==================== FingerprintCache ====================

    @Override
    public Optional<CacheEntry> get(Path file) {
        try {
            return withConnection(connection -> {
                try (PreparedStatement ps = connection.prepareStatement(CacheSchema.SELECT_ENTRY)) {
                    ps.setString(1, key(file));
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.empty();
                        }
                        FileFingerprint fingerprint = new FileFingerprint(rs.getLong(1), rs.getLong(2));
                        int schemaVersion = rs.getInt(3);
                        List<Finding> findings = decode(file, rs.getString(4));
                        if (findings == null) {
                            return Optional.empty();
                        }
                        return Optional.of(new CacheEntry(fingerprint, findings, schemaVersion));
                    }
                }
            });
        } catch (SQLException e) {
            throw new CacheException("Cannot read cache entry for " + file, e);
        }
    }

    @Override
    public void put(Path file, FileFingerprint fingerprint, List<Finding> findings) {
        String json;
        try {
            json = objectMapper.writeValueAsString(findings);
        } catch (JsonProcessingException e) {
            throw new CacheException("Cannot serialize findings for " + file, e);
        }

        try {
            withConnection(connection -> {
                try (PreparedStatement ps = connection.prepareStatement(CacheSchema.UPSERT_ENTRY)) {
                    ps.setString(1, key(file));
                    ps.setLong(2, fingerprint.modifiedMillis());
                    ps.setLong(3, fingerprint.size());
                    ps.setInt(4, CacheSchema.VERSION);
                    ps.setString(5, json);
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new CacheException("Cannot write cache entry for " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            int removed = withConnection(connection -> {
                try (Statement st = connection.createStatement()) {
                    return st.executeUpdate(CacheSchema.DELETE_ENTRIES);
                }
            });
            log.debug("Cleared {} cache entries from {}", removed, databaseFile);
        } catch (SQLException e) {
            throw new CacheException("Cannot clear cache " + databaseFile, e);
        }
    }

    @Override
    public long size() {
        try {
            return withConnection(connection -> {
                try (Statement st = connection.createStatement();
                     ResultSet rs = st.executeQuery(CacheSchema.COUNT_ENTRIES)) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            });
        } catch (SQLException e) {
            throw new CacheException("Cannot count cache entries in " + databaseFile, e);
        }
    }

    @Override
    public void close() {
        closed = true;
        Connection connection;
        while ((connection = idleConnections.poll()) != null) {
            closeQuietly(connection);
        }
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    private static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    private List<Finding> decode(Path file, String json) {
        try {
            return objectMapper.readValue(json, FINDINGS_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring undecodable cache entry for {}: {}", file, e.getMessage());
            return null;
        }
    }
}
