package com.todotracker.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.todotracker.core.cache.SqliteFingerprintCache;
import com.todotracker.core.io.LargeFileReader;
import com.todotracker.core.scanner.base.TagVocabulary;

import java.util.List;

/**
 * Root configuration for todo-tracker.
 *
 * <p>Loaded from {@code .todo-tracker.yaml}. Every key is optional; absent keys take the
 * defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * scan:
 *   tags: [TODO, FIXME, HACK, BUG, XXX, NOTE]
 *   caseSensitive: true
 *   workers: 8
 *   largeFileThreshold: 262144
 *   maxFileSize: 1048576
 *   precise: false
 *
 * cache:
 *   enabled: true
 *   directory: .todo-tracker
 *
 * exclude:
 *   - "vendor/**"
 *   - "*.min.js"
 * }</pre>
 *
 * @param scan scan settings
 * @param cache cache settings
 * @param exclude glob patterns (relative to the scanned root) of files to leave out
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackerConfig(
    @JsonProperty("scan") ScanSettings scan,
    @JsonProperty("cache") CacheSettings cache,
    @JsonProperty("exclude") List<String> exclude
) {
    /** Default configuration file name. */
    public static final String FILE_NAME = ".todo-tracker.yaml";

    public TrackerConfig {
        if (scan == null) {
            scan = ScanSettings.defaults();
        }
        if (cache == null) {
            cache = CacheSettings.defaults();
        }
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static TrackerConfig defaults() {
        return new TrackerConfig(ScanSettings.defaults(), CacheSettings.defaults(), List.of());
    }

    /**
     * Scan settings.
     *
     * @param tags tag vocabulary (defaults to the five built-in tags)
     * @param caseSensitive whether tags match exact-case (default true)
     * @param workers worker pool size (default: available processors)
     * @param largeFileThreshold size in bytes above which files are memory-mapped (default 256 KiB)
     * @param maxFileSize size in bytes above which files are not discovered (default 1 MiB)
     * @param precise whether the AST verification layer is enabled (default false)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanSettings(
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("caseSensitive") Boolean caseSensitive,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("largeFileThreshold") Long largeFileThreshold,
        @JsonProperty("maxFileSize") Long maxFileSize,
        @JsonProperty("precise") Boolean precise
    ) {
        public static final long DEFAULT_MAX_FILE_SIZE = 1024L * 1024;

        public ScanSettings {
            if (tags == null || tags.isEmpty()) {
                tags = TagVocabulary.DEFAULT_TAGS;
            } else {
                tags = List.copyOf(tags);
            }
            if (caseSensitive == null) {
                caseSensitive = Boolean.TRUE;
            }
            if (workers == null || workers < 1) {
                workers = Runtime.getRuntime().availableProcessors();
            }
            if (largeFileThreshold == null || largeFileThreshold < 0) {
                largeFileThreshold = LargeFileReader.DEFAULT_THRESHOLD;
            }
            if (maxFileSize == null || maxFileSize < 0) {
                maxFileSize = DEFAULT_MAX_FILE_SIZE;
            }
            if (precise == null) {
                precise = Boolean.FALSE;
            }
        }

        public static ScanSettings defaults() {
            return new ScanSettings(null, null, null, null, null, null);
        }

        /**
         * Builds the tag vocabulary these settings describe.
         */
        public TagVocabulary vocabulary() {
            return TagVocabulary.of(tags, caseSensitive);
        }
    }

    /**
     * Cache settings.
     *
     * @param enabled whether the fingerprint cache is used (default true)
     * @param directory cache directory, relative to the scanned root (default {@code .todo-tracker})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("directory") String directory
    ) {
        public static final String DEFAULT_DIRECTORY = SqliteFingerprintCache.CACHE_DIRECTORY;

        public CacheSettings {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
        }

        public static CacheSettings defaults() {
            return new CacheSettings(null, null);
        }
    }
}
