package com.todotracker.cli;

import com.todotracker.core.cache.CacheException;
import com.todotracker.core.cache.FingerprintCache;
import com.todotracker.core.cache.SqliteFingerprintCache;
import com.todotracker.core.config.ConfigLoader;
import com.todotracker.core.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Commands operating on the fingerprint cache of a scanned directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Show the number of cached files
 * todo-tracker cache info
 *
 * # Remove all cached results
 * todo-tracker cache clear /path/to/project
 * }</pre>
 */
@Command(
    name = "cache",
    description = "Inspect or clear the fingerprint cache",
    mixinStandardHelpOptions = true,
    subcommands = {
        CacheCommand.Info.class,
        CacheCommand.Clear.class
    }
)
public class CacheCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Resolves the cache database of a project directory from its configuration.
     */
    static Path databaseFile(Path projectPath) {
        Path root = projectPath.toAbsolutePath().normalize();
        TrackerConfig config = ConfigLoader.loadNearest(root);
        return root.resolve(config.cache().directory()).resolve(SqliteFingerprintCache.DATABASE_FILE);
    }

    @Command(name = "info", description = "Show the number of cached files", mixinStandardHelpOptions = true)
    static class Info implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(Info.class);

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
        private Path projectPath;

        @Override
        public Integer call() {
            Path databaseFile = databaseFile(projectPath);
            if (!Files.exists(databaseFile)) {
                spec.commandLine().getOut().println("No cache at " + databaseFile);
                return 0;
            }
            try (FingerprintCache cache = SqliteFingerprintCache.inspect(databaseFile)) {
                spec.commandLine().getOut().println("✓ " + cache.size() + " cached files in " + databaseFile);
                return 0;
            } catch (CacheException e) {
                log.error("Cannot read cache {}", databaseFile, e);
                spec.commandLine().getErr().println("✗ Cannot read cache: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "clear", description = "Remove all cached results", mixinStandardHelpOptions = true)
    static class Clear implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(Clear.class);

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
        private Path projectPath;

        @Override
        public Integer call() {
            Path databaseFile = databaseFile(projectPath);
            if (!Files.exists(databaseFile)) {
                spec.commandLine().getOut().println("✓ Nothing to clear (no cache at " + databaseFile + ")");
                return 0;
            }
            try (FingerprintCache cache = SqliteFingerprintCache.inspect(databaseFile)) {
                long entries = cache.size();
                cache.clear();
                log.info("Cleared {} entries from {}", entries, databaseFile);
                spec.commandLine().getOut().println("✓ Cleared " + entries + " cached files");
                return 0;
            } catch (CacheException e) {
                log.error("Cannot clear cache {}", databaseFile, e);
                spec.commandLine().getErr().println("✗ Cannot clear cache: " + e.getMessage());
                return 1;
            }
        }
    }
}
