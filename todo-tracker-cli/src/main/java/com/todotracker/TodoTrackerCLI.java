package com.todotracker;

import ch.qos.logback.classic.Level;
import com.todotracker.cli.CacheCommand;
import com.todotracker.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for todo-tracker.
 *
 * <p>todo-tracker finds technical-debt markers (TODO, FIXME, HACK, BUG, XXX and custom tags)
 * in the comments of source files across many languages.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a directory and list findings</li>
 *   <li>{@code cache} - Inspect or clear the fingerprint cache</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * todo-tracker scan
 *
 * # Scan with grammar verification and debug logging
 * todo-tracker -v scan --precise src
 *
 * # Drop cached results
 * todo-tracker cache clear
 * }</pre>
 */
@Command(
    name = "todo-tracker",
    mixinStandardHelpOptions = true,
    version = "todo-tracker 1.0.0-SNAPSHOT",
    description = "Finds TODO/FIXME/HACK/BUG/XXX markers in source code comments",
    subcommands = {
        ScanCommand.class,
        CacheCommand.class
    }
)
public class TodoTrackerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TodoTrackerCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("todo-tracker - technical debt marker scanner");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'todo-tracker --help' to see available commands");
        System.out.println("Use 'todo-tracker <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TodoTrackerCLI app = new TodoTrackerCLI();
        CommandLine commandLine = new CommandLine(app);
        commandLine.setExecutionStrategy(parseResult -> {
            app.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
