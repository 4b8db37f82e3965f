package com.todotracker.cli;

import com.todotracker.core.cache.CacheException;
import com.todotracker.core.cache.FingerprintCache;
import com.todotracker.core.cache.SqliteFingerprintCache;
import com.todotracker.core.config.ConfigLoader;
import com.todotracker.core.config.TrackerConfig;
import com.todotracker.core.io.LargeFileReader;
import com.todotracker.core.model.FileScanError;
import com.todotracker.core.model.Finding;
import com.todotracker.core.scanner.FindingExtractor;
import com.todotracker.core.scanner.ScanOrchestrator;
import com.todotracker.core.scanner.ScanReport;
import com.todotracker.core.scanner.ScanStatistics;
import com.todotracker.core.scanner.base.TagVocabulary;
import com.todotracker.core.scanner.impl.AstCommentVerifier;
import com.todotracker.core.scanner.impl.CommentExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Command to scan a directory for debt markers.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code .todo-tracker.yaml} (explicit, or nearest to the scanned directory)</li>
 *   <li>Discover files under the directory</li>
 *   <li>Scan them through the fingerprint cache with the baseline or precise strategy</li>
 *   <li>Print one line per finding and a summary</li>
 * </ol>
 *
 * <p>Findings are printed as {@code path:line:column TAG message}, with the path relative to
 * the scanned directory and a 1-based column.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * todo-tracker scan
 *
 * # Scan with AST verification, 4 workers, an extra tag
 * todo-tracker scan --precise -w 4 -t NOTE src
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a directory for TODO/FIXME/HACK/BUG/XXX markers",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Directory to scan (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: nearest .todo-tracker.yaml)"
    )
    private Path configPath;

    @Option(
        names = {"--precise"},
        description = "Verify candidates with language grammars to drop markers inside string literals"
    )
    private boolean precise;

    @Option(
        names = {"--no-cache"},
        description = "Do not read or write the fingerprint cache"
    )
    private boolean noCache;

    @Option(
        names = {"-w", "--workers"},
        description = "Number of scan workers (overrides config)"
    )
    private Integer workers;

    @Option(
        names = {"-t", "--tag"},
        description = "Additional tag to look for (repeatable)"
    )
    private List<String> extraTags = new ArrayList<>();

    @Option(
        names = {"--summary-only"},
        description = "Print only the summary, not individual findings"
    )
    private boolean summaryOnly;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Path root = projectPath.toAbsolutePath().normalize();
        try {
            log.info("Starting scan of: {}", root);

            TrackerConfig config = loadConfiguration(root);
            TrackerConfig.ScanSettings settings = config.scan();

            TagVocabulary vocabulary = settings.vocabulary();
            if (!extraTags.isEmpty()) {
                vocabulary = vocabulary.withTags(extraTags);
            }
            CommentExtractor baseline = new CommentExtractor(vocabulary);
            boolean verify = precise || settings.precise();
            FindingExtractor strategy = verify ? new AstCommentVerifier(baseline) : baseline;

            DirectoryDiscovery discovery = new DirectoryDiscovery(root, settings.maxFileSize(), config.exclude());
            List<Path> files = discovery.discover();
            out.println("✓ Discovered " + files.size() + " files");

            ScanReport report;
            try (FingerprintCache cache = openCache(root, config, strategy, vocabulary)) {
                ScanOrchestrator orchestrator = ScanOrchestrator.builder()
                    .workers(workers != null ? workers : settings.workers())
                    .reader(new LargeFileReader(settings.largeFileThreshold()))
                    .cache(cache)
                    .build();
                report = orchestrator.scan(files, strategy);
            }

            if (strategy instanceof AstCommentVerifier verifier) {
                verifier.logSummary();
            }
            printReport(out, err, root, report);
            return 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads configuration from the explicit file, or the nearest one to the scanned root.
     */
    private TrackerConfig loadConfiguration(Path root) {
        if (configPath == null) {
            return ConfigLoader.loadNearest(root);
        }
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    /**
     * Opens the cache for this scan profile, or returns null when caching is off or unavailable.
     */
    private FingerprintCache openCache(Path root, TrackerConfig config, FindingExtractor strategy,
                                       TagVocabulary vocabulary) {
        if (noCache || !config.cache().enabled()) {
            log.debug("Fingerprint cache disabled");
            return null;
        }
        Path databaseFile = root.resolve(config.cache().directory()).resolve(SqliteFingerprintCache.DATABASE_FILE);
        String profile = strategy.getId() + "|" + vocabulary;
        try {
            return SqliteFingerprintCache.open(databaseFile, profile);
        } catch (CacheException e) {
            log.warn("Cannot open cache {}, scanning without it: {}", databaseFile, e.getMessage());
            return null;
        }
    }

    private void printReport(PrintWriter out, PrintWriter err, Path root, ScanReport report) {
        if (!summaryOnly) {
            for (Finding finding : report.findings()) {
                out.println(formatFinding(root, finding));
            }
            if (!report.findings().isEmpty()) {
                out.println();
            }
        }

        ScanStatistics stats = report.statistics();
        out.println("✓ Scanned " + stats.filesScanned() + " files ("
            + stats.filesFromCache() + " from cache, " + stats.filesSkipped() + " skipped) in "
            + stats.elapsed().toMillis() + "ms");
        out.println("✓ Found " + stats.totalFindings() + " markers in " + stats.filesWithFindings() + " files");
        Map<String, Integer> byTag = new TreeMap<>(stats.findingsByTag());
        byTag.forEach((tag, count) -> out.println("  - " + tag + ": " + count));

        if (report.hasErrors()) {
            err.println("✗ " + report.errors().size() + " files could not be scanned:");
            for (FileScanError error : report.errors()) {
                err.println("  " + relativize(root, error.file()) + ": [" + error.kind() + "] " + error.message());
            }
        }
        if (report.cancelled()) {
            err.println("✗ Scan was cancelled before all files were visited");
        }
        out.flush();
        err.flush();
    }

    static String formatFinding(Path root, Finding finding) {
        return relativize(root, finding.file()) + ":" + finding.line() + ":" + (finding.column() + 1)
            + " " + finding.tag() + " " + finding.message();
    }

    private static String relativize(Path root, String file) {
        Path path = Path.of(file).toAbsolutePath().normalize();
        if (!path.startsWith(root)) {
            return file;
        }
        return root.relativize(path).toString().replace('\\', '/');
    }
}
