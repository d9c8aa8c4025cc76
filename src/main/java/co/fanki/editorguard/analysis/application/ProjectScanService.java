package co.fanki.editorguard.analysis.application;

import co.fanki.editorguard.analysis.application.ScanReport.FailedFile;
import co.fanki.editorguard.analysis.domain.Diagnostic;
import co.fanki.editorguard.analysis.domain.EditorUsageAnalyzer;
import co.fanki.editorguard.analysis.domain.SourceFile;
import co.fanki.editorguard.analysis.domain.SourceParser;
import co.fanki.editorguard.analysis.domain.UsageSite;
import co.fanki.editorguard.shared.DomainException;
import co.fanki.editorguard.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Application service running the editor usage check over sources.
 *
 * <p>Single sources are analyzed on the calling thread. Whole projects
 * are analyzed file by file on a bounded worker pool created for each
 * scan; the analysis itself shares no state between files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectScanService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectScanService.class);

    private final SourceParser sourceParser;
    private final EditorUsageAnalyzer analyzer;
    private final int threads;

    /**
     * Creates a new ProjectScanService.
     *
     * @param theSourceParser the parser for source files
     * @param theAnalyzer the editor usage analyzer
     * @param theThreads the worker count, 0 for one per processor
     */
    public ProjectScanService(
            final SourceParser theSourceParser,
            final EditorUsageAnalyzer theAnalyzer,
            @Value("${editorguard.scan.threads:0}") final int theThreads) {
        Preconditions.requireNonNegative(theThreads,
                "Thread count must be >= 0");
        this.sourceParser = theSourceParser;
        this.analyzer = theAnalyzer;
        this.threads = theThreads == 0
                ? Runtime.getRuntime().availableProcessors()
                : theThreads;
    }

    /**
     * Checks a single in-memory source.
     *
     * @param path the file path, may be null
     * @param content the source text
     * @return the diagnostics in source order
     */
    public List<Diagnostic> checkSource(final String path,
            final String content) {
        Preconditions.requireNonNull(content, "Source content is required");
        return analyzer.analyze(sourceParser.parse(path, content));
    }

    /**
     * Explains the decision taken for each using directive of a source.
     *
     * @param path the file path, may be null
     * @param content the source text
     * @return the usage sites in source order
     */
    public List<UsageSite> explainSource(final String path,
            final String content) {
        Preconditions.requireNonNull(content, "Source content is required");
        return analyzer.inspect(sourceParser.parse(path, content));
    }

    /**
     * Scans every source file under a project root.
     *
     * @param projectRoot the project root directory
     * @return the scan report
     * @throws DomainException if the root is not a directory or the scan
     *         cannot complete
     */
    public ScanReport scanProject(final String projectRoot) {
        Preconditions.requireNonBlank(projectRoot, "Project root is required");

        final Path root = Path.of(projectRoot).toAbsolutePath().normalize();
        Preconditions.requireDomain(Files.isDirectory(root),
                "Project root is not a directory: " + projectRoot,
                "INVALID_PROJECT_ROOT");

        LOG.info("Scanning {} with {} ({})", root, sourceParser.language(),
                analyzer.rules().describe());

        final List<Path> files;
        try {
            files = sourceParser.discoverFiles(root);
        } catch (final IOException e) {
            throw new DomainException("Cannot list source files of "
                    + root + ": " + e.getMessage(), "SCAN_FAILED", e);
        }

        LOG.info("Discovered {} source files", files.size());

        final List<Diagnostic> diagnostics = new ArrayList<>();
        final List<FailedFile> failures = new ArrayList<>();
        int scanned = 0;

        for (final FileOutcome outcome : analyzeAll(root, files)) {
            if (outcome.error() != null) {
                failures.add(new FailedFile(outcome.path(), outcome.error()));
            } else {
                scanned++;
                diagnostics.addAll(outcome.diagnostics());
            }
        }

        diagnostics.sort(Comparator
                .comparing(Diagnostic::filePath,
                        Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingInt(d -> d.span().start()));

        LOG.info("Scan of {} finished: {} files, {} diagnostics, {} failures",
                root, scanned, diagnostics.size(), failures.size());

        return new ScanReport(root.toString(), scanned, failures,
                diagnostics);
    }

    /** The result of analyzing one file. */
    private record FileOutcome(String path, List<Diagnostic> diagnostics,
            String error) {
    }

    private List<FileOutcome> analyzeAll(final Path root,
            final List<Path> files) {

        if (files.isEmpty()) {
            return List.of();
        }

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(threads, files.size()));
        try {
            final List<Future<FileOutcome>> futures = new ArrayList<>(
                    files.size());
            for (final Path file : files) {
                futures.add(executor.submit(() -> analyzeFile(root, file)));
            }

            final List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), root, files.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome analyzeFile(final Path root, final Path file) {
        final String relative = relativePath(root, file);
        try {
            final SourceFile sourceFile = sourceParser.parseFile(root, file);
            return new FileOutcome(relative, analyzer.analyze(sourceFile),
                    null);
        } catch (final IOException e) {
            LOG.warn("Cannot read {}: {}", relative, e.getMessage());
            return new FileOutcome(relative, List.of(),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private FileOutcome await(final Future<FileOutcome> future,
            final Path root, final Path file) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Scan of " + root + " interrupted",
                    "SCAN_FAILED", e);
        } catch (final ExecutionException e) {
            final String relative = relativePath(root, file);
            LOG.error("Analysis of {} failed", relative, e.getCause());
            return new FileOutcome(relative, List.of(),
                    String.valueOf(e.getCause()));
        }
    }

    private static String relativePath(final Path root, final Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

}
