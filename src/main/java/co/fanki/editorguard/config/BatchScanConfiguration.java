package co.fanki.editorguard.config;

import co.fanki.editorguard.analysis.application.ProjectScanService;
import co.fanki.editorguard.analysis.application.ScanReport;
import co.fanki.editorguard.analysis.domain.Diagnostic;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs one project scan at startup, for build pipelines.
 *
 * <p>Enabled by setting {@code editorguard.batch.project-root}. Each
 * diagnostic is printed in compiler format and, when
 * {@code editorguard.batch.report-file} is set, the full report is
 * written there as JSON. The application exits with status 1 when a
 * diagnostic was found or when a file could not be analyzed, since an
 * unanalyzed file may hide a forbidden import.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "editorguard.batch.project-root")
public class BatchScanConfiguration {

    /**
     * Creates the batch runner.
     *
     * @param projectScanService the scan service
     * @param objectMapper the mapper used for the JSON report
     * @param projectRoot the project to scan
     * @param reportFile the JSON report destination, may be empty
     * @return the runner
     */
    @Bean
    BatchScanRunner batchScanRunner(
            final ProjectScanService projectScanService,
            final ObjectMapper objectMapper,
            @Value("${editorguard.batch.project-root}") final String projectRoot,
            @Value("${editorguard.batch.report-file:}") final String reportFile) {
        return new BatchScanRunner(projectScanService, objectMapper,
                projectRoot, reportFile, System.out);
    }

    /**
     * Scans the configured project and remembers the exit status.
     */
    public static class BatchScanRunner
            implements CommandLineRunner, ExitCodeGenerator {

        private static final Logger LOG = LoggerFactory.getLogger(
                BatchScanRunner.class);

        private final ProjectScanService projectScanService;
        private final ObjectMapper objectMapper;
        private final String projectRoot;
        private final String reportFile;
        private final PrintStream out;

        private int exitCode;

        /**
         * Creates a new BatchScanRunner.
         *
         * @param theProjectScanService the scan service
         * @param theObjectMapper the mapper used for the JSON report
         * @param theProjectRoot the project to scan
         * @param theReportFile the JSON report destination, may be empty
         * @param theOut where diagnostics are printed
         */
        public BatchScanRunner(final ProjectScanService theProjectScanService,
                final ObjectMapper theObjectMapper,
                final String theProjectRoot, final String theReportFile,
                final PrintStream theOut) {
            this.projectScanService = theProjectScanService;
            this.objectMapper = theObjectMapper;
            this.projectRoot = theProjectRoot;
            this.reportFile = theReportFile;
            this.out = theOut;
        }

        @Override
        public void run(final String... args) throws IOException {
            final ScanReport report = projectScanService.scanProject(
                    projectRoot);

            for (final Diagnostic diagnostic : report.diagnostics()) {
                out.println(diagnostic.toCompilerFormat());
            }
            for (final ScanReport.FailedFile failed : report.failedFiles()) {
                LOG.warn("Skipped {}: {}", failed.path(), failed.error());
                out.println(failed.path() + ": error: file not analyzed: "
                        + failed.error());
            }

            if (reportFile != null && !reportFile.isBlank()) {
                final Path target = Path.of(reportFile);
                Files.writeString(target, objectMapper
                        .writerWithDefaultPrettyPrinter()
                        .writeValueAsString(report));
                LOG.info("Report written to {}", target.toAbsolutePath());
            }

            exitCode = report.hasDiagnostics()
                    || !report.failedFiles().isEmpty() ? 1 : 0;
        }

        @Override
        public int getExitCode() {
            return exitCode;
        }

    }

}
