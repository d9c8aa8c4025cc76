package co.fanki.editorguard.analysis.application;

import co.fanki.editorguard.analysis.domain.Diagnostic;

import java.util.List;

/**
 * The outcome of scanning every source file of a project.
 *
 * @param projectRoot the scanned root directory
 * @param filesScanned the number of files analyzed successfully
 * @param failedFiles the files that could not be read
 * @param diagnostics the diagnostics, ordered by file path and offset
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScanReport(
        String projectRoot,
        int filesScanned,
        List<FailedFile> failedFiles,
        List<Diagnostic> diagnostics
) {

    /**
     * Copies the lists so the report stays immutable.
     *
     * @param projectRoot the scanned root
     * @param filesScanned the number of analyzed files
     * @param failedFiles the unreadable files
     * @param diagnostics the diagnostics
     */
    public ScanReport {
        failedFiles = List.copyOf(failedFiles);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Checks whether the scan found forbidden imports.
     *
     * @return true if at least one diagnostic was reported
     */
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * A file that could not be analyzed.
     *
     * @param path the file path, relative to the project root
     * @param error the failure description
     */
    public record FailedFile(String path, String error) {
    }

}
