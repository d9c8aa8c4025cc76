package co.fanki.editorguard.analysis.application;

import co.fanki.editorguard.analysis.domain.Diagnostic;
import co.fanki.editorguard.analysis.domain.UsageSite;
import co.fanki.editorguard.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the editor usage check.
 *
 * <p>Provides the same operations as the {@code check_source},
 * {@code explain_source} and {@code scan_project} MCP tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/scan")
@Tag(name = "Editor Usage", description = "Find editor-only namespaces imported into runtime code")
public class ScanController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScanController.class);

    private final ProjectScanService projectScanService;

    /**
     * Creates a new ScanController.
     *
     * @param theProjectScanService the scan service
     */
    public ScanController(final ProjectScanService theProjectScanService) {
        this.projectScanService = theProjectScanService;
    }

    /**
     * Checks a single source file sent in the request body.
     *
     * @param request the source to check
     * @return the diagnostics found
     */
    @Operation(
            summary = "Check a source file",
            description = "Reports every editor-only using directive of the source that is neither "
                    + "under an editor directory nor guarded by the editor compilation symbol."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Check completed",
                    content = @Content(schema = @Schema(implementation = SourceCheckResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    @PostMapping("/source")
    public ResponseEntity<SourceCheckResponse> checkSource(
            @RequestBody final SourceRequest request) {

        LOG.debug("Checking source {}", request.path());

        try {
            final List<Diagnostic> diagnostics = projectScanService
                    .checkSource(request.path(), request.content());
            return ResponseEntity.ok(new SourceCheckResponse(
                    request.path(), diagnostics, null));
        } catch (final IllegalArgumentException | DomainException e) {
            return ResponseEntity.badRequest()
                    .body(new SourceCheckResponse(request.path(), List.of(),
                            e.getMessage()));
        }
    }

    /**
     * Explains the decision taken for each using directive of a source.
     *
     * @param request the source to explain
     * @return every using directive with its verdict
     */
    @Operation(
            summary = "Explain a source file",
            description = "Lists every using directive of the source with the verdict of the check "
                    + "and, for guarded ones, the condition that guards it."
    )
    @PostMapping("/source/explain")
    public ResponseEntity<ExplainResponse> explainSource(
            @RequestBody final SourceRequest request) {

        try {
            final List<UsageSite> sites = projectScanService
                    .explainSource(request.path(), request.content());
            return ResponseEntity.ok(new ExplainResponse(
                    request.path(), sites, null));
        } catch (final IllegalArgumentException | DomainException e) {
            return ResponseEntity.badRequest()
                    .body(new ExplainResponse(request.path(), List.of(),
                            e.getMessage()));
        }
    }

    /**
     * Scans every source file of a project on the server's filesystem.
     *
     * @param request the project to scan
     * @return the scan report
     */
    @Operation(
            summary = "Scan a project",
            description = "Walks the project directory, skipping build output folders, and checks "
                    + "every C# source file."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scan completed",
                    content = @Content(schema = @Schema(implementation = ProjectScanResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid project root"),
            @ApiResponse(responseCode = "500", description = "Scan failed")
    })
    @PostMapping("/project")
    public ResponseEntity<ProjectScanResponse> scanProject(
            @RequestBody final ProjectScanRequest request) {

        LOG.info("Received scan request for: {}", request.projectRoot());

        try {
            final ScanReport report = projectScanService.scanProject(
                    request.projectRoot());
            return ResponseEntity.ok(new ProjectScanResponse(
                    true, report, null));

        } catch (final IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(new ProjectScanResponse(false, null, e.getMessage()));
        } catch (final DomainException e) {
            LOG.error("Scan failed: {}", e.getMessage());
            if ("INVALID_PROJECT_ROOT".equals(e.getErrorCode())) {
                return ResponseEntity.badRequest()
                        .body(new ProjectScanResponse(false, null,
                                e.getMessage()));
            }
            return ResponseEntity.internalServerError()
                    .body(new ProjectScanResponse(false, null, e.getMessage()));
        } catch (final Exception e) {
            LOG.error("Unexpected error during scan", e);
            return ResponseEntity.internalServerError()
                    .body(new ProjectScanResponse(false, null,
                            "Internal error: " + e.getMessage()));
        }
    }

    /**
     * Request carrying a single source file.
     *
     * @param path the file path used for the editor directory check
     * @param content the source text
     */
    public record SourceRequest(
            String path,
            String content
    ) {}

    /**
     * Response with the diagnostics of a single source file.
     */
    public record SourceCheckResponse(
            String path,
            List<Diagnostic> diagnostics,
            String error
    ) {}

    /**
     * Response listing the usage sites of a single source file.
     */
    public record ExplainResponse(
            String path,
            List<UsageSite> usages,
            String error
    ) {}

    /**
     * Request to scan a project directory.
     *
     * @param projectRoot the project root directory
     */
    public record ProjectScanRequest(
            String projectRoot
    ) {}

    /**
     * Response of a project scan.
     */
    public record ProjectScanResponse(
            boolean success,
            ScanReport report,
            String error
    ) {}

}
