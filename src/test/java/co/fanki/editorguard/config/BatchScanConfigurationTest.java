package co.fanki.editorguard.config;

import co.fanki.editorguard.analysis.application.ProjectScanService;
import co.fanki.editorguard.analysis.application.ScanReport;
import co.fanki.editorguard.analysis.application.ScanReport.FailedFile;
import co.fanki.editorguard.analysis.domain.EditorUsageAnalyzer;
import co.fanki.editorguard.analysis.domain.EditorUsageRules;
import co.fanki.editorguard.analysis.domain.csharp.CSharpSourceParser;
import co.fanki.editorguard.config.BatchScanConfiguration.BatchScanRunner;
import co.fanki.editorguard.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the batch runner of {@link BatchScanConfiguration}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class BatchScanConfigurationTest {

    private final ProjectScanService service = new ProjectScanService(
            new CSharpSourceParser(),
            new EditorUsageAnalyzer(EditorUsageRules.defaults()),
            1);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private BatchScanRunner runner(final Path root, final String reportFile) {
        return new BatchScanRunner(service, objectMapper, root.toString(),
                reportFile, new PrintStream(output, true,
                        StandardCharsets.UTF_8));
    }

    @Test
    void whenRunning_givenRuntimeImport_shouldPrintDiagnosticAndFail(
            @TempDir final Path projectRoot) throws IOException {

        write(projectRoot, "Assets/Scripts/Player.cs",
                "using UnityEngine;\nusing UnityEditor;\n");

        final BatchScanRunner runner = runner(projectRoot, "");
        runner.run();

        final String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.startsWith(
                "Assets/Scripts/Player.cs(2,1): error UEA001: "), printed);
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void whenRunning_givenCleanProject_shouldSucceedSilently(
            @TempDir final Path projectRoot) throws IOException {

        write(projectRoot, "Assets/Scripts/Player.cs",
                "#if UNITY_EDITOR\nusing UnityEditor;\n#endif\n");
        write(projectRoot, "Assets/Editor/Tool.cs", "using UnityEditor;\n");

        final BatchScanRunner runner = runner(projectRoot, null);
        runner.run();

        assertEquals("", output.toString(StandardCharsets.UTF_8));
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void whenRunning_givenReportFile_shouldWriteJsonReport(
            @TempDir final Path projectRoot, @TempDir final Path outputDir)
            throws IOException {

        write(projectRoot, "Assets/Player.cs", "using UnityEditor;\n");
        final Path reportFile = outputDir.resolve("report.json");

        runner(projectRoot, reportFile.toString()).run();

        final JsonNode report = objectMapper.readTree(reportFile.toFile());
        assertEquals(1, report.path("filesScanned").asInt());
        assertEquals("UEA001", report.path("diagnostics").get(0)
                .path("ruleId").asText());
        assertEquals("Assets/Player.cs", report.path("diagnostics").get(0)
                .path("filePath").asText());
    }

    @Test
    void whenRunning_givenLegacyEncodedFile_shouldStillReportImport(
            @TempDir final Path projectRoot) throws IOException {

        final Path player = projectRoot.resolve("Assets/Scripts/Player.cs");
        Files.createDirectories(player.getParent());
        Files.write(player, "// Contr\u00f4leur\nusing UnityEditor;\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        final BatchScanRunner runner = runner(projectRoot, "");
        runner.run();

        assertTrue(output.toString(StandardCharsets.UTF_8).startsWith(
                "Assets/Scripts/Player.cs(2,1): error UEA001: "));
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void whenRunning_givenUnanalyzedFile_shouldFail() throws IOException {
        final ProjectScanService failing = mock(ProjectScanService.class);
        when(failing.scanProject("/game")).thenReturn(new ScanReport("/game",
                0, List.of(new FailedFile("Assets/Player.cs",
                        "AccessDeniedException: Assets/Player.cs")),
                List.of()));

        final BatchScanRunner runner = new BatchScanRunner(failing,
                objectMapper, "/game", "", new PrintStream(output, true,
                        StandardCharsets.UTF_8));
        runner.run();

        assertEquals("Assets/Player.cs: error: file not analyzed:"
                + " AccessDeniedException: Assets/Player.cs"
                + System.lineSeparator(),
                output.toString(StandardCharsets.UTF_8));
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void whenRunning_givenInvalidRoot_shouldPropagateError(
            @TempDir final Path projectRoot) {

        final BatchScanRunner runner = runner(projectRoot.resolve("missing"),
                "");

        assertThrows(DomainException.class, runner::run);
    }

    private static void write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

}
