package co.fanki.editorguard.analysis.application;

import co.fanki.editorguard.analysis.domain.Diagnostic;
import co.fanki.editorguard.analysis.domain.EditorUsageAnalyzer;
import co.fanki.editorguard.analysis.domain.EditorUsageRules;
import co.fanki.editorguard.analysis.domain.UsageSite;
import co.fanki.editorguard.analysis.domain.UsageVerdict;
import co.fanki.editorguard.analysis.domain.csharp.CSharpSourceParser;
import co.fanki.editorguard.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ProjectScanService}.
 *
 * <p>Runs the real C# parser and analyzer over small Unity-like project
 * trees created in temporary directories.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectScanServiceTest {

    private static final String EDITOR_IMPORT =
            "using UnityEditor;\npublic class X {}\n";

    private final ProjectScanService service = new ProjectScanService(
            new CSharpSourceParser(),
            new EditorUsageAnalyzer(EditorUsageRules.defaults()),
            2);

    // -- scanProject --

    @Test
    void whenScanningProject_givenMixedSources_shouldReportRuntimeImports(
            @TempDir final Path projectRoot) throws IOException {

        write(projectRoot, "Assets/Scripts/Player.cs", EDITOR_IMPORT);
        write(projectRoot, "Assets/Scripts/Editor/PlayerInspector.cs",
                EDITOR_IMPORT);
        write(projectRoot, "Assets/Scripts/Guarded.cs",
                "#if UNITY_EDITOR\nusing UnityEditor;\n#endif\n");
        write(projectRoot, "Assets/Zone.cs",
                "using UnityEngine;\nusing UnityEditor.SceneManagement;\n");
        write(projectRoot, "Library/PackageCache/Cached.cs", EDITOR_IMPORT);

        final ScanReport report = service.scanProject(projectRoot.toString());

        assertEquals(projectRoot.toAbsolutePath().normalize().toString(),
                report.projectRoot());
        assertEquals(4, report.filesScanned());
        assertTrue(report.failedFiles().isEmpty());
        assertTrue(report.hasDiagnostics());
        assertEquals(List.of("Assets/Scripts/Player.cs", "Assets/Zone.cs"),
                report.diagnostics().stream()
                        .map(Diagnostic::filePath).toList());
        assertEquals(2, report.diagnostics().get(1).line());
    }

    @Test
    void whenScanningProject_givenNoSources_shouldReturnEmptyReport(
            @TempDir final Path projectRoot) {

        final ScanReport report = service.scanProject(projectRoot.toString());

        assertEquals(0, report.filesScanned());
        assertFalse(report.hasDiagnostics());
    }

    @Test
    void whenScanningProject_givenLegacyEncodedComment_shouldStillReport(
            @TempDir final Path projectRoot) throws IOException {

        final Path player = projectRoot.resolve("Assets/Scripts/Player.cs");
        Files.createDirectories(player.getParent());
        Files.write(player, "// Contr\u00f4leur du joueur\nusing UnityEditor;\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        final ScanReport report = service.scanProject(projectRoot.toString());

        assertEquals(1, report.filesScanned());
        assertTrue(report.failedFiles().isEmpty());
        assertEquals(1, report.diagnostics().size());
        assertEquals(2, report.diagnostics().get(0).line());
    }

    @Test
    void whenScanningProject_givenMalformedBytesBeforeImport_shouldStillReport(
            @TempDir final Path projectRoot) throws IOException {

        final Path broken = projectRoot.resolve("Assets/Broken.cs");
        Files.createDirectories(broken.getParent());
        final byte[] code = "using UnityEditor;\n".getBytes(
                StandardCharsets.US_ASCII);
        final byte[] content = new byte[code.length + 3];
        content[0] = (byte) 0xC3;
        content[1] = (byte) 0x28;
        content[2] = '\n';
        System.arraycopy(code, 0, content, 3, code.length);
        Files.write(broken, content);

        final ScanReport report = service.scanProject(projectRoot.toString());

        assertTrue(report.failedFiles().isEmpty());
        assertEquals(List.of("Assets/Broken.cs"), report.diagnostics().stream()
                .map(Diagnostic::filePath).toList());
    }

    @Test
    void whenScanningProject_givenRegularFile_shouldRejectRoot(
            @TempDir final Path projectRoot) throws IOException {

        final Path file = write(projectRoot, "Player.cs", EDITOR_IMPORT);

        final DomainException e = assertThrows(DomainException.class,
                () -> service.scanProject(file.toString()));

        assertEquals("INVALID_PROJECT_ROOT", e.getErrorCode());
    }

    @Test
    void whenScanningProject_givenMissingRoot_shouldRejectRoot(
            @TempDir final Path projectRoot) {

        final DomainException e = assertThrows(DomainException.class,
                () -> service.scanProject(
                        projectRoot.resolve("missing").toString()));

        assertEquals("INVALID_PROJECT_ROOT", e.getErrorCode());
    }

    @Test
    void whenScanningProject_givenBlankRoot_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> service.scanProject(" "));
    }

    // -- single sources --

    @Test
    void whenCheckingSource_givenEditorPath_shouldNotReport() {
        assertTrue(service.checkSource("Assets/Editor/Tool.cs",
                EDITOR_IMPORT).isEmpty());
        assertEquals(1, service.checkSource("Assets/Tool.cs",
                EDITOR_IMPORT).size());
    }

    @Test
    void whenCheckingSource_givenTextInDisabledBranch_shouldReportFollowingImport() {
        assertEquals(1, service.checkSource("Assets/Scripts/Foo.cs",
                "#if NEVER\n don't \n#endif\nusing UnityEditor;").size());
    }

    @Test
    void whenCheckingSource_givenNoContent_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> service.checkSource("Assets/Tool.cs", null));
    }

    @Test
    void whenExplainingSource_givenGuardedImport_shouldReturnVerdicts() {
        final List<UsageSite> sites = service.explainSource("Assets/Tool.cs",
                "using System;\n#if UNITY_EDITOR\nusing UnityEditor;\n#endif\n");

        assertEquals(List.of(UsageVerdict.IGNORED_NAMESPACE,
                UsageVerdict.GUARDED), sites.stream()
                        .map(UsageSite::verdict).toList());
    }

    @Test
    void whenCreating_givenNegativeThreads_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProjectScanService(new CSharpSourceParser(),
                        new EditorUsageAnalyzer(EditorUsageRules.defaults()),
                        -1));
    }

    private static Path write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

}
