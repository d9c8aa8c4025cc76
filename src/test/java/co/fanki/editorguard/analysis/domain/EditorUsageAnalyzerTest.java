package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.analysis.domain.csharp.CSharpSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link EditorUsageAnalyzer}.
 *
 * <p>Sources are parsed with the C# parser so directives and using
 * positions come from real text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EditorUsageAnalyzerTest {

    private static final String RUNTIME_PATH = "Assets/Scripts/Foo.cs";

    private final CSharpSourceParser parser = new CSharpSourceParser();

    private final EditorUsageAnalyzer analyzer =
            new EditorUsageAnalyzer(EditorUsageRules.defaults());

    private List<Diagnostic> analyze(final String path, final String text) {
        return analyzer.analyze(parser.parse(path, text));
    }

    // -- reporting --

    @Test
    void whenAnalyzing_givenUnguardedImportInRuntimeFile_shouldReport() {
        final List<Diagnostic> diagnostics = analyze(RUNTIME_PATH,
                "using UnityEditor;\npublic class Foo {}\n");

        assertEquals(1, diagnostics.size());
        final Diagnostic diagnostic = diagnostics.get(0);
        assertEquals("UEA001", diagnostic.ruleId());
        assertEquals(DiagnosticSeverity.ERROR, diagnostic.severity());
        assertEquals(RUNTIME_PATH, diagnostic.filePath());
        assertEquals(new TextSpan(0, 18), diagnostic.span());
        assertEquals(1, diagnostic.line());
        assertEquals(1, diagnostic.column());
        assertEquals("Namespace 'UnityEditor' must not be used in runtime"
                + " code. Move this code under an 'Editor' directory or"
                + " wrap it in '#if UNITY_EDITOR'.", diagnostic.message());
    }

    @Test
    void whenAnalyzing_givenImportOnSecondLine_shouldLocateIt() {
        final List<Diagnostic> diagnostics = analyze(RUNTIME_PATH,
                "using UnityEngine;\n    using UnityEditor.SceneManagement;\n");

        assertEquals(1, diagnostics.size());
        assertEquals(2, diagnostics.get(0).line());
        assertEquals(5, diagnostics.get(0).column());
        assertEquals(RUNTIME_PATH + "(2,5): error UEA001: Namespace"
                + " 'UnityEditor.SceneManagement' must not be used in"
                + " runtime code. Move this code under an 'Editor'"
                + " directory or wrap it in '#if UNITY_EDITOR'.",
                diagnostics.get(0).toCompilerFormat());
    }

    @Test
    void whenAnalyzing_givenNonMatchingCondition_shouldReport() {
        assertEquals(1, analyze(RUNTIME_PATH,
                "#if DEBUG\nusing UnityEditor;\n#endif\n").size());
    }

    @Test
    void whenAnalyzing_givenImportAfterClosedBlock_shouldReport() {
        assertEquals(1, analyze(RUNTIME_PATH,
                "#if UNITY_EDITOR\nusing UnityEngine;\n#endif\n"
                        + "using UnityEditor;\n").size());
    }

    @Test
    void whenAnalyzing_givenImportInElseBranch_shouldReport() {
        assertEquals(1, analyze(RUNTIME_PATH,
                "#if UNITY_EDITOR\nusing UnityEngine;\n#else\n"
                        + "using UnityEditor;\n#endif\n").size());
    }

    @Test
    void whenAnalyzing_givenStrayEndif_shouldStillReport() {
        assertEquals(1, analyze(RUNTIME_PATH,
                "#endif\nusing UnityEditor;\n").size());
    }

    @Test
    void whenAnalyzing_givenEveryDirectiveForm_shouldReportEachOne() {
        final List<Diagnostic> diagnostics = analyze(RUNTIME_PATH, """
                global using UnityEditor;
                using static UnityEditor.EditorGUILayout;
                using Menu = UnityEditor.Menu;
                using global::UnityEditor.Callbacks;
                """);

        assertEquals(4, diagnostics.size());
        assertEquals(List.of(1, 2, 3, 4), diagnostics.stream()
                .map(Diagnostic::line).toList());
    }

    @Test
    void whenAnalyzing_givenInMemorySource_shouldReportWithoutPath() {
        final List<Diagnostic> diagnostics = analyze(null,
                "using UnityEditor;");

        assertEquals(1, diagnostics.size());
        assertNull(diagnostics.get(0).filePath());
        assertTrue(diagnostics.get(0).toCompilerFormat()
                .startsWith("<memory>(1,1): error UEA001: "));
    }

    // -- allowed usages --

    @Test
    void whenAnalyzing_givenImportInEditorDirectory_shouldNotReport() {
        assertTrue(analyze("Assets/Scripts/Editor/Foo.cs",
                "using UnityEditor;\npublic class Foo {}\n").isEmpty());
    }

    @Test
    void whenAnalyzing_givenImportGuardedByEditorSymbol_shouldNotReport() {
        assertTrue(analyze(RUNTIME_PATH,
                "#if UNITY_EDITOR\nusing UnityEditor;\n#endif\n").isEmpty());
    }

    @Test
    void whenAnalyzing_givenOuterEditorGuard_shouldNotReport() {
        assertTrue(analyze(RUNTIME_PATH, """
                #if UNITY_EDITOR
                #if DEBUG
                using UnityEditor;
                #endif
                #endif
                """).isEmpty());
    }

    @Test
    void whenAnalyzing_givenEditorSymbolInElif_shouldNotReport() {
        assertTrue(analyze(RUNTIME_PATH, """
                #if DEVELOPMENT_BUILD
                using UnityEngine;
                #elif UNITY_EDITOR
                using UnityEditor;
                #endif
                """).isEmpty());
    }

    @Test
    void whenAnalyzing_givenUnrelatedNamespaces_shouldNotReport() {
        assertTrue(analyze(RUNTIME_PATH, """
                using System;
                using UnityEngine;
                using UnityEditorExtensions;
                """).isEmpty());
    }

    // -- explanations --

    @Test
    void whenInspecting_givenMixedFile_shouldExplainEveryDirective() {
        final SourceFile file = parser.parse(RUNTIME_PATH, """
                using UnityEngine;
                #if UNITY_EDITOR && !UNITY_WEBGL
                using UnityEditor;
                #endif
                using UnityEditor.Build;
                """);

        final List<UsageSite> sites = analyzer.inspect(file);

        assertEquals(List.of(UsageVerdict.IGNORED_NAMESPACE,
                UsageVerdict.GUARDED, UsageVerdict.REPORTED),
                sites.stream().map(UsageSite::verdict).toList());
        assertEquals("UNITY_EDITOR && !UNITY_WEBGL",
                sites.get(1).scanResult().matchedCondition());
        assertFalse(sites.get(2).scanResult().guarded());
        assertNull(sites.get(0).scanResult());
    }

    @Test
    void whenInspecting_givenEditorDirectory_shouldExplainPathExclusion() {
        final SourceFile file = parser.parse("Assets/Editor/Tool.cs",
                "using UnityEditor;");

        assertEquals(UsageVerdict.EXCLUDED_BY_PATH,
                analyzer.inspect(file).get(0).verdict());
    }

    @Test
    void whenInspecting_givenFileOutsideTargetFolders_shouldSkipIt() {
        final EditorUsageAnalyzer scoped = new EditorUsageAnalyzer(
                EditorUsageRules.defaults().withTargetFolders(
                        List.of("Assets/Scripts")));

        final SourceFile outside = parser.parse("Assets/Plugins/Foo.cs",
                "using UnityEditor;");
        final SourceFile inside = parser.parse(RUNTIME_PATH,
                "using UnityEditor;");

        assertEquals(UsageVerdict.OUT_OF_SCOPE,
                scoped.inspect(outside).get(0).verdict());
        assertTrue(scoped.analyze(outside).isEmpty());
        assertEquals(1, scoped.analyze(inside).size());
    }

    @Test
    void whenAnalyzing_givenCustomRules_shouldUseConfiguredNames() {
        final EditorUsageAnalyzer custom = new EditorUsageAnalyzer(
                new EditorUsageRules("Tools.Authoring", "Authoring",
                        "AUTHORING", List.of()));

        final List<Diagnostic> diagnostics = custom.analyze(parser.parse(
                RUNTIME_PATH, """
                        using UnityEditor;
                        #if AUTHORING
                        using Tools.Authoring;
                        #endif
                        using Tools.Authoring.Gizmos;
                        """));

        assertEquals(1, diagnostics.size());
        assertEquals(5, diagnostics.get(0).line());
        assertTrue(diagnostics.get(0).message().contains("'#if AUTHORING'"));
    }

    // -- resolve --

    @Test
    void whenResolving_givenPositionInsideGuard_shouldReturnCondition() {
        final SourceFile file = parser.parse(RUNTIME_PATH,
                "#if UNITY_EDITOR\nclass A {}\n#endif\n");

        assertEquals(ScanResult.guardedBy("UNITY_EDITOR"),
                analyzer.resolve(file, 17));
        assertEquals(ScanResult.notGuarded(), analyzer.resolve(file, 0));
    }

    @Test
    void whenCreating_givenNoRules_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new EditorUsageAnalyzer(null));
    }

}
