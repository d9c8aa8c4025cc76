package co.fanki.editorguard.config;

import co.fanki.editorguard.analysis.domain.EditorUsageRules;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisConfiguration}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisConfigurationTest {

    private final AnalysisConfiguration configuration =
            new AnalysisConfiguration();

    @Test
    void whenSplittingFolders_givenCommaSeparatedList_shouldTrimEntries() {
        assertEquals(List.of("Assets/Scripts", "Packages/Game"),
                AnalysisConfiguration.splitFolders(
                        " Assets/Scripts ,, Packages/Game,"));
    }

    @Test
    void whenSplittingFolders_givenEmptyValue_shouldReturnEmptyList() {
        assertTrue(AnalysisConfiguration.splitFolders("").isEmpty());
        assertTrue(AnalysisConfiguration.splitFolders(null).isEmpty());
    }

    @Test
    void whenBuildingRules_givenProperties_shouldUseThem() {
        final EditorUsageRules rules = configuration.editorUsageRules(
                "UnityEditor", "Editor", "UNITY_EDITOR", "Assets/Scripts/");

        assertEquals(List.of("Assets/Scripts"), rules.targetFolders());
        assertTrue(configuration.editorUsageAnalyzer(rules).rules()
                .isInTargetScope("Assets/Scripts/Player.cs"));
    }

    @Test
    void whenCreatingParser_shouldHandleCSharp() {
        assertEquals("csharp", configuration.sourceParser().language());
    }

}
