package co.fanki.editorguard.config;

import co.fanki.editorguard.analysis.domain.EditorUsageAnalyzer;
import co.fanki.editorguard.analysis.domain.EditorUsageRules;
import co.fanki.editorguard.analysis.domain.SourceParser;
import co.fanki.editorguard.analysis.domain.csharp.CSharpSourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Wires the editor usage check from the {@code editorguard.*} properties.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisConfiguration.class);

    /**
     * Builds the rules of the check.
     *
     * @param namespace the editor-only namespace
     * @param directorySegment the editor directory name
     * @param compilationSymbol the editor compilation symbol
     * @param targetFolders comma separated target folders, may be empty
     * @return the rules
     */
    @Bean
    EditorUsageRules editorUsageRules(
            @Value("${editorguard.editor-only-namespace:"
                    + EditorUsageRules.DEFAULT_NAMESPACE + "}")
            final String namespace,
            @Value("${editorguard.editor-directory-segment:"
                    + EditorUsageRules.DEFAULT_DIRECTORY_SEGMENT + "}")
            final String directorySegment,
            @Value("${editorguard.editor-compilation-symbol:"
                    + EditorUsageRules.DEFAULT_COMPILATION_SYMBOL + "}")
            final String compilationSymbol,
            @Value("${editorguard.target-folders:}")
            final String targetFolders) {

        final EditorUsageRules rules = new EditorUsageRules(namespace,
                directorySegment, compilationSymbol,
                splitFolders(targetFolders));
        LOG.info("Editor usage rules: {}", rules.describe());
        return rules;
    }

    /**
     * Creates the analyzer applying the configured rules.
     *
     * @param rules the rules
     * @return the analyzer
     */
    @Bean
    EditorUsageAnalyzer editorUsageAnalyzer(final EditorUsageRules rules) {
        return new EditorUsageAnalyzer(rules);
    }

    /**
     * Creates the parser for C# sources.
     *
     * @return the parser
     */
    @Bean
    SourceParser sourceParser() {
        return new CSharpSourceParser();
    }

    static List<String> splitFolders(final String folders) {
        if (folders == null || folders.isBlank()) {
            return List.of();
        }
        return Arrays.stream(folders.split(","))
                .map(String::trim)
                .filter(folder -> !folder.isEmpty())
                .toList();
    }

}
