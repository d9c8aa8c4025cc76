package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reports editor-only namespaces imported into runtime code.
 *
 * <p>A {@code using} directive naming the editor-only namespace, or one of
 * its sub-namespaces, is allowed when its file lives in an editor
 * directory, or when a conditional-compilation block enclosing it
 * mentions the editor compilation symbol. Every other such directive is
 * reported with {@link DiagnosticDescriptor#EDITOR_USAGE_IN_RUNTIME_CODE}.</p>
 *
 * <p>The analyzer holds no mutable state. Each check re-derives the
 * directive context from the immutable {@link SourceFile}, so files and
 * directives can be analyzed concurrently.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EditorUsageAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            EditorUsageAnalyzer.class);

    private final EditorUsageRules rules;

    /**
     * Creates a new analyzer.
     *
     * @param theRules the names the check is built around
     */
    public EditorUsageAnalyzer(final EditorUsageRules theRules) {
        rules = Preconditions.requireNonNull(theRules, "Rules are required");
    }

    /**
     * Returns the rules this analyzer applies.
     *
     * @return the rules
     */
    public EditorUsageRules rules() {
        return rules;
    }

    /**
     * Resolves whether a position is guarded by an editor-only condition.
     *
     * @param sourceFile the parsed file
     * @param position the offset to check
     * @return the verdict with the matching condition, if any
     */
    public ScanResult resolve(final SourceFile sourceFile, final int position) {
        Preconditions.requireNonNull(sourceFile, "Source file is required");

        final Iterator<DirectiveEvent> events =
                DirectiveTriviaExtractor.extract(sourceFile).iterator();
        final ConditionStack stack =
                ConditionStackSimulator.simulate(events, position);
        return ActiveConditionClassifier.classify(stack,
                rules.editorCompilationSymbol());
    }

    /**
     * Decides about a single using directive of a file.
     *
     * @param sourceFile the file declaring the directive
     * @param directive the directive
     * @return the usage site with its verdict
     */
    public UsageSite inspect(final SourceFile sourceFile,
            final UsingDirective directive) {

        Preconditions.requireNonNull(sourceFile, "Source file is required");
        Preconditions.requireNonNull(directive, "Using directive is required");

        if (!rules.isEditorOnlyNamespace(directive.namespaceName())) {
            return new UsageSite(directive, UsageVerdict.IGNORED_NAMESPACE,
                    null);
        }
        if (rules.isEditorPath(sourceFile.path())) {
            return new UsageSite(directive, UsageVerdict.EXCLUDED_BY_PATH,
                    null);
        }
        if (!rules.isInTargetScope(sourceFile.path())) {
            return new UsageSite(directive, UsageVerdict.OUT_OF_SCOPE, null);
        }

        final ScanResult result = resolve(sourceFile, directive.position());
        if (result.guarded()) {
            LOG.debug("{}: '{}' guarded by '#if {}'", sourceFile.path(),
                    directive.namespaceName(), result.matchedCondition());
            return new UsageSite(directive, UsageVerdict.GUARDED, result);
        }
        return new UsageSite(directive, UsageVerdict.REPORTED, result);
    }

    /**
     * Decides about every using directive of a file.
     *
     * @param sourceFile the parsed file
     * @return the usage sites in source order
     */
    public List<UsageSite> inspect(final SourceFile sourceFile) {
        Preconditions.requireNonNull(sourceFile, "Source file is required");

        final List<UsageSite> sites = new ArrayList<>();
        for (final UsingDirective directive : sourceFile.usingDirectives()) {
            sites.add(inspect(sourceFile, directive));
        }
        return sites;
    }

    /**
     * Reports the forbidden editor-only imports of a file.
     *
     * @param sourceFile the parsed file
     * @return the diagnostics in source order, empty if the file is clean
     */
    public List<Diagnostic> analyze(final SourceFile sourceFile) {
        final List<Diagnostic> diagnostics = new ArrayList<>();
        for (final UsageSite site : inspect(sourceFile)) {
            if (site.verdict().isReported()) {
                diagnostics.add(toDiagnostic(sourceFile, site));
            }
        }
        if (!diagnostics.isEmpty()) {
            LOG.debug("{}: {} editor-only import(s) in runtime code",
                    sourceFile.path(), diagnostics.size());
        }
        return diagnostics;
    }

    private Diagnostic toDiagnostic(final SourceFile sourceFile,
            final UsageSite site) {
        final UsingDirective directive = site.usingDirective();
        return Diagnostic.create(
                DiagnosticDescriptor.EDITOR_USAGE_IN_RUNTIME_CODE,
                sourceFile,
                directive.span(),
                directive.namespaceName(),
                rules.editorDirectorySegment(),
                rules.editorCompilationSymbol());
    }

}
