package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * A namespace import found in a C# source file.
 *
 * <p>The span covers the whole directive, from the {@code using} keyword
 * (or {@code global} for global usings) through the terminating
 * semicolon. For an alias directive such as
 * {@code using Menu = UnityEditor.Menu;} the namespace name is the aliased
 * target, {@code UnityEditor.Menu}.</p>
 *
 * @param namespaceName the imported name, without whitespace or comments
 * @param span the directive location
 * @param isStatic whether this is a {@code using static} directive
 * @param alias the alias name, or null
 * @param isGlobal whether this is a {@code global using} directive
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record UsingDirective(
        String namespaceName,
        TextSpan span,
        boolean isStatic,
        String alias,
        boolean isGlobal
) {

    /**
     * Validates the directive components.
     *
     * @param namespaceName the imported name
     * @param span the directive location
     * @param isStatic whether this is a static import
     * @param alias the alias name, or null
     * @param isGlobal whether this is a global import
     */
    public UsingDirective {
        Preconditions.requireNonBlank(namespaceName,
                "Namespace name is required");
        Preconditions.requireNonNull(span, "Directive span is required");
    }

    /**
     * Creates a plain {@code using N;} directive.
     *
     * @param namespaceName the imported namespace
     * @param span the directive location
     * @return the directive
     */
    public static UsingDirective of(final String namespaceName,
            final TextSpan span) {
        return new UsingDirective(namespaceName, span, false, null, false);
    }

    /**
     * Returns the offset the directive starts at.
     *
     * @return the span start
     */
    public int position() {
        return span.start();
    }

}
