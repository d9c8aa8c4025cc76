package co.fanki.editorguard.analysis.domain;

import java.util.Optional;

/**
 * The conditional-compilation directives that shape the condition stack.
 *
 * <p>Any other directive ({@code #define}, {@code #region},
 * {@code #pragma}, ...) has no kind and is ignored by the analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DirectiveKind {

    /** {@code #if condition}: opens a nesting level. */
    IF("if"),

    /** {@code #elif condition}: switches the innermost level's branch. */
    ELIF("elif"),

    /** {@code #else}: switches the innermost level to its fallback branch. */
    ELSE("else"),

    /** {@code #endif}: closes the innermost level. */
    ENDIF("endif");

    private final String keyword;

    DirectiveKind(final String theKeyword) {
        keyword = theKeyword;
    }

    /**
     * Returns the directive keyword as written after {@code #}.
     *
     * @return the keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a directive keyword into its kind.
     *
     * <p>Keywords are case-sensitive, as in C#.</p>
     *
     * @param keyword the keyword following {@code #}
     * @return the kind, or empty for directives the analysis ignores
     */
    public static Optional<DirectiveKind> fromKeyword(final String keyword) {
        for (final DirectiveKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

}
