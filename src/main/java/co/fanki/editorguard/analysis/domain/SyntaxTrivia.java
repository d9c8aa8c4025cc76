package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * A piece of non-code text found in a source file.
 *
 * <p>For {@link TriviaKind#DIRECTIVE} trivia the span starts at the
 * {@code #} character, {@code directiveKeyword} holds the word following
 * it (e.g. {@code "if"}, {@code "endregion"}) and
 * {@code directiveArgument} the rest of the line, trimmed and without a
 * trailing line comment. Both are null for comments.</p>
 *
 * @param kind the trivia kind
 * @param span the location of the trivia in the source text
 * @param directiveKeyword the directive keyword, or null
 * @param directiveArgument the directive argument text, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyntaxTrivia(
        TriviaKind kind,
        TextSpan span,
        String directiveKeyword,
        String directiveArgument
) {

    /**
     * Validates the trivia components.
     *
     * @param kind the trivia kind
     * @param span the location of the trivia
     * @param directiveKeyword the directive keyword, or null
     * @param directiveArgument the directive argument, or null
     */
    public SyntaxTrivia {
        Preconditions.requireNonNull(kind, "Trivia kind is required");
        Preconditions.requireNonNull(span, "Trivia span is required");
        if (kind == TriviaKind.DIRECTIVE) {
            Preconditions.requireNonNull(directiveKeyword,
                    "Directive keyword is required");
            Preconditions.requireNonNull(directiveArgument,
                    "Directive argument is required");
        }
    }

    /**
     * Creates comment trivia.
     *
     * @param span the comment location
     * @return the trivia
     */
    public static SyntaxTrivia comment(final TextSpan span) {
        return new SyntaxTrivia(TriviaKind.COMMENT, span, null, null);
    }

    /**
     * Creates directive trivia.
     *
     * @param span the directive location, starting at {@code #}
     * @param keyword the directive keyword
     * @param argument the directive argument text
     * @return the trivia
     */
    public static SyntaxTrivia directive(final TextSpan span,
            final String keyword, final String argument) {
        return new SyntaxTrivia(TriviaKind.DIRECTIVE, span, keyword, argument);
    }

    /**
     * Checks whether this trivia is a preprocessor directive.
     *
     * @return true for directive trivia
     */
    public boolean isDirective() {
        return kind == TriviaKind.DIRECTIVE;
    }

}
