package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns the directive trivia of a source file into directive events.
 *
 * <p>The stream is lazy and follows source order, so callers that stop
 * at a cutoff never look at the directives after it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DirectiveTriviaExtractor {

    private DirectiveTriviaExtractor() {
    }

    /**
     * Streams the conditional-compilation directives of a file.
     *
     * @param sourceFile the parsed source file
     * @return the directive events in source order
     */
    public static Stream<DirectiveEvent> extract(final SourceFile sourceFile) {
        Preconditions.requireNonNull(sourceFile, "Source file is required");
        return sourceFile.trivia().stream()
                .filter(SyntaxTrivia::isDirective)
                .map(DirectiveTriviaExtractor::toEvent)
                .flatMap(Optional::stream);
    }

    private static Optional<DirectiveEvent> toEvent(final SyntaxTrivia trivia) {
        return DirectiveKind.fromKeyword(trivia.directiveKeyword())
                .map(kind -> new DirectiveEvent(kind, trivia.span().start(),
                        trivia.directiveArgument()));
    }

}
