package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The parsed representation of one C# source file.
 *
 * <p>Holds the raw text, the comments and preprocessor directives in
 * source order, and the {@code using} directives in source order. The
 * path is the one the file was loaded from (relative to the project root
 * when scanned as part of a project) and may be null for in-memory
 * sources.</p>
 *
 * <p>Instances are immutable and may be analyzed from many threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceFile {

    private final String path;

    private final String text;

    private final List<SyntaxTrivia> trivia;

    private final List<UsingDirective> usingDirectives;

    /** Offsets at which each line starts, line 1 at index 0. */
    private final int[] lineStarts;

    /**
     * Creates a new source file.
     *
     * @param thePath the file path, may be null
     * @param theText the source text
     * @param theTrivia the comments and directives, in source order
     * @param theUsingDirectives the using directives, in source order
     */
    public SourceFile(final String thePath, final String theText,
            final List<SyntaxTrivia> theTrivia,
            final List<UsingDirective> theUsingDirectives) {
        Preconditions.requireNonNull(theText, "Source text is required");
        Preconditions.requireNonNull(theTrivia, "Trivia list is required");
        Preconditions.requireNonNull(theUsingDirectives,
                "Using directive list is required");
        path = thePath;
        text = theText;
        trivia = List.copyOf(theTrivia);
        usingDirectives = List.copyOf(theUsingDirectives);
        lineStarts = computeLineStarts(theText);
    }

    /**
     * Returns the file path.
     *
     * @return the path, or null for in-memory sources
     */
    public String path() {
        return path;
    }

    /**
     * Returns the source text.
     *
     * @return the text
     */
    public String text() {
        return text;
    }

    /**
     * Returns the comments and directives in source order.
     *
     * @return the trivia, never null
     */
    public List<SyntaxTrivia> trivia() {
        return trivia;
    }

    /**
     * Returns the using directives in source order.
     *
     * @return the using directives, never null
     */
    public List<UsingDirective> usingDirectives() {
        return usingDirectives;
    }

    /**
     * Returns the 1-based line number of an offset.
     *
     * @param offset the character offset
     * @return the line number
     */
    public int lineOf(final int offset) {
        final int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the 1-based column of an offset within its line.
     *
     * @param offset the character offset
     * @return the column number
     */
    public int columnOf(final int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    /**
     * Returns the source text covered by a span.
     *
     * @param span the span to extract
     * @return the covered text
     */
    public String textOf(final TextSpan span) {
        return text.substring(span.start(), span.end());
    }

    private static int[] computeLineStarts(final String text) {
        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "SourceFile{path=" + path + ", usings="
                + usingDirectives.size() + ", trivia=" + trivia.size() + "}";
    }

}
