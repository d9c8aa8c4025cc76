package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * A half-open range of character offsets in a source text.
 *
 * @param start the offset of the first character
 * @param end the offset just past the last character
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TextSpan(int start, int end) {

    /**
     * Creates a new span, validating that it is well formed.
     *
     * @param start the offset of the first character
     * @param end the offset just past the last character
     */
    public TextSpan {
        Preconditions.requireNonNegative(start, "Span start must be >= 0");
        Preconditions.require(end >= start, "Span end must be >= start");
    }

    /**
     * Returns the number of characters covered by this span.
     *
     * @return the span length
     */
    public int length() {
        return end - start;
    }

}
