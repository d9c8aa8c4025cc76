package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * A conditional-compilation directive, positioned in its source file.
 *
 * @param kind the directive kind
 * @param sourceOffset the offset of the directive's {@code #}
 * @param conditionText the raw condition for IF and ELIF, null otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DirectiveEvent(
        DirectiveKind kind,
        int sourceOffset,
        String conditionText
) {

    /**
     * Validates the event components.
     *
     * @param kind the directive kind
     * @param sourceOffset the directive offset
     * @param conditionText the raw condition text
     */
    public DirectiveEvent {
        Preconditions.requireNonNull(kind, "Directive kind is required");
        Preconditions.requireNonNegative(sourceOffset,
                "Directive offset must be >= 0");
        if (kind == DirectiveKind.IF || kind == DirectiveKind.ELIF) {
            Preconditions.requireNonNull(conditionText,
                    "Condition text is required for #" + kind.keyword());
        } else {
            conditionText = null;
        }
    }

    /**
     * Creates an {@code #if} event.
     *
     * @param offset the directive offset
     * @param condition the raw condition
     * @return the event
     */
    public static DirectiveEvent ifDirective(final int offset,
            final String condition) {
        return new DirectiveEvent(DirectiveKind.IF, offset, condition);
    }

    /**
     * Creates an {@code #elif} event.
     *
     * @param offset the directive offset
     * @param condition the raw condition
     * @return the event
     */
    public static DirectiveEvent elifDirective(final int offset,
            final String condition) {
        return new DirectiveEvent(DirectiveKind.ELIF, offset, condition);
    }

    /**
     * Creates an {@code #else} event.
     *
     * @param offset the directive offset
     * @return the event
     */
    public static DirectiveEvent elseDirective(final int offset) {
        return new DirectiveEvent(DirectiveKind.ELSE, offset, null);
    }

    /**
     * Creates an {@code #endif} event.
     *
     * @param offset the directive offset
     * @return the event
     */
    public static DirectiveEvent endIfDirective(final int offset) {
        return new DirectiveEvent(DirectiveKind.ENDIF, offset, null);
    }

}
