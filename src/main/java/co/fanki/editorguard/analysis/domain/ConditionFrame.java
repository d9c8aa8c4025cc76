package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * The branch currently active at one conditional nesting level.
 *
 * <p>A frame either carries the raw condition of the {@code #if} or
 * {@code #elif} branch it stands for, or is the else-branch frame, which
 * has no condition text and never mentions any symbol.</p>
 *
 * @param activeConditionText the condition text, null for the else branch
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ConditionFrame(String activeConditionText) {

    private static final ConditionFrame ELSE_BRANCH = new ConditionFrame(null);

    /**
     * Creates a frame for a conditioned branch.
     *
     * @param conditionText the raw condition text
     * @return the frame
     */
    public static ConditionFrame conditioned(final String conditionText) {
        return new ConditionFrame(Preconditions.requireNonNull(conditionText,
                "Condition text is required"));
    }

    /**
     * Returns the frame standing for an {@code #else} branch.
     *
     * @return the else-branch frame
     */
    public static ConditionFrame elseBranch() {
        return ELSE_BRANCH;
    }

    /**
     * Checks whether this frame stands for an {@code #else} branch.
     *
     * @return true for the else-branch frame
     */
    public boolean isElseBranch() {
        return activeConditionText == null;
    }

    /**
     * Checks whether the condition text contains a marker, case-sensitively.
     *
     * @param marker the text to look for
     * @return true if the marker occurs in the condition text
     */
    public boolean mentions(final String marker) {
        return !isElseBranch() && activeConditionText.contains(marker);
    }

}
