package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * Decides whether a condition stack guards code as editor-only.
 *
 * <p>Any level counts: a marker anywhere in the enclosing chain is
 * enough, even when inner levels are unconditioned. The check is a plain
 * case-sensitive substring match on the raw condition, so
 * {@code UNITY_EDITOR && DEBUG} and {@code !UNITY_EDITOR} both match. The
 * else-branch frame never matches.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ActiveConditionClassifier {

    private ActiveConditionClassifier() {
    }

    /**
     * Classifies a condition stack.
     *
     * @param stack the active conditions, outermost first
     * @param marker the editor-only compilation symbol
     * @return the verdict with the first matching condition
     */
    public static ScanResult classify(final ConditionStack stack,
            final String marker) {

        Preconditions.requireNonNull(stack, "Condition stack is required");
        Preconditions.requireNonBlank(marker, "Marker is required");

        for (final ConditionFrame frame : stack) {
            if (frame.mentions(marker)) {
                return ScanResult.guardedBy(frame.activeConditionText());
            }
        }
        return ScanResult.notGuarded();
    }

}
