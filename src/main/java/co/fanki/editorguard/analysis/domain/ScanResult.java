package co.fanki.editorguard.analysis.domain;

/**
 * Whether a position is guarded by an editor-only condition.
 *
 * @param guarded true if an enclosing condition mentions the marker
 * @param matchedCondition the first matching condition text, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScanResult(boolean guarded, String matchedCondition) {

    private static final ScanResult NOT_GUARDED = new ScanResult(false, null);

    /**
     * Creates a guarded result.
     *
     * @param condition the condition text that guards the position
     * @return the result
     */
    public static ScanResult guardedBy(final String condition) {
        return new ScanResult(true, condition);
    }

    /**
     * Returns the result for an unguarded position.
     *
     * @return the result
     */
    public static ScanResult notGuarded() {
        return NOT_GUARDED;
    }

}
