package co.fanki.editorguard.analysis.domain;

/**
 * What the analysis decided for one using directive.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum UsageVerdict {

    /** The directive imports some other namespace. */
    IGNORED_NAMESPACE,

    /** The file lives in an editor-only directory. */
    EXCLUDED_BY_PATH,

    /** The file is outside the configured target folders. */
    OUT_OF_SCOPE,

    /** An enclosing condition mentions the editor compilation symbol. */
    GUARDED,

    /** Forbidden import, reported as a diagnostic. */
    REPORTED;

    /**
     * Checks whether this verdict produces a diagnostic.
     *
     * @return true only for {@link #REPORTED}
     */
    public boolean isReported() {
        return this == REPORTED;
    }

}
