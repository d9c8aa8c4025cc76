package co.fanki.editorguard.analysis.domain;

/**
 * The kinds of non-code text recorded while parsing a source file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TriviaKind {

    /** A line or block comment. */
    COMMENT,

    /** A preprocessor directive line, e.g. {@code #if UNITY_EDITOR}. */
    DIRECTIVE

}
