package co.fanki.editorguard.analysis.domain;

import java.util.Locale;

/**
 * How serious a reported diagnostic is.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DiagnosticSeverity {

    INFO,

    WARNING,

    ERROR;

    /**
     * Returns the severity as printed in compiler-style output.
     *
     * @return the lower-case label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

}
