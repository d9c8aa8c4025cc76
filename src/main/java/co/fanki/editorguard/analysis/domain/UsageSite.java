package co.fanki.editorguard.analysis.domain;

/**
 * A using directive together with the analysis decision about it.
 *
 * @param usingDirective the directive
 * @param verdict the decision
 * @param scanResult the guard resolution, null when it was not needed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record UsageSite(
        UsingDirective usingDirective,
        UsageVerdict verdict,
        ScanResult scanResult
) {
}
