package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * The stable description of a rule that produces diagnostics.
 *
 * @param id the stable rule identifier
 * @param title a short human readable title
 * @param messageFormat a {@link String#format} template for the message
 * @param category the rule category
 * @param defaultSeverity the severity of reported diagnostics
 * @param description a longer explanation of the rule
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagnosticDescriptor(
        String id,
        String title,
        String messageFormat,
        String category,
        DiagnosticSeverity defaultSeverity,
        String description
) {

    /** Editor-only namespace imported into code compiled for runtime. */
    public static final DiagnosticDescriptor EDITOR_USAGE_IN_RUNTIME_CODE =
            new DiagnosticDescriptor(
                    "UEA001",
                    "UnityEditor usage in runtime code",
                    "Namespace '%s' must not be used in runtime code. Move"
                            + " this code under an '%s' directory or wrap"
                            + " it in '#if %s'.",
                    "Usage",
                    DiagnosticSeverity.ERROR,
                    "Editor-only namespaces are missing from player"
                            + " builds, so importing them outside editor"
                            + " code breaks the build.");

    /**
     * Validates the descriptor components.
     *
     * @param id the rule identifier
     * @param title the rule title
     * @param messageFormat the message template
     * @param category the rule category
     * @param defaultSeverity the severity
     * @param description the rule explanation
     */
    public DiagnosticDescriptor {
        Preconditions.requireNonBlank(id, "Rule id is required");
        Preconditions.requireNonBlank(messageFormat,
                "Message format is required");
        Preconditions.requireNonNull(defaultSeverity, "Severity is required");
    }

    /**
     * Formats the diagnostic message.
     *
     * @param arguments the template arguments
     * @return the message
     */
    public String formatMessage(final Object... arguments) {
        return String.format(messageFormat, arguments);
    }

}
