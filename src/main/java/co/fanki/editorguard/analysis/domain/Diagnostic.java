package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

/**
 * A problem reported at a location of a source file.
 *
 * @param ruleId the identifier of the rule that reported it
 * @param severity the severity
 * @param message the human readable message
 * @param filePath the file path, null for in-memory sources
 * @param span the offending source range
 * @param line the 1-based line of the span start
 * @param column the 1-based column of the span start
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Diagnostic(
        String ruleId,
        DiagnosticSeverity severity,
        String message,
        String filePath,
        TextSpan span,
        int line,
        int column
) {

    /**
     * Validates the diagnostic components.
     *
     * @param ruleId the rule id
     * @param severity the severity
     * @param message the message
     * @param filePath the file path
     * @param span the source range
     * @param line the line
     * @param column the column
     */
    public Diagnostic {
        Preconditions.requireNonBlank(ruleId, "Rule id is required");
        Preconditions.requireNonNull(severity, "Severity is required");
        Preconditions.requireNonNull(span, "Span is required");
    }

    /**
     * Creates a diagnostic located in a source file.
     *
     * @param descriptor the reporting rule
     * @param sourceFile the file the span belongs to
     * @param span the offending range
     * @param arguments the message template arguments
     * @return the diagnostic
     */
    public static Diagnostic create(final DiagnosticDescriptor descriptor,
            final SourceFile sourceFile, final TextSpan span,
            final Object... arguments) {
        return new Diagnostic(
                descriptor.id(),
                descriptor.defaultSeverity(),
                descriptor.formatMessage(arguments),
                sourceFile.path(),
                span,
                sourceFile.lineOf(span.start()),
                sourceFile.columnOf(span.start()));
    }

    /**
     * Renders the diagnostic the way C# compilers print them, e.g.
     * {@code Assets/Foo.cs(3,1): error UEA001: ...}.
     *
     * @return the formatted line
     */
    public String toCompilerFormat() {
        final String location = filePath == null ? "<memory>" : filePath;
        return location + "(" + line + "," + column + "): "
                + severity.label() + " " + ruleId + ": " + message;
    }

}
