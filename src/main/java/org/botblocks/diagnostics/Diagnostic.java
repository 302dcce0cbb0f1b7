package org.botblocks.diagnostics;

/**
 * Represents a single finding reported while validating or compiling a program.
 *
 * @param severity  Whether the finding blocks emission of the affected rule.
 * @param code      The stable code identifying the finding.
 * @param ruleIndex The index of the concerned rule in the program.
 * @param message   The human readable description.
 */
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        int ruleIndex,
        String message
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        /** The affected rule is not emitted. */
        ERROR,
        /** Code is still emitted. */
        WARNING
    }

    /**
     * Creates a diagnostic with the code's own severity.
     *
     * @param code      The diagnostic code.
     * @param ruleIndex The index of the concerned rule.
     * @param message   The message.
     * @return The new diagnostic.
     */
    public static Diagnostic of(DiagnosticCode code, int ruleIndex, String message) {
        return new Diagnostic(code.severity(), code, ruleIndex, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return String.format("[%s] rule %d: %s (%s)", severity, ruleIndex, message, code);
    }
}
