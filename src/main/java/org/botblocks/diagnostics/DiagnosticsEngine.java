package org.botblocks.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one compile call and forwards each of them to a {@link DiagnosticSink}.
 * <p>
 * This decouples error reporting from the compiler logic. Instances are not thread-safe and
 * belong to exactly one compilation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink sink;

    public DiagnosticsEngine() {
        this(DiagnosticSink.none());
    }

    public DiagnosticsEngine(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.none() : sink;
    }

    /**
     * Reports a finding with the severity of its code.
     *
     * @param code      The diagnostic code.
     * @param ruleIndex The index of the concerned rule.
     * @param message   The message.
     */
    public void report(DiagnosticCode code, int ruleIndex, String message) {
        report(Diagnostic.of(code, ruleIndex, message));
    }

    /**
     * Reports an already built diagnostic.
     *
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        sink.accept(diagnostic);
    }

    /**
     * @param batch Diagnostics to report in order.
     */
    public void reportAll(List<Diagnostic> batch) {
        batch.forEach(this::report);
    }

    /**
     * @return {@code true} if at least one error has been reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @param ruleIndex The rule index.
     * @return {@code true} if an error has been reported against that rule.
     */
    public boolean hasErrorFor(int ruleIndex) {
        return diagnostics.stream().anyMatch(d -> d.isError() && d.ruleIndex() == ruleIndex);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All collected diagnostics as one formatted string, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
