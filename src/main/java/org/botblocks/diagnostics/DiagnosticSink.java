package org.botblocks.diagnostics;

/**
 * Receives diagnostics as soon as they are reported. Passed explicitly into a compile call
 * by hosts that want to observe findings, e.g. to log them.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * Called once per reported diagnostic, in reporting order.
     *
     * @param diagnostic The reported diagnostic.
     */
    void accept(Diagnostic diagnostic);

    /**
     * @return A sink that ignores everything.
     */
    static DiagnosticSink none() {
        return diagnostic -> { };
    }
}
