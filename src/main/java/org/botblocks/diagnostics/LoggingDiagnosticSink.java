package org.botblocks.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every diagnostic to the log: errors at ERROR, warnings at WARN.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    private final String programName;

    /**
     * @param programName Name of the compiled program, prefixed to every log line.
     */
    public LoggingDiagnosticSink(String programName) {
        this.programName = programName;
    }

    @Override
    public void accept(Diagnostic diagnostic) {
        if (diagnostic.isError()) {
            LOG.error("{}: rule {}: {} ({})", programName, diagnostic.ruleIndex(), diagnostic.message(), diagnostic.code());
        } else {
            LOG.warn("{}: rule {}: {} ({})", programName, diagnostic.ruleIndex(), diagnostic.message(), diagnostic.code());
        }
    }
}
