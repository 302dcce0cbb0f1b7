package org.botblocks.compiler.api;

import org.botblocks.diagnostics.Diagnostic;
import org.botblocks.model.TriggerKey;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of one compile call: best-effort script text plus every finding.
 *
 * @param script      The complete script; empty for an empty program.
 * @param handlers    The emitted handlers in script order.
 * @param diagnostics All diagnostics in reporting order.
 */
public record CompilationResult(String script, List<EmittedHandler> handlers, List<Diagnostic> diagnostics) {

    public CompilationResult {
        handlers = List.copyOf(handlers);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    /**
     * @param trigger A trigger key.
     * @return The handler emitted for that trigger, if any.
     */
    public Optional<EmittedHandler> handlerFor(TriggerKey trigger) {
        return handlers.stream().filter(h -> h.trigger().equals(trigger)).findFirst();
    }

    /**
     * @return All diagnostics as one formatted string, one per line.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
