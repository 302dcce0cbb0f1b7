package org.botblocks.compiler.codegen;

import java.util.List;

/**
 * The opening of an emitted event handler: the target language's event name and the
 * fixed parameter bindings derived from the event block.
 *
 * @param eventName The event name, e.g. {@code buttons}.
 * @param bindings  Rendered parameter bindings, possibly empty.
 */
public record HandlerSignature(String eventName, List<String> bindings) {

    public HandlerSignature {
        bindings = List.copyOf(bindings);
    }

    /**
     * @return The header line, e.g. {@code onevent buttons(button.forward):}.
     */
    public String header() {
        return "onevent " + eventName + "(" + String.join(", ", bindings) + "):";
    }
}
