package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.HandlerSignature;
import org.botblocks.compiler.codegen.IEventRenderer;
import org.botblocks.model.Block;

import java.util.List;

/**
 * Renders parameterless events into a handler with a fixed name and no bindings.
 */
public class NamedEventRenderer implements IEventRenderer {

    private final String eventName;

    public NamedEventRenderer(String eventName) {
        this.eventName = eventName;
    }

    @Override
    public HandlerSignature signature(Block event) {
        return new HandlerSignature(eventName, List.of());
    }
}
