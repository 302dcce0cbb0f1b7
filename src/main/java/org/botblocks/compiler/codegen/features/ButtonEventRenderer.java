package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.HandlerSignature;
import org.botblocks.compiler.codegen.IEventRenderer;
import org.botblocks.model.Block;

import java.util.List;

/**
 * Renders {@code button-pressed} into the {@code buttons} handler bound to one button.
 */
public class ButtonEventRenderer implements IEventRenderer {

    private static final List<String> BUTTONS = List.of("forward", "backward", "left", "right", "center");

    @Override
    public HandlerSignature signature(Block event) {
        return new HandlerSignature("buttons", List.of("button." + BUTTONS.get(event.parameter(0))));
    }
}
