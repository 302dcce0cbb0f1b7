package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IActionRenderer;
import org.botblocks.compiler.codegen.ScriptWriter;
import org.botblocks.model.Block;

/**
 * Renders {@code set-state}: one assignment per variable whose parameter is not 0.
 * Value 1 switches the variable on, 2 switches it off, 0 leaves it unchanged.
 */
public class SetStateActionRenderer implements IActionRenderer {

    @Override
    public void render(Block action, ScriptWriter out) {
        for (int i = 0; i < action.parameters().size(); i++) {
            int change = action.parameter(i);
            if (change == 0) {
                continue;
            }
            out.line(StateMemory.element(i) + " = " + (change == 1 ? 1 : 0));
        }
    }
}
