package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IActionRenderer;
import org.botblocks.compiler.codegen.ScriptWriter;
import org.botblocks.model.Block;

/**
 * Renders {@code set-motor-speed(left, right)} as two motor target assignments.
 */
public class MotorActionRenderer implements IActionRenderer {

    @Override
    public void render(Block action, ScriptWriter out) {
        out.line("motor.left.target = " + action.parameter(0));
        out.line("motor.right.target = " + action.parameter(1));
    }
}
