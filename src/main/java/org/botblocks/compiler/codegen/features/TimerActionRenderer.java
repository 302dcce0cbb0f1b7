package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IActionRenderer;
import org.botblocks.compiler.codegen.ScriptWriter;
import org.botblocks.model.Block;

/**
 * Renders {@code start-timer(period)}. A period of 0 is emitted as is and stops the timer.
 */
public class TimerActionRenderer implements IActionRenderer {

    @Override
    public void render(Block action, ScriptWriter out) {
        out.line("timer.period[0] = " + action.parameter(0));
    }
}
