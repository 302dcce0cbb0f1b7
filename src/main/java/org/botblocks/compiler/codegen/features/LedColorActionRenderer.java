package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IActionRenderer;
import org.botblocks.compiler.codegen.ScriptWriter;
import org.botblocks.model.Block;

import java.util.List;

/**
 * Renders an RGB color block as one native LED call per target LED group.
 */
public class LedColorActionRenderer implements IActionRenderer {

    private final List<String> targets;

    /**
     * @param targets Native functions to call, in emission order.
     */
    public LedColorActionRenderer(List<String> targets) {
        this.targets = List.copyOf(targets);
    }

    @Override
    public void render(Block action, ScriptWriter out) {
        String rgb = action.parameter(0) + ", " + action.parameter(1) + ", " + action.parameter(2);
        for (String target : targets) {
            out.line("call " + target + "(" + rgb + ")");
        }
    }
}
