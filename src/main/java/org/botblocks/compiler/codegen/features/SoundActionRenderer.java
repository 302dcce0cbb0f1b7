package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IActionRenderer;
import org.botblocks.compiler.codegen.ScriptWriter;
import org.botblocks.model.Block;

/**
 * Renders {@code play-sound(sound)} as a system sound call.
 */
public class SoundActionRenderer implements IActionRenderer {

    @Override
    public void render(Block action, ScriptWriter out) {
        out.line("call sound.system(" + action.parameter(0) + ")");
    }
}
