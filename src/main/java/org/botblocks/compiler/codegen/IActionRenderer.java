package org.botblocks.compiler.codegen;

import org.botblocks.model.Block;

/**
 * Renders an action block into zero or more statements.
 * Implementations should be stateless; all output goes to the given writer.
 */
@FunctionalInterface
public interface IActionRenderer {

    /**
     * @param action A range-checked action block.
     * @param out    The writer receiving the statements at its current indentation.
     */
    void render(Block action, ScriptWriter out);
}
