package org.botblocks.compiler.codegen;

import org.botblocks.model.Block;

/**
 * Renders a state block into a boolean expression of the target language.
 * Implementations should be stateless.
 */
@FunctionalInterface
public interface IStateRenderer {

    /**
     * @param state A range-checked state block.
     * @return The condition expression, e.g. {@code state[0] == 1}.
     */
    String condition(Block state);
}
