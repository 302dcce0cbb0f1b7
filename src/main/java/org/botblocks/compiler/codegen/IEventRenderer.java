package org.botblocks.compiler.codegen;

import org.botblocks.model.Block;

/**
 * Renders an event block into the opening of its handler.
 * Implementations should be stateless.
 */
@FunctionalInterface
public interface IEventRenderer {

    /**
     * @param event A range-checked event block.
     * @return The handler signature.
     */
    HandlerSignature signature(Block event);
}
