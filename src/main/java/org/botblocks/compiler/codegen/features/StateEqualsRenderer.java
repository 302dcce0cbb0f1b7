package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.IStateRenderer;
import org.botblocks.model.Block;

/**
 * Renders {@code state-equals(variable, value)} as an equality test on the state memory.
 */
public class StateEqualsRenderer implements IStateRenderer {

    @Override
    public String condition(Block state) {
        return StateMemory.element(state.parameter(0)) + " == " + state.parameter(1);
    }
}
