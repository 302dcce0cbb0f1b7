package org.botblocks.compiler.codegen.features;

import java.util.Collections;

/**
 * Naming of the state memory array shared by state tests, state updates and the script prologue.
 */
public final class StateMemory {

    /** Name of the array variable holding the state memory. */
    public static final String NAME = "state";

    private StateMemory() {}

    /**
     * @param index A state variable index.
     * @return The array element expression, e.g. {@code state[2]}.
     */
    public static String element(int index) {
        return NAME + "[" + index + "]";
    }

    /**
     * @param size Number of state variables.
     * @return The declaration statement, e.g. {@code var state[4] = [0,0,0,0]}.
     */
    public static String declaration(int size) {
        return "var " + NAME + "[" + size + "] = [" + String.join(",", Collections.nCopies(size, "0")) + "]";
    }
}
