package org.botblocks.model;

import java.util.List;
import java.util.Optional;

/**
 * Describes one concrete block identity: its kind and the fixed list of parameter slots.
 *
 * @param identity           Stable identity string, e.g. {@code button-pressed}.
 * @param kind               Whether blocks of this type are events, states or actions.
 * @param parameters         The ordered parameter slots. The arity never changes for an identity.
 * @param touchesStateMemory {@code true} if blocks of this type read or write the state memory,
 *                           which makes the compiler declare it in the script prologue.
 */
public record BlockType(String identity, BlockKind kind, List<ParameterSpec> parameters, boolean touchesStateMemory) {

    public BlockType {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Block identity must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Block kind must not be null for '" + identity + "'");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public BlockType(String identity, BlockKind kind, List<ParameterSpec> parameters) {
        this(identity, kind, parameters, false);
    }

    /**
     * @return The number of parameters every block of this type carries.
     */
    public int arity() {
        return parameters.size();
    }

    /**
     * Checks raw parameter values against this type's arity and ranges.
     *
     * @param values The values to check.
     * @return A description of the first violation, or empty if the values are acceptable.
     */
    public Optional<String> checkParameters(List<Integer> values) {
        if (values == null || values.size() != arity()) {
            int actual = values == null ? 0 : values.size();
            return Optional.of(String.format("'%s' expects %d parameter(s) but got %d", identity, arity(), actual));
        }
        for (int i = 0; i < values.size(); i++) {
            ParameterSpec spec = parameters.get(i);
            Integer value = values.get(i);
            if (value == null || !spec.accepts(value)) {
                return Optional.of(String.format("'%s' parameter %d (%s) is %s, expected %d..%d",
                        identity, i, spec.name(), value, spec.min(), spec.max()));
            }
        }
        return Optional.empty();
    }
}
