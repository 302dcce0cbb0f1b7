package org.botblocks.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable block value. Edits in the editor produce new blocks, so the same instance
 * can safely be referenced from several rules.
 * <p>
 * Instances are normally obtained from {@link BlockCatalog#create(String, int...)}, which
 * range-checks the parameters. The canonical constructor performs no range check.
 *
 * @param type       The block's type descriptor.
 * @param parameters The parameter values, one per slot of the type.
 */
public record Block(BlockType type, List<Integer> parameters) {

    public Block {
        if (type == null) {
            throw new IllegalArgumentException("Block type must not be null");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public BlockKind kind() {
        return type.kind();
    }

    public String identity() {
        return type.identity();
    }

    /**
     * @param index Slot index.
     * @return The value of the parameter in that slot.
     */
    public int parameter(int index) {
        return parameters.get(index);
    }

    @Override
    public String toString() {
        return identity() + parameters.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
    }
}
