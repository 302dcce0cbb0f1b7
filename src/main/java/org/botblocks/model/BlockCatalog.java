package org.botblocks.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of block types by identity and the validating factory for {@link Block} values.
 * <p>
 * A catalog is filled once and then only read, so a fully initialized instance can be shared
 * between threads.
 */
public final class BlockCatalog {

    private final Map<String, BlockType> byIdentity = new LinkedHashMap<>();

    /**
     * Registers a block type. A later registration under the same identity replaces the earlier one.
     *
     * @param type The type to register.
     */
    public void register(BlockType type) {
        byIdentity.put(type.identity(), type);
    }

    /**
     * @param identity The identity to look up.
     * @return The registered type, if any.
     */
    public Optional<BlockType> find(String identity) {
        return Optional.ofNullable(byIdentity.get(identity));
    }

    /**
     * @return All registered types in registration order.
     */
    public Collection<BlockType> types() {
        return Collections.unmodifiableCollection(byIdentity.values());
    }

    /**
     * Creates a block, checking the identity and every parameter against the registered type.
     *
     * @param identity      The block identity.
     * @param rawParameters The parameter values.
     * @return The new block.
     * @throws BlockConstructionException if the identity is unknown or a value is out of range.
     */
    public Block create(String identity, int... rawParameters) throws BlockConstructionException {
        List<Integer> values = new ArrayList<>(rawParameters.length);
        Arrays.stream(rawParameters).forEach(values::add);
        return create(identity, values);
    }

    /**
     * List-based variant of {@link #create(String, int...)}.
     *
     * @param identity      The block identity.
     * @param rawParameters The parameter values.
     * @return The new block.
     * @throws BlockConstructionException if the identity is unknown or a value is out of range.
     */
    public Block create(String identity, List<Integer> rawParameters) throws BlockConstructionException {
        BlockType type = find(identity).orElseThrow(() -> new BlockConstructionException(
                BlockConstructionException.Reason.UNKNOWN_IDENTITY, identity, "Unknown block identity '" + identity + "'"));
        Optional<String> violation = type.checkParameters(rawParameters);
        if (violation.isPresent()) {
            throw new BlockConstructionException(BlockConstructionException.Reason.PARAMETER_OUT_OF_RANGE, identity,
                    violation.get());
        }
        return new Block(type, rawParameters);
    }

    /**
     * Initializes a catalog holding the standard robot palette.
     *
     * @return A new catalog with all {@link StandardBlocks} types registered.
     */
    public static BlockCatalog initializeWithDefaults() {
        BlockCatalog catalog = new BlockCatalog();
        StandardBlocks.types().forEach(catalog::register);
        return catalog;
    }
}
