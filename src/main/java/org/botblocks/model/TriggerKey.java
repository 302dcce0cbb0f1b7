package org.botblocks.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical (event identity, event parameters) pair. Rules with equal trigger keys are merged
 * into a single emitted handler.
 *
 * @param identity   The event block's identity.
 * @param parameters The event block's parameter values.
 */
public record TriggerKey(String identity, List<Integer> parameters) {

    public TriggerKey {
        parameters = List.copyOf(parameters);
    }

    /**
     * @param event An event block.
     * @return The trigger key of that block.
     */
    public static TriggerKey of(Block event) {
        return new TriggerKey(event.identity(), event.parameters());
    }

    @Override
    public String toString() {
        return identity + parameters.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
    }
}
