package org.botblocks.compiler.grouping;

import org.botblocks.model.Block;
import org.botblocks.model.TriggerKey;

import java.util.List;

/**
 * All usable rules sharing one trigger key, in program order.
 *
 * @param key   The shared trigger key.
 * @param rules The member rules, never empty.
 */
public record TriggerGroup(TriggerKey key, List<IndexedRule> rules) {

    public TriggerGroup {
        rules = List.copyOf(rules);
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Trigger group " + key + " has no rules");
        }
    }

    /**
     * @return The event block of the first member; all members have an equal one.
     */
    public Block event() {
        return rules.get(0).rule().event();
    }
}
