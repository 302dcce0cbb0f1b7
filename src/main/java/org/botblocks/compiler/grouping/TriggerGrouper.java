package org.botblocks.compiler.grouping;

import org.botblocks.model.TriggerKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions usable rules by trigger key. Groups come out in order of first occurrence,
 * members in program order.
 */
public final class TriggerGrouper {

    private TriggerGrouper() {}

    /**
     * @param usable Rules with an event, in program order.
     * @return The trigger groups.
     * @throws IllegalArgumentException if a rule has no event.
     */
    public static List<TriggerGroup> group(List<IndexedRule> usable) {
        Map<TriggerKey, List<IndexedRule>> byKey = new LinkedHashMap<>();
        for (IndexedRule candidate : usable) {
            TriggerKey key = candidate.rule().triggerKey()
                    .orElseThrow(() -> new IllegalArgumentException("Rule " + candidate.index() + " has no event"));
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
        }
        List<TriggerGroup> groups = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> groups.add(new TriggerGroup(key, members)));
        return groups;
    }
}
