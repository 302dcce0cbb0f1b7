package org.botblocks.compiler.grouping;

import org.botblocks.model.Block;
import org.botblocks.model.Rule;
import org.botblocks.model.TriggerKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The guard tree of one handler: guarded branches in program order and an optional
 * unconditional fallback emitted as the trailing {@code else}, or as the whole body when
 * there are no branches.
 *
 * @param key      The trigger key of the handler.
 * @param event    The event block rendering the handler's opening.
 * @param branches Guarded branches in program order.
 * @param fallback The unguarded rule, or {@code null}.
 */
public record HandlerPlan(TriggerKey key, Block event, List<GuardBranch> branches, IndexedRule fallback) {

    public HandlerPlan {
        branches = List.copyOf(branches);
    }

    public Optional<IndexedRule> fallbackRule() {
        return Optional.ofNullable(fallback);
    }

    /**
     * @return All rules emitted by this plan: branches first, then the fallback.
     */
    public Stream<Rule> emittedRules() {
        return Stream.concat(branches.stream().map(b -> b.source().rule()), fallbackRule().stream().map(IndexedRule::rule));
    }

    /**
     * @return Program indices of the emitted rules in ascending order.
     */
    public List<Integer> ruleIndices() {
        List<Integer> indices = new ArrayList<>();
        branches.forEach(b -> indices.add(b.source().index()));
        fallbackRule().ifPresent(f -> indices.add(f.index()));
        indices.sort(null);
        return indices;
    }
}
