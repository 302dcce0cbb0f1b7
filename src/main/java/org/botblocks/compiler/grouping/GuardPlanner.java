package org.botblocks.compiler.grouping;

import org.botblocks.compiler.DuplicateUnconditionalPolicy;
import org.botblocks.diagnostics.DiagnosticCode;
import org.botblocks.diagnostics.DiagnosticsEngine;
import org.botblocks.model.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a trigger group into a {@link HandlerPlan}.
 * <p>
 * Guarded rules become an if / elseif chain in program order. The first unguarded rule is the
 * fallback, wherever it is listed; further unguarded rules are ambiguous duplicates handled
 * according to the {@link DuplicateUnconditionalPolicy}. A guarded rule whose guard implies
 * the guard of an earlier, satisfiable branch can never fire and is reported as unreachable,
 * but its branch is still emitted.
 */
public class GuardPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(GuardPlanner.class);

    private final DuplicateUnconditionalPolicy policy;
    private final DiagnosticsEngine diagnostics;

    public GuardPlanner(DuplicateUnconditionalPolicy policy, DiagnosticsEngine diagnostics) {
        this.policy = policy;
        this.diagnostics = diagnostics;
    }

    /**
     * @param group The trigger group to plan.
     * @return The plan, or empty if the group is rejected.
     */
    public Optional<HandlerPlan> plan(TriggerGroup group) {
        List<IndexedRule> guarded = new ArrayList<>();
        List<IndexedRule> unguarded = new ArrayList<>();
        for (IndexedRule member : group.rules()) {
            (member.rule().isGuarded() ? guarded : unguarded).add(member);
        }

        if (unguarded.size() > 1) {
            IndexedRule first = unguarded.get(0);
            for (IndexedRule extra : unguarded.subList(1, unguarded.size())) {
                diagnostics.report(DiagnosticCode.DUPLICATE_UNCONDITIONAL_RULE, extra.index(),
                        String.format("Rule has no state guard and shares trigger %s with rule %d", group.key(), first.index()));
            }
            if (policy == DuplicateUnconditionalPolicy.REJECT_GROUP) {
                LOG.debug("Rejecting handler {}: {} unconditional rules", group.key(), unguarded.size());
                return Optional.empty();
            }
        }

        List<GuardBranch> branches = new ArrayList<>(guarded.size());
        for (int i = 0; i < guarded.size(); i++) {
            IndexedRule candidate = guarded.get(i);
            Set<Block> conditions = candidate.rule().guardConditions();
            if (!candidate.rule().hasContradictoryGuard()) {
                findShadowingRule(guarded.subList(0, i), conditions).ifPresent(shadow ->
                        diagnostics.report(DiagnosticCode.UNREACHABLE_RULE, candidate.index(),
                                String.format("Rule can never fire: rule %d on trigger %s already matches whenever its guard holds",
                                        shadow.index(), group.key())));
            }
            branches.add(new GuardBranch(candidate, new ArrayList<>(conditions)));
        }

        IndexedRule fallback = unguarded.isEmpty() ? null : unguarded.get(0);
        return Optional.of(new HandlerPlan(group.key(), group.event(), branches, fallback));
    }

    // An earlier branch shadows when its conditions are a subset of the candidate's conditions.
    private static Optional<IndexedRule> findShadowingRule(List<IndexedRule> earlier, Set<Block> conditions) {
        for (IndexedRule previous : earlier) {
            if (previous.rule().hasContradictoryGuard()) {
                continue;
            }
            if (conditions.containsAll(previous.rule().guardConditions())) {
                return Optional.of(previous);
            }
        }
        return Optional.empty();
    }
}
