package org.botblocks.compiler.grouping;

import org.botblocks.compiler.DuplicateUnconditionalPolicy;
import org.botblocks.diagnostics.Diagnostic;
import org.botblocks.diagnostics.DiagnosticCode;
import org.botblocks.diagnostics.DiagnosticSink;
import org.botblocks.diagnostics.DiagnosticsEngine;
import org.botblocks.model.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.botblocks.test.utils.Blocks.sound;
import static org.botblocks.test.utils.Blocks.stateEquals;
import static org.botblocks.test.utils.Blocks.tap;

@Tag("unit")
class GuardPlannerTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine(DiagnosticSink.none());
    }

    private static TriggerGroup tapGroup(Rule... rules) {
        List<IndexedRule> members = new ArrayList<>();
        for (int i = 0; i < rules.length; i++) {
            members.add(new IndexedRule(i, rules[i]));
        }
        return TriggerGrouper.group(members).get(0);
    }

    private static Rule unguarded(int sound) {
        return Rule.builder().event(tap()).action(sound(sound)).build();
    }

    @Test
    void singleUnguardedRuleBecomesFallbackOnly() {
        HandlerPlan plan = new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics)
                .plan(tapGroup(unguarded(1))).orElseThrow();

        assertThat(plan.branches()).isEmpty();
        assertThat(plan.fallbackRule()).map(IndexedRule::index).contains(0);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void fallbackIsTakenFromAnyPosition() {
        TriggerGroup group = tapGroup(
                Rule.builder().event(tap()).state(stateEquals(0, 1)).action(sound(1)).build(),
                unguarded(2),
                Rule.builder().event(tap()).state(stateEquals(0, 0)).action(sound(3)).build());

        HandlerPlan plan = new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics).plan(group).orElseThrow();

        assertThat(plan.branches()).extracting(b -> b.source().index()).containsExactly(0, 2);
        assertThat(plan.fallback().index()).isEqualTo(1);
        assertThat(plan.ruleIndices()).containsExactly(0, 1, 2);
    }

    @Test
    void repeatedConditionsAreMergedInBranch() {
        TriggerGroup group = tapGroup(Rule.builder().event(tap())
                .state(stateEquals(1, 1)).state(stateEquals(1, 1)).state(stateEquals(2, 0))
                .action(sound(1)).build());

        HandlerPlan plan = new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics).plan(group).orElseThrow();

        assertThat(plan.branches().get(0).conditions()).containsExactly(stateEquals(1, 1), stateEquals(2, 0));
    }

    @Test
    void keepFirstReportsEveryExtraUnguardedRule() {
        Optional<HandlerPlan> plan = new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics)
                .plan(tapGroup(unguarded(1), unguarded(2), unguarded(3)));

        assertThat(plan).isPresent();
        assertThat(plan.get().ruleIndices()).containsExactly(0);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::ruleIndex).containsExactly(1, 2);
        assertThat(diagnostics.getDiagnostics()).allSatisfy(d ->
                assertThat(d.code()).isEqualTo(DiagnosticCode.DUPLICATE_UNCONDITIONAL_RULE));
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("rule 0");
    }

    @Test
    void rejectGroupDropsThePlan() {
        Optional<HandlerPlan> plan = new GuardPlanner(DuplicateUnconditionalPolicy.REJECT_GROUP, diagnostics)
                .plan(tapGroup(unguarded(1), unguarded(2)));

        assertThat(plan).isEmpty();
        assertThat(diagnostics.hasErrorFor(1)).isTrue();
    }

    @Test
    void identicalGuardIsUnreachable() {
        TriggerGroup group = tapGroup(
                Rule.builder().event(tap()).state(stateEquals(0, 1)).action(sound(1)).build(),
                Rule.builder().event(tap()).state(stateEquals(0, 1)).action(sound(2)).build());

        HandlerPlan plan = new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics).plan(group).orElseThrow();

        assertThat(plan.branches()).hasSize(2);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.UNREACHABLE_RULE);
            assertThat(d.ruleIndex()).isEqualTo(1);
        });
    }

    @Test
    void narrowerEarlierGuardDoesNotShadow() {
        TriggerGroup group = tapGroup(
                Rule.builder().event(tap()).state(stateEquals(0, 1)).state(stateEquals(1, 1)).action(sound(1)).build(),
                Rule.builder().event(tap()).state(stateEquals(0, 1)).action(sound(2)).build());

        new GuardPlanner(DuplicateUnconditionalPolicy.KEEP_FIRST, diagnostics).plan(group);

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }
}
