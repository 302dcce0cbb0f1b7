package org.botblocks.model;

import org.botblocks.diagnostics.Diagnostic;
import org.botblocks.diagnostics.DiagnosticCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * One "when / with state / do" rule, the event-actions set of the visual editor.
 * <p>
 * A rule owns its blocks as immutable values. The event is {@code null} while the user has not
 * placed one yet; such a rule is incomplete and never emitted.
 *
 * @param event   The trigger, or {@code null} if missing.
 * @param states  The conjunctive guard; empty means unconditional.
 * @param actions The effects in execution order.
 */
public record Rule(Block event, List<Block> states, List<Block> actions) {

    public Rule {
        states = states == null ? List.of() : List.copyOf(states);
        actions = actions == null ? List.of() : List.copyOf(actions);
        if (event != null && event.kind() != BlockKind.EVENT) {
            throw new IllegalArgumentException("Event slot holds a " + event.kind() + " block: " + event);
        }
        requireKind(states, BlockKind.STATE);
        requireKind(actions, BlockKind.ACTION);
    }

    private static void requireKind(List<Block> blocks, BlockKind kind) {
        for (Block block : blocks) {
            if (block.kind() != kind) {
                throw new IllegalArgumentException("Expected " + kind + " block but got " + block.kind() + ": " + block);
            }
        }
    }

    public boolean hasEvent() {
        return event != null;
    }

    /**
     * @return {@code true} if the rule carries at least one state block.
     */
    public boolean isGuarded() {
        return !states.isEmpty();
    }

    /**
     * @return The trigger key used for grouping, empty if the rule has no event.
     */
    public Optional<TriggerKey> triggerKey() {
        return hasEvent() ? Optional.of(TriggerKey.of(event)) : Optional.empty();
    }

    /**
     * @return The distinct state conditions of the guard in their original order.
     */
    public Set<Block> guardConditions() {
        return new LinkedHashSet<>(states);
    }

    /**
     * @return All blocks of the rule: event first, then states, then actions.
     */
    public Stream<Block> blocks() {
        return Stream.concat(Stream.ofNullable(event), Stream.concat(states.stream(), actions.stream()));
    }

    /**
     * Checks the rule's structure. Every finding is reported, not only the first one.
     *
     * @param ruleIndex The rule's index in its program, attached to each diagnostic.
     * @return The findings in a fixed order: missing event, empty actions, contradictions.
     */
    public List<Diagnostic> validate(int ruleIndex) {
        List<Diagnostic> findings = new ArrayList<>();
        if (!hasEvent()) {
            findings.add(Diagnostic.of(DiagnosticCode.MISSING_EVENT, ruleIndex, "Rule has no event block"));
        }
        if (actions.isEmpty()) {
            findings.add(Diagnostic.of(DiagnosticCode.EMPTY_ACTION_LIST, ruleIndex, "Rule has no action block and has no effect"));
        }
        contradictedVariables().forEach(variable -> findings.add(Diagnostic.of(DiagnosticCode.CONTRADICTORY_GUARD, ruleIndex,
                "State " + variable + " is required to hold different values; the rule can never fire")));
        return findings;
    }

    /**
     * @return {@code true} if two state blocks require different values of one variable.
     */
    public boolean hasContradictoryGuard() {
        return !contradictedVariables().isEmpty();
    }

    private Set<String> contradictedVariables() {
        Map<String, List<Integer>> required = new LinkedHashMap<>();
        Set<String> contradicted = new LinkedHashSet<>();
        for (Block state : states) {
            String variable = stateVariable(state);
            List<Integer> value = state.parameters().isEmpty() ? List.of() : state.parameters().subList(1, state.parameters().size());
            List<Integer> previous = required.putIfAbsent(variable, value);
            if (previous != null && !previous.equals(value)) {
                contradicted.add(variable);
            }
        }
        return contradicted;
    }

    // A state block's first parameter names the variable it tests.
    private static String stateVariable(Block state) {
        return state.parameters().isEmpty() ? state.identity() : state.identity() + "[" + state.parameter(0) + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mostly for hosts and tests assembling rules by hand.
     */
    public static final class Builder {
        private Block event;
        private final List<Block> states = new ArrayList<>();
        private final List<Block> actions = new ArrayList<>();

        private Builder() {}

        public Builder event(Block event) {
            this.event = event;
            return this;
        }

        public Builder state(Block state) {
            states.add(state);
            return this;
        }

        public Builder action(Block action) {
            actions.add(action);
            return this;
        }

        public Rule build() {
            return new Rule(event, states, actions);
        }
    }
}
