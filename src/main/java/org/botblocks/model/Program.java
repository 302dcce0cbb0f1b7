package org.botblocks.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The whole visual program: an ordered list of rules. Order is the visual top-to-bottom order
 * and decides branch precedence inside a merged handler.
 *
 * @param rules The rules in program order.
 */
public record Program(List<Rule> rules) {

    public Program {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static Program empty() {
        return new Program(List.of());
    }

    public static Program of(Rule... rules) {
        return new Program(List.of(rules));
    }

    public int size() {
        return rules.size();
    }

    public Rule rule(int index) {
        return rules.get(index);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * @param index Index of the rule to drop.
     * @return A new program without that rule.
     */
    public Program without(int index) {
        List<Rule> copy = new ArrayList<>(rules);
        copy.remove(index);
        return new Program(copy);
    }
}
