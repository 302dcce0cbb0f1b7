package org.botblocks.compiler.grouping;

import org.botblocks.model.Rule;

/**
 * A rule together with its index in the compiled program.
 *
 * @param index The program index, used in diagnostics.
 * @param rule  The rule.
 */
public record IndexedRule(int index, Rule rule) {
}
