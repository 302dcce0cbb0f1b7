package org.botblocks.compiler;

import java.util.Locale;

/**
 * What the compiler does with a trigger group that holds more than one rule without a guard.
 * Either way every extra rule is reported as {@code DUPLICATE_UNCONDITIONAL_RULE}.
 */
public enum DuplicateUnconditionalPolicy {
    /** Emit the group using the first unguarded rule in program order. */
    KEEP_FIRST,
    /** Leave the whole group out of the script. */
    REJECT_GROUP;

    /**
     * Parses a policy name leniently: case-insensitive, dashes allowed for underscores.
     *
     * @param name The configured name.
     * @return The policy.
     * @throws IllegalArgumentException if the name matches no policy.
     */
    public static DuplicateUnconditionalPolicy parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
