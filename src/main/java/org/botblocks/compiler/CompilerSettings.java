package org.botblocks.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.botblocks.model.StandardBlocks;

/**
 * Immutable compiler options.
 *
 * @param duplicatePolicy      Handling of trigger groups with several unguarded rules.
 * @param indent               Indentation unit of the emitted script.
 * @param emitStateDeclaration Whether to declare the state memory when the script uses it.
 * @param stateVariableCount   Size of the declared state memory; at least
 *                             {@link StandardBlocks#STATE_VARIABLES}, the number of variables state blocks address.
 */
public record CompilerSettings(
        DuplicateUnconditionalPolicy duplicatePolicy,
        String indent,
        boolean emitStateDeclaration,
        int stateVariableCount
) {
    /** Config path of the compiler block. */
    public static final String CONFIG_PATH = "botblocks.compiler";

    private static final String POLICY_KEY = "duplicate-unconditional-policy";
    private static final String INDENT_KEY = "indent";
    private static final String DECLARATION_KEY = "emit-state-declaration";
    private static final String STATE_COUNT_KEY = "state-variable-count";

    public CompilerSettings {
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("Duplicate policy must not be null");
        }
        if (indent == null) {
            throw new IllegalArgumentException("Indent must not be null");
        }
        if (stateVariableCount < StandardBlocks.STATE_VARIABLES) {
            throw new IllegalArgumentException("State variable count must be at least " + StandardBlocks.STATE_VARIABLES
                    + " but was " + stateVariableCount);
        }
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(DuplicateUnconditionalPolicy.KEEP_FIRST, "\t", true, StandardBlocks.STATE_VARIABLES);
    }

    /**
     * @param policy The policy to use.
     * @return A copy of these settings with another duplicate policy.
     */
    public CompilerSettings withDuplicatePolicy(DuplicateUnconditionalPolicy policy) {
        return new CompilerSettings(policy, indent, emitStateDeclaration, stateVariableCount);
    }

    /**
     * Reads the {@value #CONFIG_PATH} block. Missing keys keep their {@link #defaults()} value.
     *
     * @param config The application configuration.
     * @return The settings.
     * @throws ConfigException.BadValue if the duplicate policy name is unknown or the state
     *                                  variable count is too small.
     */
    public static CompilerSettings fromConfig(Config config) {
        CompilerSettings defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config options = config.getConfig(CONFIG_PATH);

        DuplicateUnconditionalPolicy policy = defaults.duplicatePolicy();
        if (options.hasPath(POLICY_KEY)) {
            String name = options.getString(POLICY_KEY);
            try {
                policy = DuplicateUnconditionalPolicy.parse(name);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(CONFIG_PATH + "." + POLICY_KEY, "Unknown policy '" + name + "'", e);
            }
        }
        String indent = options.hasPath(INDENT_KEY) ? options.getString(INDENT_KEY) : defaults.indent();
        boolean declare = options.hasPath(DECLARATION_KEY) ? options.getBoolean(DECLARATION_KEY) : defaults.emitStateDeclaration();
        int stateCount = options.hasPath(STATE_COUNT_KEY) ? options.getInt(STATE_COUNT_KEY) : defaults.stateVariableCount();
        if (stateCount < StandardBlocks.STATE_VARIABLES) {
            throw new ConfigException.BadValue(CONFIG_PATH + "." + STATE_COUNT_KEY,
                    "Must be at least " + StandardBlocks.STATE_VARIABLES + " but was " + stateCount);
        }
        return new CompilerSettings(policy, indent, declare, stateCount);
    }
}
