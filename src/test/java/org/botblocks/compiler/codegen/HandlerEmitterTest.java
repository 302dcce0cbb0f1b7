package org.botblocks.compiler.codegen;

import org.botblocks.compiler.grouping.GuardBranch;
import org.botblocks.compiler.grouping.HandlerPlan;
import org.botblocks.compiler.grouping.IndexedRule;
import org.botblocks.model.Rule;
import org.botblocks.model.TriggerKey;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.botblocks.test.utils.Blocks.clap;
import static org.botblocks.test.utils.Blocks.sound;
import static org.botblocks.test.utils.Blocks.stateEquals;

@Tag("unit")
class HandlerEmitterTest {

    private final RendererRegistry renderers = RendererRegistry.initializeWithDefaults();

    private static IndexedRule rule(int index, int sound) {
        return new IndexedRule(index, Rule.builder().event(clap()).action(sound(sound)).build());
    }

    @Test
    void fallbackOnlyWritesStatementsDirectly() {
        HandlerPlan plan = new HandlerPlan(TriggerKey.of(clap()), clap(), List.of(), rule(0, 4));

        String text = new HandlerEmitter(renderers, "    ").emit(plan);

        assertThat(text).isEqualTo("onevent mic():\n    call sound.system(4)\n");
    }

    @Test
    void branchesUseConfiguredIndent() {
        GuardBranch branch = new GuardBranch(rule(0, 1), List.of(stateEquals(0, 1), stateEquals(1, 0)));
        HandlerPlan plan = new HandlerPlan(TriggerKey.of(clap()), clap(), List.of(branch), rule(1, 2));

        String text = new HandlerEmitter(renderers, "  ").emit(plan);

        assertThat(text).isEqualTo(String.join("\n",
                "onevent mic():",
                "  if state[0] == 1 and state[1] == 0 then",
                "    call sound.system(1)",
                "  else",
                "    call sound.system(2)",
                "  end",
                ""));
    }

    @Test
    void planWithoutRulesWritesHeaderOnly() {
        HandlerPlan plan = new HandlerPlan(TriggerKey.of(clap()), clap(), List.of(), null);

        assertThat(new HandlerEmitter(renderers, "\t").emit(plan)).isEqualTo("onevent mic():\n");
    }
}
