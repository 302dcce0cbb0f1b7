package org.botblocks.compiler.grouping;

import org.botblocks.model.Rule;
import org.botblocks.model.TriggerKey;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.botblocks.test.utils.Blocks.button;
import static org.botblocks.test.utils.Blocks.sound;
import static org.botblocks.test.utils.Blocks.stateEquals;
import static org.botblocks.test.utils.Blocks.tap;

@Tag("unit")
class TriggerGrouperTest {

    private static IndexedRule indexed(int index, Rule rule) {
        return new IndexedRule(index, rule);
    }

    @Test
    void groupsByIdentityAndParameters() {
        List<IndexedRule> rules = List.of(
                indexed(0, Rule.builder().event(button(0)).action(sound(1)).build()),
                indexed(1, Rule.builder().event(button(1)).action(sound(2)).build()),
                indexed(2, Rule.builder().event(tap()).action(sound(3)).build()),
                indexed(3, Rule.builder().event(button(0)).state(stateEquals(0, 1)).action(sound(4)).build()));

        List<TriggerGroup> groups = TriggerGrouper.group(rules);

        assertThat(groups).extracting(TriggerGroup::key).containsExactly(
                new TriggerKey("button-pressed", List.of(0)),
                new TriggerKey("button-pressed", List.of(1)),
                new TriggerKey("tap", List.of()));
        assertThat(groups.get(0).rules()).extracting(IndexedRule::index).containsExactly(0, 3);
        assertThat(groups.get(0).event()).isEqualTo(button(0));
    }

    @Test
    void emptyInputGivesNoGroups() {
        assertThat(TriggerGrouper.group(List.of())).isEmpty();
    }

    @Test
    void ruleWithoutEventIsRejected() {
        List<IndexedRule> rules = List.of(indexed(5, Rule.builder().action(sound(1)).build()));

        assertThatThrownBy(() -> TriggerGrouper.group(rules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Rule 5");
    }
}
