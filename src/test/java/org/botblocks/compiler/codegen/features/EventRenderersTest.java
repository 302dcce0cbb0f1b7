package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.HandlerSignature;
import org.botblocks.model.StandardBlocks;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.botblocks.test.utils.Blocks.block;
import static org.botblocks.test.utils.Blocks.button;
import static org.botblocks.test.utils.Blocks.stateEquals;
import static org.botblocks.test.utils.Blocks.tap;

@Tag("unit")
class EventRenderersTest {

    @Test
    void buttonBindsTheNamedButton() {
        HandlerSignature signature = new ButtonEventRenderer().signature(button(2));

        assertThat(signature.header()).isEqualTo("onevent buttons(button.left):");
    }

    @Test
    void proximityBindsOnlySensorsThatMatter() {
        SensorEventRenderer renderer = new SensorEventRenderer("prox", "horizontal", "near", "clear");

        HandlerSignature signature = renderer.signature(block(StandardBlocks.PROXIMITY, 1, 0, 0, 0, 0, 0, 2));

        assertThat(signature.eventName()).isEqualTo("prox");
        assertThat(signature.bindings()).containsExactly("horizontal[0]=near", "horizontal[6]=clear");
        assertThat(signature.header()).isEqualTo("onevent prox(horizontal[0]=near, horizontal[6]=clear):");
    }

    @Test
    void groundWithAllDontCareHasNoBindings() {
        SensorEventRenderer renderer = new SensorEventRenderer("ground", "ground", "dark", "light");

        assertThat(renderer.signature(block(StandardBlocks.GROUND, 0, 0)).header()).isEqualTo("onevent ground():");
    }

    @Test
    void namedEventUsesFixedName() {
        assertThat(new NamedEventRenderer("tap").signature(tap()).header()).isEqualTo("onevent tap():");
    }

    @Test
    void stateEqualsComparesArrayElement() {
        assertThat(new StateEqualsRenderer().condition(stateEquals(2, 0))).isEqualTo("state[2] == 0");
    }

    @Test
    void stateDeclarationHasOneZeroPerVariable() {
        assertThat(StateMemory.declaration(4)).isEqualTo("var state[4] = [0,0,0,0]");
        assertThat(StateMemory.declaration(1)).isEqualTo("var state[1] = [0]");
    }
}
