package org.botblocks.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link BlockCatalog} factory and the standard palette.
 */
@Tag("unit")
class BlockCatalogTest {

    private final BlockCatalog catalog = BlockCatalog.initializeWithDefaults();

    @Test
    void createReturnsBlockWithTypeAndParameters() throws BlockConstructionException {
        Block block = catalog.create(StandardBlocks.SET_MOTOR_SPEED, -500, 500);

        assertThat(block.kind()).isEqualTo(BlockKind.ACTION);
        assertThat(block.identity()).isEqualTo("set-motor-speed");
        assertThat(block.parameters()).containsExactly(-500, 500);
    }

    @Test
    void outOfRangeParameterIsRejectedAtConstruction() {
        assertThatThrownBy(() -> catalog.create(StandardBlocks.SET_MOTOR_SPEED, 0, 501))
                .isInstanceOf(BlockConstructionException.class)
                .hasMessageContaining("right")
                .extracting(e -> ((BlockConstructionException) e).getReason())
                .isEqualTo(BlockConstructionException.Reason.PARAMETER_OUT_OF_RANGE);
    }

    @Test
    void wrongArityIsRejectedAsOutOfRange() {
        assertThatThrownBy(() -> catalog.create(StandardBlocks.BUTTON_PRESSED, 1, 2))
                .isInstanceOf(BlockConstructionException.class)
                .hasMessageContaining("expects 1 parameter(s) but got 2");
    }

    @Test
    void unknownIdentityIsRejected() {
        assertThatThrownBy(() -> catalog.create("launch-rocket"))
                .isInstanceOf(BlockConstructionException.class)
                .satisfies(e -> {
                    BlockConstructionException ce = (BlockConstructionException) e;
                    assertThat(ce.getReason()).isEqualTo(BlockConstructionException.Reason.UNKNOWN_IDENTITY);
                    assertThat(ce.getIdentity()).isEqualTo("launch-rocket");
                });
    }

    @Test
    void blocksAreImmutableValues() throws BlockConstructionException {
        Block first = catalog.create(StandardBlocks.STATE_EQUALS, 2, 1);
        Block second = catalog.create(StandardBlocks.STATE_EQUALS, List.of(2, 1));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThatThrownBy(() -> first.parameters().set(0, 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void registeredTypeReplacesEarlierRegistration() throws BlockConstructionException {
        catalog.register(new BlockType(StandardBlocks.PLAY_SOUND, BlockKind.ACTION, List.of(new ParameterSpec("sound", 0, 20))));

        assertThat(catalog.create(StandardBlocks.PLAY_SOUND, 15).parameter(0)).isEqualTo(15);
        assertThat(catalog.types()).extracting(BlockType::identity).containsOnlyOnce(StandardBlocks.PLAY_SOUND);
    }

    @Test
    void standardPaletteMarksStateMemoryBlocks() {
        assertThat(catalog.types())
                .filteredOn(BlockType::touchesStateMemory)
                .extracting(BlockType::identity)
                .containsExactlyInAnyOrder(StandardBlocks.STATE_EQUALS, StandardBlocks.SET_STATE);
    }
}
