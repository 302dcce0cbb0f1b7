package org.botblocks.compiler.codegen;

import org.botblocks.compiler.codegen.features.ButtonEventRenderer;
import org.botblocks.compiler.codegen.features.LedColorActionRenderer;
import org.botblocks.compiler.codegen.features.MotorActionRenderer;
import org.botblocks.compiler.codegen.features.NamedEventRenderer;
import org.botblocks.compiler.codegen.features.SensorEventRenderer;
import org.botblocks.compiler.codegen.features.SetStateActionRenderer;
import org.botblocks.compiler.codegen.features.SoundActionRenderer;
import org.botblocks.compiler.codegen.features.StateEqualsRenderer;
import org.botblocks.compiler.codegen.features.TimerActionRenderer;
import org.botblocks.model.Block;
import org.botblocks.model.BlockKind;
import org.botblocks.model.StandardBlocks;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping block identities to their renderers, one table per block kind.
 * <p>
 * Adding a block identity means registering one renderer. The registry is filled once
 * and then only read, so it can be shared by concurrent compilations.
 */
public final class RendererRegistry {

    private final Map<String, IEventRenderer> events = new HashMap<>();
    private final Map<String, IStateRenderer> states = new HashMap<>();
    private final Map<String, IActionRenderer> actions = new HashMap<>();

    public void registerEvent(String identity, IEventRenderer renderer) {
        events.put(identity, renderer);
    }

    public void registerState(String identity, IStateRenderer renderer) {
        states.put(identity, renderer);
    }

    public void registerAction(String identity, IActionRenderer renderer) {
        actions.put(identity, renderer);
    }

    public Optional<IEventRenderer> eventRenderer(String identity) {
        return Optional.ofNullable(events.get(identity));
    }

    public Optional<IStateRenderer> stateRenderer(String identity) {
        return Optional.ofNullable(states.get(identity));
    }

    public Optional<IActionRenderer> actionRenderer(String identity) {
        return Optional.ofNullable(actions.get(identity));
    }

    /**
     * @param block The block to check.
     * @return {@code true} if a renderer for the block's kind and identity is registered.
     */
    public boolean supports(Block block) {
        return supports(block.kind(), block.identity());
    }

    /**
     * @param kind     The block kind.
     * @param identity The block identity.
     * @return {@code true} if a renderer of that kind is registered for the identity.
     */
    public boolean supports(BlockKind kind, String identity) {
        return switch (kind) {
            case EVENT -> events.containsKey(identity);
            case STATE -> states.containsKey(identity);
            case ACTION -> actions.containsKey(identity);
        };
    }

    /**
     * Renders an event block.
     *
     * @param event The event block.
     * @return The handler signature.
     * @throws IllegalStateException if no renderer is registered; callers check {@link #supports(Block)} first.
     */
    public HandlerSignature signature(Block event) {
        return eventRenderer(event.identity())
                .orElseThrow(() -> missing(BlockKind.EVENT, event))
                .signature(event);
    }

    /**
     * Renders a state block.
     *
     * @param state The state block.
     * @return The condition expression.
     * @throws IllegalStateException if no renderer is registered.
     */
    public String condition(Block state) {
        return stateRenderer(state.identity())
                .orElseThrow(() -> missing(BlockKind.STATE, state))
                .condition(state);
    }

    /**
     * Renders an action block into the writer.
     *
     * @param action The action block.
     * @param out    The output writer.
     * @throws IllegalStateException if no renderer is registered.
     */
    public void render(Block action, ScriptWriter out) {
        actionRenderer(action.identity())
                .orElseThrow(() -> missing(BlockKind.ACTION, action))
                .render(action, out);
    }

    private static IllegalStateException missing(BlockKind kind, Block block) {
        return new IllegalStateException("No " + kind + " renderer registered for '" + block.identity() + "'");
    }

    /**
     * Initializes a registry with renderers for every {@link StandardBlocks} identity.
     *
     * @return A registry pre-populated with the standard renderers.
     */
    public static RendererRegistry initializeWithDefaults() {
        RendererRegistry reg = new RendererRegistry();
        reg.registerEvent(StandardBlocks.BUTTON_PRESSED, new ButtonEventRenderer());
        reg.registerEvent(StandardBlocks.PROXIMITY, new SensorEventRenderer("prox", "horizontal", "near", "clear"));
        reg.registerEvent(StandardBlocks.GROUND, new SensorEventRenderer("ground", "ground", "dark", "light"));
        reg.registerEvent(StandardBlocks.TAP, new NamedEventRenderer("tap"));
        reg.registerEvent(StandardBlocks.CLAP, new NamedEventRenderer("mic"));
        reg.registerEvent(StandardBlocks.TIMER_ELAPSED, new NamedEventRenderer("timer0"));

        reg.registerState(StandardBlocks.STATE_EQUALS, new StateEqualsRenderer());

        reg.registerAction(StandardBlocks.SET_MOTOR_SPEED, new MotorActionRenderer());
        reg.registerAction(StandardBlocks.SET_TOP_COLOR, new LedColorActionRenderer(List.of("leds.top")));
        reg.registerAction(StandardBlocks.SET_BOTTOM_COLOR, new LedColorActionRenderer(List.of("leds.bottom.left", "leds.bottom.right")));
        reg.registerAction(StandardBlocks.PLAY_SOUND, new SoundActionRenderer());
        reg.registerAction(StandardBlocks.SET_STATE, new SetStateActionRenderer());
        reg.registerAction(StandardBlocks.START_TIMER, new TimerActionRenderer());
        return reg;
    }
}
