package org.botblocks.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The standard block palette of the robot: identities and type descriptors.
 */
public final class StandardBlocks {

    // region Events
    public static final String BUTTON_PRESSED = "button-pressed";
    public static final String PROXIMITY = "proximity";
    public static final String GROUND = "ground";
    public static final String TAP = "tap";
    public static final String CLAP = "clap";
    public static final String TIMER_ELAPSED = "timer-elapsed";
    // endregion

    // region States
    public static final String STATE_EQUALS = "state-equals";
    // endregion

    // region Actions
    public static final String SET_MOTOR_SPEED = "set-motor-speed";
    public static final String SET_TOP_COLOR = "set-top-color";
    public static final String SET_BOTTOM_COLOR = "set-bottom-color";
    public static final String PLAY_SOUND = "play-sound";
    public static final String SET_STATE = "set-state";
    public static final String START_TIMER = "start-timer";
    // endregion

    /** Number of state variables in the robot's state memory. */
    public static final int STATE_VARIABLES = 4;
    /** Number of front and rear horizontal proximity sensors. */
    public static final int PROXIMITY_SENSORS = 7;
    /** Number of ground sensors. */
    public static final int GROUND_SENSORS = 2;
    /** Largest absolute motor target. */
    public static final int MAX_MOTOR_SPEED = 500;
    /** Largest intensity of one LED color channel. */
    public static final int MAX_COLOR = 32;
    /** Number of built-in system sounds. */
    public static final int SYSTEM_SOUNDS = 8;
    /** Longest timer period in milliseconds. */
    public static final int MAX_TIMER_PERIOD = 10000;

    private StandardBlocks() {}

    /**
     * @return Descriptors of all standard block types, events first, then states, then actions.
     */
    public static List<BlockType> types() {
        List<BlockType> types = new ArrayList<>();
        types.add(new BlockType(BUTTON_PRESSED, BlockKind.EVENT, List.of(new ParameterSpec("button", 0, 4))));
        types.add(new BlockType(PROXIMITY, BlockKind.EVENT, repeated("sensor", PROXIMITY_SENSORS, 0, 2)));
        types.add(new BlockType(GROUND, BlockKind.EVENT, repeated("sensor", GROUND_SENSORS, 0, 2)));
        types.add(new BlockType(TAP, BlockKind.EVENT, List.of()));
        types.add(new BlockType(CLAP, BlockKind.EVENT, List.of()));
        types.add(new BlockType(TIMER_ELAPSED, BlockKind.EVENT, List.of()));

        types.add(new BlockType(STATE_EQUALS, BlockKind.STATE, List.of(
                new ParameterSpec("variable", 0, STATE_VARIABLES - 1),
                new ParameterSpec("value", 0, 1)), true));

        types.add(new BlockType(SET_MOTOR_SPEED, BlockKind.ACTION, List.of(
                new ParameterSpec("left", -MAX_MOTOR_SPEED, MAX_MOTOR_SPEED),
                new ParameterSpec("right", -MAX_MOTOR_SPEED, MAX_MOTOR_SPEED))));
        types.add(new BlockType(SET_TOP_COLOR, BlockKind.ACTION, rgb()));
        types.add(new BlockType(SET_BOTTOM_COLOR, BlockKind.ACTION, rgb()));
        types.add(new BlockType(PLAY_SOUND, BlockKind.ACTION, List.of(new ParameterSpec("sound", 0, SYSTEM_SOUNDS - 1))));
        types.add(new BlockType(SET_STATE, BlockKind.ACTION, repeated("variable", STATE_VARIABLES, 0, 2), true));
        types.add(new BlockType(START_TIMER, BlockKind.ACTION, List.of(new ParameterSpec("period", 0, MAX_TIMER_PERIOD))));
        return types;
    }

    private static List<ParameterSpec> rgb() {
        return List.of(
                new ParameterSpec("red", 0, MAX_COLOR),
                new ParameterSpec("green", 0, MAX_COLOR),
                new ParameterSpec("blue", 0, MAX_COLOR));
    }

    private static List<ParameterSpec> repeated(String prefix, int count, int min, int max) {
        List<ParameterSpec> specs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            specs.add(new ParameterSpec(prefix + i, min, max));
        }
        return specs;
    }
}
