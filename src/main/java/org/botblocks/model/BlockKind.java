package org.botblocks.model;

/**
 * The three kinds of visual blocks a rule is assembled from.
 */
public enum BlockKind {
    /** Trigger of a rule, becomes the handler the rule is merged into. */
    EVENT,
    /** Condition on the robot's state memory, part of a rule's guard. */
    STATE,
    /** Effect executed when the rule fires. */
    ACTION
}
