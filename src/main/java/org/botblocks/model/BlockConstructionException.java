package org.botblocks.model;

/**
 * Thrown when a block cannot be created from an identity and raw parameter values.
 * The offending block is never created, so it can never be inserted into a rule.
 */
public class BlockConstructionException extends Exception {

    /**
     * Why the construction failed.
     */
    public enum Reason {
        /** A value lies outside its declared range, or the parameter count is wrong. */
        PARAMETER_OUT_OF_RANGE,
        /** No block type is registered under the requested identity. */
        UNKNOWN_IDENTITY
    }

    private final Reason reason;
    private final String identity;

    public BlockConstructionException(Reason reason, String identity, String message) {
        super(message);
        this.reason = reason;
        this.identity = identity;
    }

    public Reason getReason() {
        return reason;
    }

    public String getIdentity() {
        return identity;
    }
}
