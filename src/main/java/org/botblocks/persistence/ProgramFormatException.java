package org.botblocks.persistence;

import java.io.IOException;

/**
 * Thrown when a stored program cannot be read back, either because the JSON is malformed or
 * because a block in it fails construction.
 */
public class ProgramFormatException extends IOException {

    public ProgramFormatException(String message) {
        super(message);
    }

    public ProgramFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
