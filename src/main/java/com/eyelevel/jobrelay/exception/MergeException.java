package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown when no chunk of a session produced a usable result, or the merged artifact could not be written.
 */
public class MergeException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = -1835500632981127409L;

    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
