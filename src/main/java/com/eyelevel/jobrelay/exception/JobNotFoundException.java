package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown when a job, session or artifact the caller asked for does not exist.
 */
public class JobNotFoundException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = 7439928106723041154L;

    public JobNotFoundException(String message) {
        super(message);
    }
}
