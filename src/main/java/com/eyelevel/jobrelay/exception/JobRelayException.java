package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * A base exception for errors raised while relaying jobs between callers and workers.
 */
public class JobRelayException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2291846730617302218L;

    public JobRelayException(String message) {
        super(message);
    }

    public JobRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
