package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown for input the relay refuses to submit: unparseable CSV, an empty dataset, or a chunk size
 * outside the configured bounds.
 */
public class InvalidDatasetException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = 8817029455360215537L;

    public InvalidDatasetException(String message) {
        super(message);
    }

    public InvalidDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
