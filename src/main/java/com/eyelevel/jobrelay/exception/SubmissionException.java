package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown when a job could not be fully written to the store. The status record may have been left
 * in {@code uploading}.
 */
public class SubmissionException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = 3351260988451130972L;

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
