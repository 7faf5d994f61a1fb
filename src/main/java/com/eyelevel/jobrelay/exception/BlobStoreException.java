package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown when the object store cannot be reached or rejects an operation. Absence of an object is
 * never reported this way.
 */
public class BlobStoreException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = -6082730519862771045L;

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
