package com.vidnyan.cleanup.application.error;

/**
 * Base type for failures raised by the analysis core.
 */
public class CleanupException extends RuntimeException {

    public CleanupException(String message) {
        super(message);
    }

    public CleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
