package com.vidnyan.cleanup.application.error;

import lombok.Getter;

/**
 * A finding store could not be reached or rejected an operation.
 */
@Getter
public class StoreConnectivityException extends CleanupException {

    private final String store;
    private final String operation;

    public StoreConnectivityException(String store, String operation, Throwable cause) {
        super("Store '" + store + "' failed during " + operation + ": " + cause.getMessage(), cause);
        this.store = store;
        this.operation = operation;
    }
}
