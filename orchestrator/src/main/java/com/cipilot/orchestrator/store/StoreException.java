package com.cipilot.orchestrator.store;

/**
 * Thrown when the template / learned-config store returns an error or is unreachable.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
