package com.cipilot.orchestrator.claude;

/**
 * The model call did not answer within the configured request timeout.
 */
public class ModelTimeoutException extends RuntimeException {

    public ModelTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
