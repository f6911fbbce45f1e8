package com.cipilot.orchestrator.claude;

/**
 * The model API answered with an error status or could not be reached.
 * statusCode is -1 when no HTTP response was received.
 */
public class ModelUnavailableException extends RuntimeException {

    private final int statusCode;

    public ModelUnavailableException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }
}
