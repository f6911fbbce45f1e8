package com.cipilot.orchestrator.pipeline;

/**
 * A pipeline definition that cannot be parsed or repaired into a valid shape.
 */
public class InvalidArtifactException extends RuntimeException {

    public InvalidArtifactException(String message) {
        super(message);
    }

    public InvalidArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
