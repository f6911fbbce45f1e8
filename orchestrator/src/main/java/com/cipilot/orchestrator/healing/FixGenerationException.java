package com.cipilot.orchestrator.healing;

/**
 * The model could not produce a usable fix, even after the immediate retry.
 */
public class FixGenerationException extends RuntimeException {

    public FixGenerationException(String message) {
        super(message);
    }

    public FixGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
