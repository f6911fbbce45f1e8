package com.cipilot.orchestrator.analyzer;

/**
 * The repository does not exist or the supplied credential cannot read it.
 */
public class RepositoryNotFoundException extends RuntimeException {

    public RepositoryNotFoundException(String message) {
        super(message);
    }

    public RepositoryNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
