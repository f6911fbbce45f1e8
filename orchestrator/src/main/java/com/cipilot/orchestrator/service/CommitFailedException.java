package com.cipilot.orchestrator.service;

/**
 * Writing the artifact to version control failed (auth, network, branch conflict).
 * Fatal to the workflow and reported to the caller.
 */
public class CommitFailedException extends RuntimeException {

    public CommitFailedException(String message) {
        super(message);
    }

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
