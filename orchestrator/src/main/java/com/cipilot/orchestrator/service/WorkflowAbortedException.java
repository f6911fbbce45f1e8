package com.cipilot.orchestrator.service;

/**
 * The background task stopped because its workflow was aborted or the process
 * is shutting down.
 */
public class WorkflowAbortedException extends RuntimeException {

    public WorkflowAbortedException(String message) {
        super(message);
    }
}
