package com.cipilot.orchestrator.vcs;

import com.cipilot.orchestrator.model.ExecutionState;

/**
 * A GitLab pipeline as returned by the pipelines API, status in GitLab's vocabulary.
 */
public record ExecutionStatus(long id, String status) {

    /**
     * Collapse GitLab's pipeline statuses onto the monitor's state machine.
     * "skipped" pipelines never ran a job, so they count as canceled.
     */
    public ExecutionState state() {
        if (status == null) return ExecutionState.QUEUED;
        return switch (status) {
            case "running"              -> ExecutionState.RUNNING;
            case "success"              -> ExecutionState.SUCCEEDED;
            case "failed"               -> ExecutionState.FAILED;
            case "canceled", "skipped"  -> ExecutionState.CANCELED;
            default                     -> ExecutionState.QUEUED;   // created, pending, preparing, manual, scheduled ...
        };
    }
}
