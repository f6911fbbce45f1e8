package com.cipilot.orchestrator.model;

/**
 * Overall state of a workflow.
 *
 * Happy path:
 *   GENERATING → COMMITTING → MONITORING → SUCCEEDED
 * With repairs:
 *   MONITORING → HEALING → MONITORING → ... → SUCCEEDED | MAX_ATTEMPTS_EXHAUSTED
 *
 * TIMED_OUT, CANCELED, ABORTED and FAILED are terminal alternates.
 */
public enum WorkflowState {
    GENERATING,
    COMMITTING,
    MONITORING,
    HEALING,
    SUCCEEDED,
    TIMED_OUT,
    MAX_ATTEMPTS_EXHAUSTED,
    CANCELED,   // CI execution was canceled outside the orchestrator
    ABORTED,    // background task stopped by request or shutdown
    FAILED;     // commit failure, fix generation failure, unexpected error

    public boolean isTerminal() {
        return switch (this) {
            case GENERATING, COMMITTING, MONITORING, HEALING -> false;
            default -> true;
        };
    }
}
