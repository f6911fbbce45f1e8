package com.cipilot.orchestrator.model;

/**
 * State of one CI execution as seen by the monitor.
 *
 * Transitions:
 *   QUEUED → RUNNING → SUCCEEDED | FAILED | CANCELED
 *   QUEUED | RUNNING → TIMED_OUT   (monitor budget exhausted, not reported by CI)
 */
public enum ExecutionState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED,
    TIMED_OUT;

    /** True for the three states CI itself reports as final. */
    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }
}
