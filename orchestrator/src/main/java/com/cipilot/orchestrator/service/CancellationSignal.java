package com.cipilot.orchestrator.service;

/**
 * Cooperative stop flag for one workflow's background task. Checked between
 * polls and between healing attempts; in-flight HTTP calls are bounded by their
 * own timeouts and are not interrupted.
 */
public class CancellationSignal {

    private volatile boolean cancelled;
    private volatile String  reason = "";

    public void cancel(String reason) {
        this.reason    = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() { return cancelled; }

    public String reason() { return reason; }

    /**
     * @throws WorkflowAbortedException if {@link #cancel} has been called
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new WorkflowAbortedException(reason);
        }
    }
}
