package com.cipilot.orchestrator.model;

/**
 * One CI job inside an execution. {@code status} is the raw CI value
 * ("success", "failed", "skipped", "running", ...).
 */
public record JobStatus(long id, String name, String stage, String status, boolean allowFailure) {

    public boolean succeeded() { return "success".equals(status); }
    public boolean failed()    { return "failed".equals(status); }
    public boolean skipped()   { return "skipped".equals(status); }
}
