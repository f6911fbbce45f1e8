package com.cipilot.orchestrator.model;

import java.time.Instant;

/**
 * Identifies one triggered CI execution: the commit that triggers it and the branch
 * it lives on. The monitor resolves the pipeline by (branch, commitId), so a newer
 * commit on the same branch never gets confused with an older execution.
 */
public record ExecutionHandle(String commitId, String branch, Instant startedAt) {}
