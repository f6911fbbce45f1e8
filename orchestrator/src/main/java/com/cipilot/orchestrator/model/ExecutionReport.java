package com.cipilot.orchestrator.model;

import java.util.List;

/**
 * What the monitor hands back once an execution stops being watched.
 *
 * @param pipelineId null when CI never created a pipeline for the commit
 * @param polls      number of status calls made, successful or not
 */
public record ExecutionReport(
        ExecutionState  state,
        Long            pipelineId,
        List<JobStatus> jobs,
        int             polls
) {
    public ExecutionReport {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}
