package com.cipilot.orchestrator.api.dto;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.service.StartedWorkflow;

import java.util.UUID;

/**
 * Response body for POST /workflows. workflowId is what the caller polls with.
 */
public record StartWorkflowResponse(
        UUID           workflowId,
        String         commitId,
        String         branch,
        ArtifactSource provenance
) {
    public static StartWorkflowResponse from(StartedWorkflow started) {
        return new StartWorkflowResponse(
                started.workflowId(),
                started.commitId(),
                started.branch(),
                started.provenance()
        );
    }
}
