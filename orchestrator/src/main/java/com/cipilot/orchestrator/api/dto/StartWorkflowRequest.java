package com.cipilot.orchestrator.api.dto;

import com.cipilot.orchestrator.model.WorkflowRequest;

/**
 * Request body for POST /workflows and POST /workflows/preview.
 *
 * Required: repoUrl, token
 * Optional: additionalContext, pipelineOnly, branchName, useTemplateOnly, maxAttempts.
 *   Omitted booleans default to false; an omitted maxAttempts uses the configured budget.
 */
public record StartWorkflowRequest(
        String  repoUrl,
        String  token,
        String  additionalContext,
        Boolean pipelineOnly,
        String  branchName,
        Boolean useTemplateOnly,
        Integer maxAttempts
) {

    public WorkflowRequest toWorkflowRequest() {
        return new WorkflowRequest(
                repoUrl,
                token,
                additionalContext,
                Boolean.TRUE.equals(pipelineOnly),
                branchName == null || branchName.isBlank() ? null : branchName.strip(),
                Boolean.TRUE.equals(useTemplateOnly),
                maxAttempts
        );
    }

    @Override
    public String toString() {
        return "StartWorkflowRequest[repoUrl=" + repoUrl + ", branchName=" + branchName + "]";
    }
}
