package com.cipilot.orchestrator.api.dto;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowState;
import com.cipilot.orchestrator.service.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /workflows/{id}: the current state plus the full
 * event timeline in creation order.
 *
 * attempt counts self-healing attempts, not CI executions; a workflow whose
 * first pipeline passed reports attempt 0.
 */
public record WorkflowResponse(
        UUID                id,
        WorkflowState       state,
        String              repoUrl,
        String              language,
        String              framework,
        String              branch,
        String              commitId,
        Long                pipelineId,
        ArtifactSource      provenance,
        String              templateId,
        int                 attempt,
        int                 maxAttempts,
        String              failureReason,
        Instant             createdAt,
        Instant             updatedAt,
        List<EventResponse> events
) {
    public static WorkflowResponse from(WorkflowStatus status) {
        Workflow wf = status.workflow();
        return new WorkflowResponse(
                wf.getId(),
                wf.getState(),
                wf.getRepoUrl(),
                wf.getLanguage(),
                wf.getFramework(),
                wf.getBranch(),
                wf.getCommitId(),
                wf.getPipelineId(),
                wf.getProvenance(),
                wf.getTemplateId(),
                wf.getAttempt(),
                wf.getMaxAttempts(),
                wf.getFailureReason(),
                wf.getCreatedAt(),
                wf.getUpdatedAt(),
                status.events().stream().map(EventResponse::from).toList()
        );
    }
}
