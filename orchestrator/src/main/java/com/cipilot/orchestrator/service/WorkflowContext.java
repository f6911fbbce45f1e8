package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.vcs.GitLabProject;

import java.util.UUID;

/**
 * Everything the background task of one workflow needs. Lives in memory only;
 * this is the sole holder of the caller's token once the request returns.
 */
public record WorkflowContext(
        UUID               workflowId,
        WorkflowRequest    request,
        GitLabProject      project,
        RepositoryProfile  profile,
        int                maxAttempts,
        CancellationSignal signal
) {
    public String token() {
        return request.token();
    }
}
