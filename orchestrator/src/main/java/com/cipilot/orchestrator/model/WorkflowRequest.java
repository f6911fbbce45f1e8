package com.cipilot.orchestrator.model;

/**
 * Immutable input of one workflow invocation.
 *
 * Required: repoUrl, token.
 * Optional: additionalContext (free text for the model), pipelineOnly (commit only the
 * pipeline file), branchName (otherwise generated), useTemplateOnly (never call the
 * model during generation), maxAttempts (otherwise the configured budget).
 */
public record WorkflowRequest(
        String  repoUrl,
        String  token,
        String  additionalContext,
        boolean pipelineOnly,
        String  branchName,
        boolean useTemplateOnly,
        Integer maxAttempts
) {
    public WorkflowRequest {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("repoUrl is required");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (additionalContext == null) additionalContext = "";
    }

    public static WorkflowRequest of(String repoUrl, String token) {
        return new WorkflowRequest(repoUrl, token, "", false, null, false, null);
    }

    // Keeps the credential out of logs.
    @Override
    public String toString() {
        return "WorkflowRequest[repoUrl=" + repoUrl
                + ", pipelineOnly=" + pipelineOnly
                + ", branchName=" + branchName
                + ", useTemplateOnly=" + useTemplateOnly
                + ", maxAttempts=" + maxAttempts + "]";
    }
}
