package com.cipilot.orchestrator.model;

/**
 * What the analyzer detected about a repository. Read-only after analysis.
 */
public record RepositoryProfile(
        String  language,
        String  framework,
        String  packageManager,
        boolean hasExistingPipelineFiles
) {
    public RepositoryProfile {
        language  = (language == null || language.isBlank())   ? "unknown" : language.toLowerCase();
        framework = (framework == null || framework.isBlank()) ? "generic" : framework.toLowerCase();
        if (packageManager == null) packageManager = "";
    }
}
