package com.cipilot.orchestrator.store;

/**
 * A pre-authored pipeline / image-build pair tagged with language and framework.
 * Either file may be null for partial templates.
 */
public record PipelineTemplate(
        String id,
        String language,
        String framework,
        String pipelineDefinition,
        String imageBuildDefinition
) {
    public boolean hasPipeline() {
        return pipelineDefinition != null && !pipelineDefinition.isBlank();
    }

    public boolean hasImageBuild() {
        return imageBuildDefinition != null && !imageBuildDefinition.isBlank();
    }

    public boolean isComplete() {
        return hasPipeline() && hasImageBuild();
    }

    public boolean isEmpty() {
        return !hasPipeline() && !hasImageBuild();
    }
}
