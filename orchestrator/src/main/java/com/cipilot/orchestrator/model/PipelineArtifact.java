package com.cipilot.orchestrator.model;

/**
 * The pair of files a workflow commits: the CI pipeline definition and the
 * image-build definition, plus where they came from.
 *
 * Immutable. The normalizer and the self-healing engine produce new instances
 * through the with* methods instead of mutating in place.
 */
public record PipelineArtifact(
        String pipelineDefinition,
        String imageBuildDefinition,
        ArtifactSource source,
        String templateId
) {

    public static PipelineArtifact of(String pipeline, String imageBuild, ArtifactSource source) {
        return new PipelineArtifact(pipeline, imageBuild, source, null);
    }

    public boolean hasPipeline() {
        return pipelineDefinition != null && !pipelineDefinition.isBlank();
    }

    public boolean hasImageBuild() {
        return imageBuildDefinition != null && !imageBuildDefinition.isBlank();
    }

    public PipelineArtifact withPipelineDefinition(String pipeline) {
        return new PipelineArtifact(pipeline, imageBuildDefinition, source, templateId);
    }

    public PipelineArtifact withFiles(String pipeline, String imageBuild) {
        return new PipelineArtifact(pipeline, imageBuild, source, templateId);
    }

    public PipelineArtifact withSource(ArtifactSource newSource) {
        return new PipelineArtifact(pipelineDefinition, imageBuildDefinition, newSource, templateId);
    }
}
