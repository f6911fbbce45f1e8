package com.cipilot.orchestrator.api.dto;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.pipeline.Generation;
import com.cipilot.orchestrator.pipeline.ReferenceTier;

/**
 * Response body for POST /workflows/preview. Nothing is committed.
 */
public record PreviewResponse(
        String         pipelineDefinition,
        String         imageBuildDefinition,
        ArtifactSource provenance,
        String         templateId,
        ReferenceTier  tier,
        boolean        modelOutputUsed
) {
    public static PreviewResponse from(Generation generation) {
        PipelineArtifact artifact = generation.artifact();
        return new PreviewResponse(
                artifact.pipelineDefinition(),
                artifact.imageBuildDefinition(),
                artifact.source(),
                artifact.templateId(),
                generation.tier(),
                generation.modelOutputUsed()
        );
    }
}
