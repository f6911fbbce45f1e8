package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.PipelineArtifact;

/**
 * Result of the generation step: the normalised artifact and the tier its reference
 * came from. modelOutputUsed is true when the committed pipeline file was written
 * by the model rather than taken from a reference or the default.
 */
public record Generation(PipelineArtifact artifact, ReferenceTier tier, boolean modelOutputUsed) {

    public ArtifactSource provenance() {
        return artifact.source();
    }
}
