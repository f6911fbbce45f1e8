package com.cipilot.orchestrator.healing;

import com.cipilot.orchestrator.model.PipelineArtifact;

/**
 * A model-proposed replacement for the failing artifact pair.
 */
public record FixProposal(String explanation, PipelineArtifact artifact) {}
