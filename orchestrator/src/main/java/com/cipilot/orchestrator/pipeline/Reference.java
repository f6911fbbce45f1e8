package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.PipelineArtifact;

/**
 * What the selector found and in which tier. For PARTIAL_TEMPLATE the artifact
 * may be missing one of its two files.
 */
public record Reference(ReferenceTier tier, PipelineArtifact artifact) {}
