package com.cipilot.orchestrator.model;

/**
 * Where a pipeline artifact came from.
 *
 * Stored on the Workflow row and reported to callers as the provenance tag.
 */
public enum ArtifactSource {
    LEARNED,            // proven config captured from an earlier successful run
    EXACT_TEMPLATE,     // language + framework template with both files, used verbatim
    PARTIAL_TEMPLATE,   // template adapted by the model (missing file generated)
    GENERATED           // generated from scratch, or the built-in default
}
