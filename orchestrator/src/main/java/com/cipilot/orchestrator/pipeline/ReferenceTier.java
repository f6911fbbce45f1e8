package com.cipilot.orchestrator.pipeline;

/**
 * Lookup tiers of the reference selector, in priority order.
 */
public enum ReferenceTier {
    LEARNED,
    EXACT_TEMPLATE,
    PARTIAL_TEMPLATE,
    DEFAULT
}
