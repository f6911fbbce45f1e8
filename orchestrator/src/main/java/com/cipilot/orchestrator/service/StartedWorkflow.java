package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ArtifactSource;

import java.util.UUID;

/**
 * What startWorkflow hands back once the commit exists. workflowId is the
 * execution reference for status polling.
 */
public record StartedWorkflow(UUID workflowId, String commitId, String branch, ArtifactSource provenance) {}
