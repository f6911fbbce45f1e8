package com.cipilot.orchestrator.api.dto;

/**
 * Request body for POST /templates.
 *
 * Required: language and at least one of pipelineDefinition / imageBuildDefinition.
 * framework defaults to "generic".
 */
public record UploadTemplateRequest(
        String language,
        String framework,
        String pipelineDefinition,
        String imageBuildDefinition,
        String description
) {}
