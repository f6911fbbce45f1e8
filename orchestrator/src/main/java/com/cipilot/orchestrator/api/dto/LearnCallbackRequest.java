package com.cipilot.orchestrator.api.dto;

/**
 * Body posted by the learn_record job of a committed pipeline.
 * pipelineId is the CI variable value and arrives as a string.
 */
public record LearnCallbackRequest(String projectUrl, String branch, String pipelineId) {}
