package com.cipilot.orchestrator.model;

/**
 * A job with its log text. logText is empty for jobs whose log was not fetched.
 * allowFailure marks jobs whose failure does not fail the pipeline.
 */
public record JobLog(String jobName, String stage, String state, boolean allowFailure, String logText) {}
