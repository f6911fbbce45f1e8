package com.cipilot.orchestrator.api.dto;

public record TemplateResponse(String id) {}
