package com.cipilot.orchestrator.api.dto;

import com.cipilot.orchestrator.model.WorkflowEvent;

import java.time.Instant;

public record EventResponse(
        String  stage,
        String  message,
        int     attempt,
        Instant createdAt
) {
    public static EventResponse from(WorkflowEvent e) {
        return new EventResponse(e.getStage(), e.getMessage(), e.getAttempt(), e.getCreatedAt());
    }
}
