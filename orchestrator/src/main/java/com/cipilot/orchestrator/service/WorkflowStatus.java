package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowEvent;

import java.util.List;

/**
 * A workflow row together with its event timeline, loaded in one transaction.
 */
public record WorkflowStatus(Workflow workflow, List<WorkflowEvent> events) {}
