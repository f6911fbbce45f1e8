package com.cipilot.orchestrator.repository;

import com.cipilot.orchestrator.model.WorkflowEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowEventRepository extends JpaRepository<WorkflowEvent, UUID> {

    /** Timeline of a workflow, oldest first. */
    List<WorkflowEvent> findByWorkflowIdOrderByCreatedAtAsc(UUID workflowId);
}
