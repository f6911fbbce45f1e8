package com.cipilot.orchestrator.repository;

import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the workflows table.
 */
public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    /** Active workflows untouched since the cutoff; candidates for orphan recovery. */
    List<Workflow> findByStateInAndUpdatedAtBefore(Collection<WorkflowState> states, Instant cutoff);

    /** Latest workflow that committed to a branch; used by the learn-stage callback. */
    Optional<Workflow> findFirstByBranchOrderByCreatedAtDesc(String branch);
}
