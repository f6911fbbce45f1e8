package com.cipilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One progress entry in a workflow's timeline, shown to the UI in creation order.
 *
 * DB table: workflow_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_events")
public class WorkflowEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private Workflow workflow;

    // Short machine-readable label, e.g. "committed", "healing", "learned".
    @Column(nullable = false)
    private String stage;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(nullable = false)
    private int attempt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected WorkflowEvent() {}   // required by JPA

    public WorkflowEvent(Workflow workflow, String stage, String message, int attempt) {
        this.workflow = workflow;
        this.stage    = stage;
        this.message  = message;
        this.attempt  = attempt;
    }

    public UUID     getId()        { return id; }
    public Workflow getWorkflow()  { return workflow; }
    public String   getStage()     { return stage; }
    public String   getMessage()   { return message; }
    public int      getAttempt()   { return attempt; }
    public Instant  getCreatedAt() { return createdAt; }
}
