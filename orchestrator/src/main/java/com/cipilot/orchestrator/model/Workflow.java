package com.cipilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One pipeline-generation workflow started by a user.
 *
 * The id doubles as the execution reference handed back to callers for
 * progress polling. The access token is never stored here; it lives only
 * in memory for the duration of the background task.
 *
 * DB table: workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflows")
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "repo_url", nullable = false)
    private String repoUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowState state = WorkflowState.GENERATING;

    private String language;

    private String framework;

    @Column(name = "branch_name")
    private String branch;

    @Column(name = "commit_id")
    private String commitId;

    // Latest CI pipeline seen by the monitor. Changes on every healing attempt.
    @Column(name = "pipeline_id")
    private Long pipelineId;

    @Enumerated(EnumType.STRING)
    private ArtifactSource provenance;

    @Column(name = "template_id")
    private String templateId;

    // Number of self-healing attempts made so far (0 until the first repair).
    @Column(nullable = false)
    private int attempt = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "pipeline_definition", columnDefinition = "TEXT")
    private String pipelineDefinition;

    @Column(name = "image_build_definition", columnDefinition = "TEXT")
    private String imageBuildDefinition;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Workflow() {}   // required by JPA

    public Workflow(String repoUrl, int maxAttempts) {
        this.repoUrl     = repoUrl;
        this.maxAttempts = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                   { return id; }
    public String         getRepoUrl()              { return repoUrl; }
    public WorkflowState  getState()                { return state; }
    public String         getLanguage()             { return language; }
    public String         getFramework()            { return framework; }
    public String         getBranch()               { return branch; }
    public String         getCommitId()             { return commitId; }
    public Long           getPipelineId()           { return pipelineId; }
    public ArtifactSource getProvenance()           { return provenance; }
    public String         getTemplateId()           { return templateId; }
    public int            getAttempt()              { return attempt; }
    public int            getMaxAttempts()          { return maxAttempts; }
    public String         getPipelineDefinition()   { return pipelineDefinition; }
    public String         getImageBuildDefinition() { return imageBuildDefinition; }
    public String         getFailureReason()        { return failureReason; }
    public Instant        getCreatedAt()            { return createdAt; }
    public Instant        getUpdatedAt()            { return updatedAt; }

    public void setState(WorkflowState state)         { this.state = state; }
    public void setBranch(String branch)              { this.branch = branch; }
    public void setCommitId(String commitId)          { this.commitId = commitId; }
    public void setPipelineId(Long pipelineId)        { this.pipelineId = pipelineId; }
    public void setAttempt(int attempt)               { this.attempt = attempt; }
    public void setFailureReason(String reason)       { this.failureReason = reason; }

    public void setProfile(RepositoryProfile profile) {
        this.language  = profile.language();
        this.framework = profile.framework();
    }

    public void setArtifact(PipelineArtifact artifact) {
        this.pipelineDefinition   = artifact.pipelineDefinition();
        this.imageBuildDefinition = artifact.imageBuildDefinition();
        this.provenance           = artifact.source();
        this.templateId           = artifact.templateId();
    }
}
