package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.HealingAttempt;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowEvent;
import com.cipilot.orchestrator.model.WorkflowState;
import com.cipilot.orchestrator.pipeline.Generation;
import com.cipilot.orchestrator.repository.WorkflowEventRepository;
import com.cipilot.orchestrator.repository.WorkflowRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persists workflow progress: the workflow row and its event timeline.
 *
 * Each method is its own short transaction, called from the request thread
 * (generation, commit) or the workflow's background thread (monitoring,
 * healing, learning). A workflow is only ever written by one thread at a time.
 * Terminal transitions also feed the cipilot.workflow.outcomes counter.
 */
@Service
public class WorkflowRecorder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRecorder.class);

    static final Set<WorkflowState> ACTIVE_STATES = Set.of(
            WorkflowState.GENERATING, WorkflowState.COMMITTING,
            WorkflowState.MONITORING, WorkflowState.HEALING);

    private final WorkflowRepository      workflowRepo;
    private final WorkflowEventRepository eventRepo;
    private final MeterRegistry           meterRegistry;

    public WorkflowRecorder(WorkflowRepository workflowRepo,
                            WorkflowEventRepository eventRepo,
                            MeterRegistry meterRegistry) {
        this.workflowRepo  = workflowRepo;
        this.eventRepo     = eventRepo;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Transactional
    public Workflow create(String repoUrl, int maxAttempts) {
        Workflow wf = workflowRepo.save(new Workflow(repoUrl, maxAttempts));
        eventRepo.save(new WorkflowEvent(wf, "analyzing", "Analyzing repository " + repoUrl, 0));
        return wf;
    }

    @Transactional
    public void profileDetected(UUID id, RepositoryProfile profile) {
        Workflow wf = load(id);
        wf.setProfile(profile);
        event(wf, "generating", "Detected %s/%s (package manager: %s)".formatted(
                profile.language(), profile.framework(),
                profile.packageManager().isEmpty() ? "unknown" : profile.packageManager()));
    }

    @Transactional
    public void generated(UUID id, Generation generation) {
        Workflow wf = loadActive(id);
        wf.setArtifact(generation.artifact());
        wf.setState(WorkflowState.COMMITTING);
        String from = generation.artifact().templateId() == null
                ? "" : " from " + generation.artifact().templateId();
        event(wf, "committing", "Pipeline ready: %s%s (reference tier %s)".formatted(
                generation.provenance().name().toLowerCase(), from, generation.tier()));
    }

    @Transactional
    public void committed(UUID id, ExecutionHandle handle) {
        Workflow wf = loadActive(id);
        wf.setBranch(handle.branch());
        wf.setCommitId(handle.commitId());
        wf.setState(WorkflowState.MONITORING);
        event(wf, "monitoring", "Committed %s to %s, waiting for the pipeline"
                .formatted(handle.commitId(), handle.branch()));
    }

    @Transactional
    public void executionFinished(UUID id, int attempt, ExecutionReport report) {
        Workflow wf = load(id);
        if (report.pipelineId() != null) {
            wf.setPipelineId(report.pipelineId());
        }
        event(wf, "monitoring", "Pipeline %s finished as %s after %d poll(s)"
                .formatted(report.pipelineId() == null ? "(none)" : report.pipelineId(),
                        report.state(), report.polls()), attempt);
    }

    @Transactional
    public void healingStarted(UUID id, int attempt, String message) {
        Workflow wf = load(id);
        wf.setState(WorkflowState.HEALING);
        wf.setAttempt(attempt);
        event(wf, "healing", message, attempt);
    }

    @Transactional
    public void fixCommitted(UUID id, HealingAttempt attempt, PipelineArtifact artifact) {
        Workflow wf = load(id);
        wf.setArtifact(artifact);
        wf.setCommitId(attempt.newExecution().commitId());
        wf.setState(WorkflowState.MONITORING);
        String description = attempt.fixDescription() == null || attempt.fixDescription().isBlank()
                ? "no explanation given" : attempt.fixDescription();
        event(wf, "monitoring", "Committed fix %s: %s"
                .formatted(attempt.newExecution().commitId(), description), attempt.attemptNumber());
    }

    @Transactional
    public void event(UUID id, String stage, String message) {
        Workflow wf = load(id);
        event(wf, stage, message, wf.getAttempt());
    }

    /** Move to a terminal state. Ignored if the workflow is already terminal. */
    @Transactional
    public void finish(UUID id, WorkflowState state, String reason) {
        Workflow wf = load(id);
        if (wf.getState().isTerminal()) {
            log.debug("Workflow {} already {}, not moving to {}", id, wf.getState(), state);
            return;
        }
        wf.setState(state);
        if (state != WorkflowState.SUCCEEDED) {
            wf.setFailureReason(reason);
        }
        event(wf, state == WorkflowState.SUCCEEDED ? "completed" : "failed",
                state + (reason == null || reason.isBlank() ? "" : ": " + reason));
        meterRegistry.counter("cipilot.workflow.outcomes", "state", state.name().toLowerCase()).increment();
        log.info("Workflow {} finished: {}", id, state);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<WorkflowStatus> status(UUID id) {
        return workflowRepo.findById(id)
                .map(wf -> new WorkflowStatus(wf, eventRepo.findByWorkflowIdOrderByCreatedAtAsc(id)));
    }

    @Transactional(readOnly = true)
    public Optional<WorkflowState> state(UUID id) {
        return workflowRepo.findById(id).map(Workflow::getState);
    }

    /**
     * Attach a learn-stage callback to the latest workflow on the branch.
     *
     * @return false when no workflow committed to that branch
     */
    @Transactional
    public boolean learnCallback(String branch, String pipelineId, String projectUrl) {
        Optional<Workflow> wf = workflowRepo.findFirstByBranchOrderByCreatedAtDesc(branch);
        wf.ifPresent(w -> event(w, "learn_callback",
                "Pipeline %s of %s reached the learn stage".formatted(pipelineId, projectUrl)));
        return wf.isPresent();
    }

    /**
     * Abort workflows left active by a previous process: no background task
     * owns them any more, and their token is gone with that process.
     *
     * @return number of workflows aborted
     */
    @Transactional
    public int abortOrphans(Collection<UUID> running, Instant cutoff) {
        List<Workflow> stale = workflowRepo.findByStateInAndUpdatedAtBefore(ACTIVE_STATES, cutoff);
        int aborted = 0;
        for (Workflow wf : stale) {
            if (running.contains(wf.getId())) continue;
            log.warn("Aborting orphaned workflow {} (state={}, last update={})",
                    wf.getId(), wf.getState(), wf.getUpdatedAt());
            wf.setState(WorkflowState.ABORTED);
            wf.setFailureReason("no background task owns this workflow");
            event(wf, "failed", "ABORTED: no background task owns this workflow");
            aborted++;
        }
        return aborted;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Workflow load(UUID id) {
        return workflowRepo.findById(id).orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    /** Aborts can land while the request thread is still generating or committing. */
    private Workflow loadActive(UUID id) {
        Workflow wf = load(id);
        if (wf.getState().isTerminal()) {
            throw new WorkflowAbortedException("workflow " + id + " is already " + wf.getState());
        }
        return wf;
    }

    private void event(Workflow wf, String stage, String message) {
        event(wf, stage, message, wf.getAttempt());
    }

    private void event(Workflow wf, String stage, String message, int attempt) {
        eventRepo.save(new WorkflowEvent(wf, stage, message, attempt));
    }
}
