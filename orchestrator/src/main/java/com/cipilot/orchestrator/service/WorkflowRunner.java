package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.healing.Classification;
import com.cipilot.orchestrator.healing.FixGenerationException;
import com.cipilot.orchestrator.healing.HealingListener;
import com.cipilot.orchestrator.healing.SelfHealingEngine;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.HealingAttempt;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.WorkflowState;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.VcsException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the background part of every workflow: monitor, heal, learn.
 *
 * Each workflow gets exactly one task on a fixed worker pool, so its healing
 * attempts run strictly one after another while different workflows proceed
 * independently. Tasks stop cooperatively through their {@link CancellationSignal}
 * (explicit abort, shutdown). The pool size caps how many pipelines are watched
 * at once; workflows beyond it queue until a worker frees up.
 */
@Component
@EnableScheduling
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private static final Duration ORPHAN_AGE = Duration.ofMinutes(10);

    private final ExecutorService                     workers;
    private final int                                 workerCount;
    private final Map<UUID, CancellationSignal>       running = new ConcurrentHashMap<>();

    private final ExecutionMonitor    monitor;
    private final SelfHealingEngine   healer;
    private final LearningStoreWriter learner;
    private final WorkflowRecorder    recorder;
    private final GitLabClient        gitLab;
    private final Clock               clock;
    private final boolean             openIssueOnExhaustion;

    public WorkflowRunner(ExecutionMonitor monitor,
                          SelfHealingEngine healer,
                          LearningStoreWriter learner,
                          WorkflowRecorder recorder,
                          GitLabClient gitLab,
                          Clock clock,
                          @Value("${cipilot.workers:32}") int workerCount,
                          @Value("${cipilot.healing.open-issue-on-exhaustion:true}") boolean openIssueOnExhaustion) {
        this.monitor               = monitor;
        this.healer                = healer;
        this.learner               = learner;
        this.recorder              = recorder;
        this.gitLab                = gitLab;
        this.clock                 = clock;
        this.openIssueOnExhaustion = openIssueOnExhaustion;
        this.workerCount           = workerCount;
        this.workers               = Executors.newFixedThreadPool(workerCount);
    }

    /**
     * Detach the background task for a freshly committed workflow.
     */
    public void launch(WorkflowContext ctx, PipelineArtifact artifact, ExecutionHandle handle) {
        running.put(ctx.workflowId(), ctx.signal());
        if (running.size() > workerCount) {
            log.warn("All {} workers busy, workflow {} waits for a free worker before monitoring starts",
                    workerCount, ctx.workflowId());
        }
        workers.submit(() -> run(ctx, artifact, handle));
    }

    /**
     * Ask a workflow's task to stop at its next poll boundary.
     *
     * @return false if no task for this workflow runs in this process
     */
    public boolean abort(UUID workflowId, String reason) {
        CancellationSignal signal = running.get(workflowId);
        if (signal == null) return false;
        signal.cancel(reason);
        log.info("Abort requested for workflow {}: {}", workflowId, reason);
        return true;
    }

    // ------------------------------------------------------------------
    // Background task
    // ------------------------------------------------------------------

    void run(WorkflowContext ctx, PipelineArtifact artifact, ExecutionHandle handle) {
        UUID id = ctx.workflowId();
        MDC.put("workflowId", id.toString());
        MDC.put("attempt", "0");
        try {
            drive(ctx, artifact, handle);
        } catch (WorkflowAbortedException e) {
            recorder.finish(id, WorkflowState.ABORTED, e.getMessage());
        } catch (FixGenerationException e) {
            log.error("Fix generation failed for workflow {}: {}", id, e.getMessage());
            recorder.finish(id, WorkflowState.FAILED, "Fix generation failed: " + e.getMessage());
        } catch (CommitFailedException e) {
            log.error("Fix commit failed for workflow {}: {}", id, e.getMessage());
            recorder.finish(id, WorkflowState.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled error in workflow {}: {}", id, e.getMessage(), e);
            recorder.finish(id, WorkflowState.FAILED, "Unexpected error: " + e.getMessage());
        } finally {
            running.remove(id);
            MDC.clear();
        }
    }

    private void drive(WorkflowContext ctx, PipelineArtifact artifact, ExecutionHandle handle) {
        UUID id = ctx.workflowId();
        ExecutionReport report = monitor.await(ctx, handle);
        recorder.executionFinished(id, 0, report);

        switch (report.state()) {
            case SUCCEEDED -> succeed(ctx, handle, report, artifact);
            case CANCELED  -> recorder.finish(id, WorkflowState.CANCELED, "Pipeline was canceled in GitLab");
            case TIMED_OUT -> recorder.finish(id, WorkflowState.TIMED_OUT, timeoutReason(report));
            case FAILED    -> heal(ctx, artifact, handle, report);
            default        -> throw new IllegalStateException("Monitor returned non-final state " + report.state());
        }
    }

    private void heal(WorkflowContext ctx, PipelineArtifact artifact, ExecutionHandle handle, ExecutionReport failed) {
        UUID id = ctx.workflowId();
        SelfHealingEngine.Outcome outcome = healer.heal(ctx, artifact, handle, failed, new RecordingListener(id));

        switch (outcome.result()) {
            case SUCCEEDED -> succeed(ctx, outcome.handle(), outcome.report(), outcome.artifact());
            case CANCELED  -> recorder.finish(id, WorkflowState.CANCELED, "Pipeline was canceled in GitLab");
            case TIMED_OUT -> recorder.finish(id, WorkflowState.TIMED_OUT, timeoutReason(outcome.report()));
            case EXHAUSTED -> {
                if (openIssueOnExhaustion) {
                    openFailureIssue(ctx, outcome);
                }
                recorder.finish(id, WorkflowState.MAX_ATTEMPTS_EXHAUSTED,
                        "Pipeline still failing after %d repair attempt(s)".formatted(outcome.attempts().size()));
            }
        }
    }

    private void succeed(WorkflowContext ctx, ExecutionHandle handle, ExecutionReport report,
                         PipelineArtifact artifact) {
        learner.learn(ctx, handle, report, artifact).ifPresentOrElse(
                config -> recorder.event(ctx.workflowId(), "learning", "Stored learned config " + config.id()),
                () -> recorder.event(ctx.workflowId(), "learning", "Configuration not stored (quality gate or store unavailable)"));
        recorder.finish(ctx.workflowId(), WorkflowState.SUCCEEDED, null);
    }

    private void openFailureIssue(WorkflowContext ctx, SelfHealingEngine.Outcome outcome) {
        Classification last = outcome.lastClassification();
        String errorClass = last == null ? "unclassified" : last.errorClass().label();
        String description = """
                CIPilot could not produce a passing pipeline for this project.

                | | |
                |---|---|
                | Language | %s |
                | Framework | %s |
                | Branch | `%s` |
                | Repair attempts | %d |
                | Last error class | %s |

                ### Last .gitlab-ci.yml
                ```yaml
                %s
                ```

                ### Last Dockerfile
                ```dockerfile
                %s
                ```
                """.formatted(ctx.profile().language(), ctx.profile().framework(), outcome.handle().branch(),
                outcome.attempts().size(), errorClass,
                outcome.artifact().pipelineDefinition().strip(),
                outcome.artifact().hasImageBuild() ? outcome.artifact().imageBuildDefinition().strip() : "");
        try {
            String url = gitLab.createIssue(ctx.project(), ctx.token(),
                    "CIPilot: pipeline still failing on " + outcome.handle().branch(),
                    description, List.of("cipilot", "pipeline-failure"));
            recorder.event(ctx.workflowId(), "issue", "Opened issue " + url);
        } catch (VcsException e) {
            log.warn("Could not open failure issue for workflow {}: {}", ctx.workflowId(), e.getMessage());
        }
    }

    private static String timeoutReason(ExecutionReport report) {
        return report.pipelineId() == null
                ? "No pipeline appeared for the commit within the wait budget"
                : "Pipeline " + report.pipelineId() + " did not finish within the wait budget";
    }

    /** Forwards healing progress to the recorder. */
    private final class RecordingListener implements HealingListener {

        private final UUID workflowId;

        RecordingListener(UUID workflowId) {
            this.workflowId = workflowId;
        }

        @Override
        public void attemptStarted(int attempt, Classification classification, String failedJob) {
            recorder.healingStarted(workflowId, attempt, "Attempt %d: %s in job %s".formatted(
                    attempt, classification.errorClass().label(), failedJob));
        }

        @Override
        public void fixCommitted(HealingAttempt attempt, PipelineArtifact artifact) {
            recorder.fixCommitted(workflowId, attempt, artifact);
        }

        @Override
        public void executionFinished(int attempt, ExecutionReport report) {
            recorder.executionFinished(workflowId, attempt, report);
        }
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /**
     * Abort active workflows that no task in this process owns, e.g. after a
     * restart. Runs every minute.
     */
    @Scheduled(fixedDelay = 60_000, initialDelay = 30_000)
    public void recoverOrphans() {
        int aborted = recorder.abortOrphans(running.keySet(), clock.instant().minus(ORPHAN_AGE));
        if (aborted > 0) {
            log.warn("Aborted {} orphaned workflow(s)", aborted);
        }
    }

    @PreDestroy
    public void shutdown() {
        running.values().forEach(s -> s.cancel("orchestrator shutting down"));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
