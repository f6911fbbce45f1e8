package com.cipilot.orchestrator.healing;

import com.cipilot.orchestrator.claude.ClaudeClient;
import com.cipilot.orchestrator.claude.ModelTimeoutException;
import com.cipilot.orchestrator.claude.ModelUnavailableException;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.ExecutionState;
import com.cipilot.orchestrator.model.HealingAttempt;
import com.cipilot.orchestrator.model.JobLog;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.pipeline.ArtifactNormalizer;
import com.cipilot.orchestrator.pipeline.InvalidArtifactException;
import com.cipilot.orchestrator.pipeline.PipelineValidator;
import com.cipilot.orchestrator.pipeline.PipelineYaml;
import com.cipilot.orchestrator.pipeline.ResponseParser;
import com.cipilot.orchestrator.pipeline.ResponseParser.ParsedArtifacts;
import com.cipilot.orchestrator.pipeline.ValidationResult;
import com.cipilot.orchestrator.service.CommitCoordinator;
import com.cipilot.orchestrator.service.ExecutionMonitor;
import com.cipilot.orchestrator.service.WorkflowContext;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.VcsException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Repair loop for a failed execution.
 *
 * One iteration:
 *   1. fetch the logs of the failed jobs and pick the root-cause job
 *   2. classify the failure with {@link ErrorClassifier}
 *   3. ask the model for complete replacement files (one immediate retry)
 *   4. normalise, commit to the workflow branch, monitor the new execution
 *
 * The loop ends on the first execution that does not fail, or with EXHAUSTED
 * once maxAttempts repairs have all failed. An initial failure plus maxAttempts
 * failed repairs is therefore maxAttempts + 1 failed executions. Fix generation
 * failing twice in a row throws {@link FixGenerationException}.
 *
 * Runs on the workflow's own background thread; iterations never overlap, and
 * a fix is only committed after the previous execution has finished.
 */
@Component
public class SelfHealingEngine {

    private static final Logger log = LoggerFactory.getLogger(SelfHealingEngine.class);

    private static final int FIX_REQUESTS_PER_ATTEMPT = 2;

    public enum Result { SUCCEEDED, TIMED_OUT, CANCELED, EXHAUSTED }

    /**
     * Where the loop stopped. lastClassification is null if no repair was attempted.
     */
    public record Outcome(
            Result               result,
            PipelineArtifact     artifact,
            ExecutionHandle      handle,
            ExecutionReport      report,
            List<HealingAttempt> attempts,
            Classification       lastClassification
    ) {}

    /** Loop state, replaced (never mutated) on every iteration. */
    private record LoopState(int attempt, PipelineArtifact artifact, ExecutionHandle handle,
                             ExecutionReport report, Classification lastClassification) {}

    private final GitLabClient       gitLab;
    private final ErrorClassifier    classifier;
    private final ClaudeClient       claude;
    private final ArtifactNormalizer normalizer;
    private final PipelineValidator  validator;
    private final CommitCoordinator  commits;
    private final ExecutionMonitor   monitor;
    private final MeterRegistry      meterRegistry;

    public SelfHealingEngine(GitLabClient gitLab,
                             ErrorClassifier classifier,
                             ClaudeClient claude,
                             ArtifactNormalizer normalizer,
                             PipelineValidator validator,
                             CommitCoordinator commits,
                             ExecutionMonitor monitor,
                             MeterRegistry meterRegistry) {
        this.gitLab        = gitLab;
        this.classifier    = classifier;
        this.claude        = claude;
        this.normalizer    = normalizer;
        this.validator     = validator;
        this.commits       = commits;
        this.monitor       = monitor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param failed report of the execution that failed; must be in state FAILED
     */
    public Outcome heal(WorkflowContext ctx, PipelineArtifact artifact, ExecutionHandle handle,
                        ExecutionReport failed, HealingListener listener) {
        if (failed.state() != ExecutionState.FAILED) {
            throw new IllegalArgumentException("Healing needs a FAILED execution, got " + failed.state());
        }

        List<HealingAttempt> attempts = new ArrayList<>();
        LoopState state = new LoopState(0, artifact, handle, failed, null);

        while (state.report().state() == ExecutionState.FAILED) {
            if (state.attempt() >= ctx.maxAttempts()) {
                log.warn("Retry budget of {} exhausted", ctx.maxAttempts());
                return outcome(Result.EXHAUSTED, state, attempts);
            }
            ctx.signal().throwIfCancelled();
            state = iterate(ctx, state, attempts, listener);
        }

        Result result = switch (state.report().state()) {
            case SUCCEEDED -> Result.SUCCEEDED;
            case CANCELED  -> Result.CANCELED;
            default        -> Result.TIMED_OUT;
        };
        return outcome(result, state, attempts);
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private LoopState iterate(WorkflowContext ctx, LoopState state, List<HealingAttempt> attempts,
                              HealingListener listener) {
        int attempt = state.attempt() + 1;
        MDC.put("attempt", String.valueOf(attempt));

        List<JobLog> failedJobs = failedJobLogs(ctx, state.report());
        List<String> stageOrder = stageOrder(state.artifact());
        JobLog rootCause = rootCause(failedJobs, stageOrder);
        List<JobLog> others = failedJobs.stream().filter(j -> j != rootCause).toList();

        Classification classification = classifier.classify(rootCause == null ? "" : rootCause.logText());
        meterRegistry.counter("cipilot.healing.attempts", "error_class", classification.errorClass().label())
                .increment();
        String failedJob = rootCause == null ? "(unknown)" : rootCause.jobName();
        log.info("Healing attempt {}/{}: {} in job {}", attempt, ctx.maxAttempts(),
                classification.errorClass().label(), failedJob);
        listener.attemptStarted(attempt, classification, failedJob);

        FixProposal fix = requestFix(ctx, state.artifact(), classification, rootCause, others, attempt);

        String message = "ci: self-healing attempt %d (%s in %s)"
                .formatted(attempt, classification.errorClass().label(), failedJob);
        ExecutionHandle next = commits.commitFix(state.handle(), fix.artifact(), ctx.request(), message);
        HealingAttempt record = new HealingAttempt(attempt, classification.errorClass(), fix.explanation(), next);
        attempts.add(record);
        listener.fixCommitted(record, fix.artifact());

        ExecutionReport report = monitor.await(ctx, next);
        listener.executionFinished(attempt, report);
        return new LoopState(attempt, fix.artifact(), next, report, classification);
    }

    private List<JobLog> failedJobLogs(WorkflowContext ctx, ExecutionReport report) {
        if (report.pipelineId() == null) return List.of();
        try {
            return gitLab.getJobLogs(ctx.project(), ctx.token(), report.pipelineId()).stream()
                    .filter(j -> "failed".equals(j.state()))
                    .toList();
        } catch (VcsException e) {
            log.warn("Could not fetch job logs of pipeline {}: {}", report.pipelineId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Earliest-stage failed job, ignoring notify_* jobs and jobs allowed to fail
     * unless nothing else failed. Later failures are usually consequences of the first one.
     */
    static JobLog rootCause(List<JobLog> failedJobs, List<String> stageOrder) {
        List<JobLog> candidates = failedJobs.stream()
                .filter(j -> !j.allowFailure())
                .filter(j -> j.jobName() == null || !j.jobName().startsWith("notify"))
                .toList();
        if (candidates.isEmpty()) {
            candidates = failedJobs.stream().filter(j -> !j.allowFailure()).toList();
        }
        if (candidates.isEmpty()) candidates = failedJobs;

        return candidates.stream()
                .min(Comparator.comparingInt(j -> {
                    int idx = stageOrder.indexOf(j.stage());
                    return idx < 0 ? Integer.MAX_VALUE : idx;
                }))
                .orElse(null);
    }

    private static List<String> stageOrder(PipelineArtifact artifact) {
        try {
            return PipelineYaml.stages(PipelineYaml.load(artifact.pipelineDefinition()));
        } catch (InvalidArtifactException e) {
            return List.of();
        }
    }

    // ------------------------------------------------------------------
    // Fix generation
    // ------------------------------------------------------------------

    private FixProposal requestFix(WorkflowContext ctx, PipelineArtifact current, Classification classification,
                                   JobLog rootCause, List<JobLog> others, int attempt) {
        boolean pipelineOnly = ctx.request().pipelineOnly();
        String context = FixPrompts.context(ctx.profile(), classification, rootCause, others,
                current, attempt, ctx.maxAttempts(), pipelineOnly);
        RuntimeException lastError = null;
        for (int call = 1; call <= FIX_REQUESTS_PER_ATTEMPT; call++) {
            try {
                return proposeFix(current, context, pipelineOnly);
            } catch (ModelUnavailableException | ModelTimeoutException | FixGenerationException e) {
                lastError = e;
                log.warn("Fix request {}/{} failed: {}", call, FIX_REQUESTS_PER_ATTEMPT, e.getMessage());
            }
        }
        throw new FixGenerationException("No usable fix after " + FIX_REQUESTS_PER_ATTEMPT + " requests", lastError);
    }

    /**
     * @param pipelineOnly the Dockerfile is not committed, so a proposed Dockerfile is
     *                     ignored and only a changed pipeline counts as a fix
     */
    private FixProposal proposeFix(PipelineArtifact current, String context, boolean pipelineOnly) {
        ParsedArtifacts parsed = ResponseParser.parse(claude.complete(FixPrompts.SYSTEM, context));
        if (parsed.isEmpty()) {
            throw new FixGenerationException("Model response contained no files");
        }

        String pipeline = current.pipelineDefinition();
        if (parsed.pipelineDefinition() != null) {
            ValidationResult result = validator.validatePipeline(parsed.pipelineDefinition());
            if (!result.isValid()) {
                throw new FixGenerationException("Proposed pipeline is invalid: " + result);
            }
            pipeline = parsed.pipelineDefinition();
        }
        String image = current.imageBuildDefinition();
        if (parsed.imageBuildDefinition() != null && !pipelineOnly) {
            ValidationResult result = validator.validateImageBuild(parsed.imageBuildDefinition());
            if (!result.isValid()) {
                throw new FixGenerationException("Proposed Dockerfile is invalid: " + result);
            }
            image = parsed.imageBuildDefinition();
        }

        PipelineArtifact repaired;
        try {
            repaired = normalizer.normalize(current.withFiles(pipeline, image));
        } catch (InvalidArtifactException e) {
            throw new FixGenerationException("Proposed pipeline could not be normalized", e);
        }
        if (Objects.equals(repaired.pipelineDefinition(), current.pipelineDefinition())
                && Objects.equals(repaired.imageBuildDefinition(), current.imageBuildDefinition())) {
            throw new FixGenerationException("Proposed files are identical to the failing ones");
        }
        return new FixProposal(parsed.explanation(), repaired);
    }

    private static Outcome outcome(Result result, LoopState state, List<HealingAttempt> attempts) {
        return new Outcome(result, state.artifact(), state.handle(), state.report(),
                List.copyOf(attempts), state.lastClassification());
    }
}
