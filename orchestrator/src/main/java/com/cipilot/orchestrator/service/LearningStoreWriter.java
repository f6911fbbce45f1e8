package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.ExecutionState;
import com.cipilot.orchestrator.model.JobStatus;
import com.cipilot.orchestrator.model.LearnedConfig;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.store.ArtifactDocument;
import com.cipilot.orchestrator.store.StoreException;
import com.cipilot.orchestrator.store.TemplateStoreClient;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the artifact of a passing execution as a learned config.
 *
 * Runs only after SUCCEEDED. The job list is fetched again rather than taken
 * from the monitor's report so the gate sees the final status of every job.
 * The document id depends only on language, framework and file contents, so
 * storing the same pair twice overwrites one entry instead of adding another.
 * Learning is best effort: store errors are logged and never fail the workflow.
 */
@Component
public class LearningStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(LearningStoreWriter.class);

    private final GitLabClient        gitLab;
    private final TemplateStoreClient store;
    private final QualityGate         gate;
    private final Clock               clock;

    public LearningStoreWriter(GitLabClient gitLab, TemplateStoreClient store, QualityGate gate, Clock clock) {
        this.gitLab = gitLab;
        this.store  = store;
        this.gate   = gate;
        this.clock  = clock;
    }

    /**
     * @return the stored config, or empty when the gate failed or storage was skipped
     */
    public Optional<LearnedConfig> learn(WorkflowContext ctx, ExecutionHandle handle,
                                         ExecutionReport report, PipelineArtifact artifact) {
        if (report.state() != ExecutionState.SUCCEEDED || report.pipelineId() == null) {
            throw new IllegalArgumentException("Only succeeded executions can be learned, got " + report.state());
        }

        List<JobStatus> jobs;
        try {
            jobs = gitLab.getJobs(ctx.project(), ctx.token(), report.pipelineId());
        } catch (VcsException e) {
            log.warn("Could not re-fetch jobs of pipeline {}, not learning: {}", report.pipelineId(), e.getMessage());
            return Optional.empty();
        }

        QualityGate.Verdict verdict = gate.evaluate(jobs, artifact.pipelineDefinition());
        if (!verdict.passed()) {
            log.info("Pipeline {} failed the quality gate, not learning: {}",
                    report.pipelineId(), verdict.violations());
            return Optional.empty();
        }

        // A pipeline-only workflow never committed its Dockerfile, so that file was never built.
        PipelineArtifact proven = ctx.request().pipelineOnly()
                ? artifact.withFiles(artifact.pipelineDefinition(), null)
                : artifact;
        LearnedConfig config = toLearnedConfig(ctx.profile(), handle, report.pipelineId(), jobs, proven);
        try {
            store.upsertLearnedConfig(config);
        } catch (StoreException e) {
            log.warn("Could not store learned config {}: {}", config.id(), e.getMessage());
            return Optional.empty();
        }
        log.info("Learned config {} ({} stages, {}s)", config.id(), config.stagesPassedCount(),
                config.durationSeconds());
        return Optional.of(config);
    }

    LearnedConfig toLearnedConfig(RepositoryProfile profile, ExecutionHandle handle, long pipelineId,
                                  List<JobStatus> jobs, PipelineArtifact artifact) {
        Instant now = clock.instant();
        int stagesPassed = (int) jobs.stream()
                .filter(JobStatus::succeeded)
                .map(JobStatus::stage)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        long duration = Math.max(0, Duration.between(handle.startedAt(), now).toSeconds());
        String content = ArtifactDocument.render(
                "Learned pipeline for " + profile.language() + "/" + profile.framework(),
                profile.language(), profile.framework(),
                artifact.pipelineDefinition(), artifact.imageBuildDefinition());

        return new LearnedConfig(
                LearnedConfig.idFor(profile.language(), profile.framework(),
                        artifact.pipelineDefinition(), artifact.imageBuildDefinition()),
                profile.language(),
                profile.framework(),
                String.valueOf(pipelineId),
                duration,
                stagesPassed,
                now,
                content);
    }
}
