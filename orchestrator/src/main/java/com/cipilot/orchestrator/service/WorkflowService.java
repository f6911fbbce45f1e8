package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.analyzer.RepositoryAnalyzer;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.LearnedConfig;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.model.WorkflowState;
import com.cipilot.orchestrator.pipeline.Generation;
import com.cipilot.orchestrator.pipeline.GenerationCoordinator;
import com.cipilot.orchestrator.pipeline.PipelineValidator;
import com.cipilot.orchestrator.pipeline.ValidationResult;
import com.cipilot.orchestrator.store.PipelineTemplate;
import com.cipilot.orchestrator.store.TemplateStoreClient;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for everything the API exposes.
 *
 * startWorkflow runs analysis, generation and the first commit on the caller's
 * thread, so a commit failure reaches the caller directly. Everything after the
 * commit (monitoring, healing, learning) is handed to {@link WorkflowRunner}.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final RepositoryAnalyzer    analyzer;
    private final GenerationCoordinator generator;
    private final CommitCoordinator     commits;
    private final WorkflowRecorder      recorder;
    private final WorkflowRunner        runner;
    private final GitLabClient          gitLab;
    private final TemplateStoreClient   store;
    private final PipelineValidator     validator;
    private final int                   defaultMaxAttempts;

    public WorkflowService(RepositoryAnalyzer analyzer,
                           GenerationCoordinator generator,
                           CommitCoordinator commits,
                           WorkflowRecorder recorder,
                           WorkflowRunner runner,
                           GitLabClient gitLab,
                           TemplateStoreClient store,
                           PipelineValidator validator,
                           @Value("${cipilot.healing.max-attempts:10}") int defaultMaxAttempts) {
        this.analyzer           = analyzer;
        this.generator          = generator;
        this.commits            = commits;
        this.recorder           = recorder;
        this.runner             = runner;
        this.gitLab             = gitLab;
        this.store              = store;
        this.validator          = validator;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    // ------------------------------------------------------------------
    // Workflows
    // ------------------------------------------------------------------

    /**
     * Analyze, generate, commit, then detach the background task.
     *
     * @throws IllegalArgumentException if the repository reference is malformed
     * @throws com.cipilot.orchestrator.analyzer.RepositoryNotFoundException if GitLab does not know the project
     * @throws CommitFailedException if the commit cannot be written
     */
    public StartedWorkflow startWorkflow(WorkflowRequest request) {
        GitLabProject project = gitLab.project(request.repoUrl());
        int maxAttempts = request.maxAttempts() != null ? request.maxAttempts() : defaultMaxAttempts;

        Workflow wf = recorder.create(request.repoUrl(), maxAttempts);
        UUID id = wf.getId();
        MDC.put("workflowId", id.toString());
        try {
            log.info("Starting workflow for {}", request);
            RepositoryProfile profile = analyzer.analyze(request.repoUrl(), request.token());
            recorder.profileDetected(id, profile);

            Generation generation = generator.generate(profile, request.additionalContext(),
                    request.useTemplateOnly());
            recorder.generated(id, generation);

            ExecutionHandle handle = commits.commit(generation.artifact(), profile, request);
            recorder.committed(id, handle);

            WorkflowContext ctx = new WorkflowContext(id, request, project, profile, maxAttempts,
                    new CancellationSignal());
            runner.launch(ctx, generation.artifact(), handle);
            return new StartedWorkflow(id, handle.commitId(), handle.branch(), generation.provenance());
        } catch (RuntimeException e) {
            log.error("Workflow {} failed before monitoring: {}", id, e.getMessage());
            recorder.finish(id, WorkflowState.FAILED, e.getMessage());
            throw e;
        } finally {
            MDC.remove("workflowId");
        }
    }

    /**
     * Analyze and generate without committing anything.
     */
    public Generation preview(WorkflowRequest request) {
        RepositoryProfile profile = analyzer.analyze(request.repoUrl(), request.token());
        return generator.generate(profile, request.additionalContext(), request.useTemplateOnly());
    }

    public WorkflowStatus getWorkflowStatus(UUID id) {
        return recorder.status(id).orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    /**
     * @return true if the background task was signalled, false if the workflow
     *         has already reached a terminal state
     */
    public boolean abort(UUID id) {
        WorkflowState state = recorder.state(id).orElseThrow(() -> new WorkflowNotFoundException(id));
        if (state.isTerminal()) {
            return false;
        }
        if (!runner.abort(id, "aborted by request")) {
            // Active in the database but not owned by this process.
            recorder.finish(id, WorkflowState.ABORTED, "aborted by request");
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Learning callback and templates
    // ------------------------------------------------------------------

    /**
     * Record the callback posted by the learn_record job. The learned config
     * itself is written by the background task once the quality gate passes.
     */
    public boolean recordLearnCallback(String projectUrl, String branch, String pipelineId) {
        boolean matched = recorder.learnCallback(branch, pipelineId, projectUrl);
        if (!matched) {
            log.info("Learn callback for unknown branch '{}' of {} ignored", branch, projectUrl);
        }
        return matched;
    }

    /**
     * Seed the template collection with a known-good pair.
     *
     * @return the template id
     * @throws IllegalArgumentException if neither file is given or the pipeline is invalid
     */
    public String uploadTemplate(String language, String framework, String pipelineDefinition,
                                 String imageBuildDefinition, String description) {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language is required");
        }
        String lang = language.strip().toLowerCase();
        String fw   = framework == null || framework.isBlank() ? "generic" : framework.strip().toLowerCase();
        boolean hasPipeline = pipelineDefinition != null && !pipelineDefinition.isBlank();
        boolean hasImage    = imageBuildDefinition != null && !imageBuildDefinition.isBlank();
        if (!hasPipeline && !hasImage) {
            throw new IllegalArgumentException("at least one of pipeline or Dockerfile is required");
        }
        if (hasPipeline) {
            ValidationResult result = validator.validatePipeline(pipelineDefinition);
            if (!result.isValid()) {
                throw new IllegalArgumentException("invalid pipeline: " + result);
            }
        }

        String id = "manual_" + lang + "_" + fw + "_"
                + LearnedConfig.contentHash(pipelineDefinition, imageBuildDefinition);
        store.upsertTemplate(new PipelineTemplate(id, lang, fw,
                hasPipeline ? pipelineDefinition : null,
                hasImage ? imageBuildDefinition : null), description);
        log.info("Stored template {}", id);
        return id;
    }
}
