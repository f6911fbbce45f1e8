package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.analyzer.RepositoryAnalyzer;
import com.cipilot.orchestrator.analyzer.RepositoryNotFoundException;
import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.Workflow;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.model.WorkflowState;
import com.cipilot.orchestrator.pipeline.Generation;
import com.cipilot.orchestrator.pipeline.GenerationCoordinator;
import com.cipilot.orchestrator.pipeline.PipelineValidator;
import com.cipilot.orchestrator.pipeline.ReferenceTier;
import com.cipilot.orchestrator.store.PipelineTemplate;
import com.cipilot.orchestrator.store.TemplateStoreClient;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import com.cipilot.orchestrator.vcs.VcsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for WorkflowService.
 *
 * All collaborators are mocked with Mockito: no Spring context, no database,
 * no network.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    private static final String REPO = "http://gitlab/group/app";
    private static final GitLabProject PROJECT = new GitLabProject("http://gitlab", "group/app");
    private static final RepositoryProfile PROFILE = new RepositoryProfile("go", "generic", "go modules", false);
    private static final PipelineArtifact ARTIFACT =
            PipelineArtifact.of("stages: [build]\n", "FROM golang:1.22\n", ArtifactSource.GENERATED);
    private static final Generation GENERATION = new Generation(ARTIFACT, ReferenceTier.DEFAULT, false);

    @Mock RepositoryAnalyzer    analyzer;
    @Mock GenerationCoordinator generator;
    @Mock CommitCoordinator     commits;
    @Mock WorkflowRecorder      recorder;
    @Mock WorkflowRunner        runner;
    @Mock GitLabClient          gitLab;
    @Mock TemplateStoreClient   store;

    WorkflowService service;

    @BeforeEach
    void setUp() {
        service = new WorkflowService(analyzer, generator, commits, recorder, runner, gitLab, store,
                new PipelineValidator(), 10);
    }

    // ------------------------------------------------------------------
    // startWorkflow()
    // ------------------------------------------------------------------

    @Test
    void startWorkflow_happyPath_commitsAndLaunchesBackgroundTask() {
        Workflow wf = workflowWithId();
        WorkflowRequest request = WorkflowRequest.of(REPO, "tok");
        ExecutionHandle handle = new ExecutionHandle("sha1", "cipilot/pipeline-1", Instant.EPOCH);
        when(gitLab.project(REPO)).thenReturn(PROJECT);
        when(recorder.create(REPO, 10)).thenReturn(wf);
        when(analyzer.analyze(REPO, "tok")).thenReturn(PROFILE);
        when(generator.generate(PROFILE, "", false)).thenReturn(GENERATION);
        when(commits.commit(ARTIFACT, PROFILE, request)).thenReturn(handle);

        StartedWorkflow started = service.startWorkflow(request);

        assertThat(started.workflowId()).isEqualTo(wf.getId());
        assertThat(started.commitId()).isEqualTo("sha1");
        assertThat(started.branch()).isEqualTo("cipilot/pipeline-1");
        assertThat(started.provenance()).isEqualTo(ArtifactSource.GENERATED);
        verify(recorder).profileDetected(wf.getId(), PROFILE);
        verify(recorder).generated(wf.getId(), GENERATION);
        verify(recorder).committed(wf.getId(), handle);

        ArgumentCaptor<WorkflowContext> ctx = ArgumentCaptor.forClass(WorkflowContext.class);
        verify(runner).launch(ctx.capture(), eq(ARTIFACT), eq(handle));
        assertThat(ctx.getValue().maxAttempts()).isEqualTo(10);
        assertThat(ctx.getValue().project()).isEqualTo(PROJECT);
        assertThat(ctx.getValue().token()).isEqualTo("tok");
    }

    @Test
    void startWorkflow_requestBudget_overridesTheDefault() {
        Workflow wf = workflowWithId();
        WorkflowRequest request = new WorkflowRequest(REPO, "tok", "", false, null, true, 3);
        when(gitLab.project(REPO)).thenReturn(PROJECT);
        when(recorder.create(REPO, 3)).thenReturn(wf);
        when(analyzer.analyze(REPO, "tok")).thenReturn(PROFILE);
        when(generator.generate(PROFILE, "", true)).thenReturn(GENERATION);
        when(commits.commit(ARTIFACT, PROFILE, request))
                .thenReturn(new ExecutionHandle("sha1", "b", Instant.EPOCH));

        service.startWorkflow(request);

        ArgumentCaptor<WorkflowContext> ctx = ArgumentCaptor.forClass(WorkflowContext.class);
        verify(runner).launch(ctx.capture(), any(), any());
        assertThat(ctx.getValue().maxAttempts()).isEqualTo(3);
    }

    @Test
    void startWorkflow_commitFails_marksFailedAndRethrows() {
        Workflow wf = workflowWithId();
        WorkflowRequest request = WorkflowRequest.of(REPO, "tok");
        when(gitLab.project(REPO)).thenReturn(PROJECT);
        when(recorder.create(REPO, 10)).thenReturn(wf);
        when(analyzer.analyze(REPO, "tok")).thenReturn(PROFILE);
        when(generator.generate(PROFILE, "", false)).thenReturn(GENERATION);
        when(commits.commit(ARTIFACT, PROFILE, request))
                .thenThrow(new CommitFailedException("Commit to group/app failed: 403", new VcsException(403, "forbidden")));

        assertThatThrownBy(() -> service.startWorkflow(request)).isInstanceOf(CommitFailedException.class);

        verify(recorder).finish(eq(wf.getId()), eq(WorkflowState.FAILED), anyString());
        verify(runner, never()).launch(any(), any(), any());
    }

    @Test
    void startWorkflow_unknownRepository_marksFailedAndRethrows() {
        Workflow wf = workflowWithId();
        when(gitLab.project(REPO)).thenReturn(PROJECT);
        when(recorder.create(REPO, 10)).thenReturn(wf);
        when(analyzer.analyze(REPO, "tok")).thenThrow(new RepositoryNotFoundException("Repository not found: group/app"));

        assertThatThrownBy(() -> service.startWorkflow(WorkflowRequest.of(REPO, "tok")))
                .isInstanceOf(RepositoryNotFoundException.class);

        verify(recorder).finish(eq(wf.getId()), eq(WorkflowState.FAILED), anyString());
        verify(commits, never()).commit(any(), any(), any());
    }

    // ------------------------------------------------------------------
    // abort() / status
    // ------------------------------------------------------------------

    @Test
    void abort_terminalWorkflow_returnsFalse() {
        UUID id = UUID.randomUUID();
        when(recorder.state(id)).thenReturn(Optional.of(WorkflowState.SUCCEEDED));

        assertThat(service.abort(id)).isFalse();
        verify(runner, never()).abort(any(), any());
    }

    @Test
    void abort_activeButNotOwnedByThisProcess_isFinishedDirectly() {
        UUID id = UUID.randomUUID();
        when(recorder.state(id)).thenReturn(Optional.of(WorkflowState.MONITORING));
        when(runner.abort(eq(id), anyString())).thenReturn(false);

        assertThat(service.abort(id)).isTrue();
        verify(recorder).finish(eq(id), eq(WorkflowState.ABORTED), anyString());
    }

    @Test
    void getWorkflowStatus_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(recorder.status(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getWorkflowStatus(id)).isInstanceOf(WorkflowNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // uploadTemplate()
    // ------------------------------------------------------------------

    @Test
    void uploadTemplate_validPipeline_storesWithManualId() {
        String pipeline = "stages: [build]\nbuild:\n  stage: build\n  script: [make]\n";

        String id = service.uploadTemplate("Java", null, pipeline, null, "Plain Maven build");

        assertThat(id).matches("manual_java_generic_[0-9a-f]{16}");
        ArgumentCaptor<PipelineTemplate> template = ArgumentCaptor.forClass(PipelineTemplate.class);
        verify(store).upsertTemplate(template.capture(), eq("Plain Maven build"));
        assertThat(template.getValue().id()).isEqualTo(id);
        assertThat(template.getValue().imageBuildDefinition()).isNull();
    }

    @Test
    void uploadTemplate_invalidInput_isRejected() {
        assertThatThrownBy(() -> service.uploadTemplate("java", "spring", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.uploadTemplate("java", "spring", "stages: []\n", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid pipeline");
        assertThatThrownBy(() -> service.uploadTemplate(" ", "spring", null, "FROM alpine", null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(store, never()).upsertTemplate(any(), any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Workflow workflowWithId() {
        Workflow wf = new Workflow(REPO, 10);
        try {
            var f = Workflow.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(wf, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return wf;
    }
}
