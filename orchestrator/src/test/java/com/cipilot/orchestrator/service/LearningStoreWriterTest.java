package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.ExecutionState;
import com.cipilot.orchestrator.model.JobStatus;
import com.cipilot.orchestrator.model.LearnedConfig;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.store.ArtifactDocument;
import com.cipilot.orchestrator.store.StoreException;
import com.cipilot.orchestrator.store.TemplateStoreClient;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LearningStoreWriter with a real QualityGate and a mocked store.
 */
@ExtendWith(MockitoExtension.class)
class LearningStoreWriterTest {

    private static final GitLabProject PROJECT = new GitLabProject("http://gitlab", "group/app");
    private static final Instant STARTED = Instant.parse("2026-01-01T10:00:00Z");
    private static final Instant NOW = STARTED.plusSeconds(245);
    private static final ExecutionHandle HANDLE = new ExecutionHandle("sha", "cipilot/pipeline-1", STARTED);
    private static final ExecutionReport SUCCEEDED = new ExecutionReport(ExecutionState.SUCCEEDED, 55L, List.of(), 4);
    private static final PipelineArtifact ARTIFACT = PipelineArtifact.of("""
            stages: [build, test, learn]
            build:
              stage: build
              script: [make]
            lint:
              stage: test
              allow_failure: true
              script: [make lint]
            unit:
              stage: test
              script: [make test]
            """, "FROM alpine:3.20\n", ArtifactSource.GENERATED);

    @Mock GitLabClient        gitLab;
    @Mock TemplateStoreClient store;

    LearningStoreWriter writer;
    WorkflowContext     ctx;

    @BeforeEach
    void setUp() {
        writer = new LearningStoreWriter(gitLab, store, new QualityGate(), Clock.fixed(NOW, ZoneOffset.UTC));
        ctx = new WorkflowContext(UUID.randomUUID(), WorkflowRequest.of("group/app", "tok"), PROJECT,
                new RepositoryProfile("rust", "generic", "cargo", false), 10, new CancellationSignal());
    }

    @Test
    void learn_allJobsPassed_storesConfigWithStageCountAndDuration() {
        when(gitLab.getJobs(PROJECT, "tok", 55L)).thenReturn(List.of(
                job("build", "build", "success"),
                job("lint", "test", "success"),
                job("unit", "test", "success"),
                job("learn_record", "learn", "success")));

        Optional<LearnedConfig> learned = writer.learn(ctx, HANDLE, SUCCEEDED, ARTIFACT);

        assertThat(learned).isPresent();
        LearnedConfig config = learned.get();
        assertThat(config.id()).isEqualTo(LearnedConfig.idFor("rust", "generic",
                ARTIFACT.pipelineDefinition(), ARTIFACT.imageBuildDefinition()));
        assertThat(config.id()).matches("learned_rust_generic_[0-9a-f]{16}");
        assertThat(config.stagesPassedCount()).isEqualTo(3);
        assertThat(config.durationSeconds()).isEqualTo(245);
        assertThat(config.pipelineId()).isEqualTo("55");
        assertThat(ArtifactDocument.pipelineDefinition(config.content())).contains(ARTIFACT.pipelineDefinition().strip());
        verify(store).upsertLearnedConfig(config);
    }

    @Test
    void learn_sameFilesTwice_upsertsTheSameId() {
        when(gitLab.getJobs(PROJECT, "tok", 55L)).thenReturn(List.of(job("build", "build", "success")));

        writer.learn(ctx, HANDLE, SUCCEEDED, ARTIFACT);
        writer.learn(ctx, new ExecutionHandle("sha2", "other", STARTED.plusSeconds(100)), SUCCEEDED, ARTIFACT);

        ArgumentCaptor<LearnedConfig> stored = ArgumentCaptor.forClass(LearnedConfig.class);
        verify(store, times(2)).upsertLearnedConfig(stored.capture());
        assertThat(stored.getAllValues()).extracting(LearnedConfig::id).containsOnly(stored.getAllValues().get(0).id());
    }

    @Test
    void learn_pipelineOnlyWorkflow_doesNotStoreTheUncommittedDockerfile() {
        WorkflowRequest request = new WorkflowRequest("group/app", "tok", "", true, null, false, null);
        WorkflowContext pipelineOnly = new WorkflowContext(UUID.randomUUID(), request, PROJECT,
                new RepositoryProfile("rust", "generic", "cargo", false), 10, new CancellationSignal());
        PipelineArtifact withUnbuiltImage = ARTIFACT.withFiles(ARTIFACT.pipelineDefinition(), "FROM never-committed:1\n");
        when(gitLab.getJobs(PROJECT, "tok", 55L)).thenReturn(List.of(job("build", "build", "success")));

        LearnedConfig config = writer.learn(pipelineOnly, HANDLE, SUCCEEDED, withUnbuiltImage).orElseThrow();

        assertThat(ArtifactDocument.imageBuildDefinition(config.content())).isEmpty();
        assertThat(config.content()).doesNotContain("never-committed");
        assertThat(config.id()).isEqualTo(LearnedConfig.idFor("rust", "generic", ARTIFACT.pipelineDefinition(), null));
    }

    @Test
    void learn_toleratedFailure_isNotStored() {
        when(gitLab.getJobs(PROJECT, "tok", 55L)).thenReturn(List.of(
                job("build", "build", "success"),
                new JobStatus(2, "lint", "test", "failed", true),
                job("unit", "test", "success")));

        assertThat(writer.learn(ctx, HANDLE, SUCCEEDED, ARTIFACT)).isEmpty();
        verify(store, never()).upsertLearnedConfig(any());
    }

    @Test
    void learn_storeUnavailable_isNotFatal() {
        when(gitLab.getJobs(PROJECT, "tok", 55L)).thenReturn(List.of(job("build", "build", "success")));
        doThrow(new StoreException("chroma down")).when(store).upsertLearnedConfig(any());

        assertThat(writer.learn(ctx, HANDLE, SUCCEEDED, ARTIFACT)).isEmpty();
    }

    @Test
    void learn_executionNotSucceeded_isRejected() {
        ExecutionReport failed = new ExecutionReport(ExecutionState.FAILED, 55L, List.of(), 4);

        assertThatThrownBy(() -> writer.learn(ctx, HANDLE, failed, ARTIFACT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static JobStatus job(String name, String stage, String status) {
        return new JobStatus(name.hashCode(), name, stage, status, false);
    }
}
