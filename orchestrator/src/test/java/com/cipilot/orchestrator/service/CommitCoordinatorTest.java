package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.vcs.CommitAction;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import com.cipilot.orchestrator.vcs.VcsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommitCoordinatorTest {

    private static final String REPO = "http://gitlab/group/app";
    private static final GitLabProject PROJECT = new GitLabProject("http://gitlab", "group/app");
    private static final Instant NOW = Instant.parse("2026-03-04T05:06:07Z");
    private static final RepositoryProfile PROFILE = new RepositoryProfile("java", "spring", "maven", true);
    private static final PipelineArtifact ARTIFACT =
            PipelineArtifact.of("stages: [build]\n", "FROM eclipse-temurin:21\n", ArtifactSource.EXACT_TEMPLATE);

    @Mock GitLabClient gitLab;
    @Captor ArgumentCaptor<List<CommitAction>> actions;

    CommitCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new CommitCoordinator(gitLab, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(gitLab.project(REPO)).thenReturn(PROJECT);
    }

    // ------------------------------------------------------------------
    // commit()
    // ------------------------------------------------------------------

    @Test
    void commit_newBranch_isForkedFromDefaultBranchAndGetsBothFiles() {
        when(gitLab.branchExists(eq(PROJECT), eq("tok"), anyString())).thenReturn(false);
        when(gitLab.defaultBranch(PROJECT, "tok")).thenReturn("main");
        when(gitLab.fileExists(eq(PROJECT), eq("tok"), eq(".gitlab-ci.yml"), anyString())).thenReturn(false);
        when(gitLab.fileExists(eq(PROJECT), eq("tok"), eq("Dockerfile"), anyString())).thenReturn(true);
        when(gitLab.commitFiles(eq(PROJECT), eq("tok"), anyString(), any(), anyString())).thenReturn("sha1");

        ExecutionHandle handle = coordinator.commit(ARTIFACT, PROFILE, WorkflowRequest.of(REPO, "tok"));

        assertThat(handle.commitId()).isEqualTo("sha1");
        assertThat(handle.branch()).matches("cipilot/pipeline-20260304-050607-[0-9a-f]{4}");
        assertThat(handle.startedAt()).isEqualTo(NOW);
        verify(gitLab).createBranch(PROJECT, "tok", handle.branch(), "main");
        verify(gitLab).commitFiles(eq(PROJECT), eq("tok"), eq(handle.branch()), actions.capture(),
                eq("ci: add java/spring pipeline (exact_template)"));
        assertThat(actions.getValue()).containsExactly(
                CommitAction.create(".gitlab-ci.yml", "stages: [build]\n"),
                CommitAction.update("Dockerfile", "FROM eclipse-temurin:21\n"));
    }

    @Test
    void commit_requestedExistingBranch_isReusedAndPipelineOnlySkipsDockerfile() {
        WorkflowRequest request = new WorkflowRequest(REPO, "tok", "", true, "ci/setup", false, null);
        when(gitLab.branchExists(PROJECT, "tok", "ci/setup")).thenReturn(true);
        when(gitLab.fileExists(PROJECT, "tok", ".gitlab-ci.yml", "ci/setup")).thenReturn(true);
        when(gitLab.commitFiles(eq(PROJECT), eq("tok"), eq("ci/setup"), any(), anyString())).thenReturn("sha2");

        ExecutionHandle handle = coordinator.commit(ARTIFACT, PROFILE, request);

        assertThat(handle.branch()).isEqualTo("ci/setup");
        verify(gitLab, never()).createBranch(any(), any(), any(), any());
        verify(gitLab).commitFiles(eq(PROJECT), eq("tok"), eq("ci/setup"), actions.capture(), anyString());
        assertThat(actions.getValue()).extracting(CommitAction::filePath).containsExactly(".gitlab-ci.yml");
    }

    @Test
    void commit_gitLabRejects_throwsCommitFailed() {
        when(gitLab.branchExists(eq(PROJECT), eq("tok"), anyString())).thenThrow(new VcsException(403, "forbidden"));

        assertThatThrownBy(() -> coordinator.commit(ARTIFACT, PROFILE, WorkflowRequest.of(REPO, "tok")))
                .isInstanceOf(CommitFailedException.class)
                .hasMessageContaining("group/app")
                .hasCauseInstanceOf(VcsException.class);
    }

    // ------------------------------------------------------------------
    // commitFix()
    // ------------------------------------------------------------------

    @Test
    void commitFix_goesToTheSameBranch() {
        ExecutionHandle previous = new ExecutionHandle("sha1", "cipilot/pipeline-x", Instant.EPOCH);
        when(gitLab.fileExists(eq(PROJECT), eq("tok"), anyString(), eq("cipilot/pipeline-x"))).thenReturn(true);
        when(gitLab.commitFiles(eq(PROJECT), eq("tok"), eq("cipilot/pipeline-x"), any(), eq("ci: fix")))
                .thenReturn("sha3");

        ExecutionHandle next = coordinator.commitFix(previous, ARTIFACT, WorkflowRequest.of(REPO, "tok"), "ci: fix");

        assertThat(next).isEqualTo(new ExecutionHandle("sha3", "cipilot/pipeline-x", NOW));
        verify(gitLab, never()).createBranch(any(), any(), any(), any());
    }

    @Test
    void newBranchName_usesUtcTimestampAndHexSuffix() {
        assertThat(coordinator.newBranchName()).startsWith("cipilot/pipeline-20260304-050607-").hasSize(37);
    }
}
