package com.cipilot.orchestrator.healing;

import com.cipilot.orchestrator.claude.ClaudeClient;
import com.cipilot.orchestrator.claude.ModelUnavailableException;
import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.ExecutionState;
import com.cipilot.orchestrator.model.HealingAttempt;
import com.cipilot.orchestrator.model.JobLog;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.pipeline.ArtifactNormalizer;
import com.cipilot.orchestrator.pipeline.DefaultTemplates;
import com.cipilot.orchestrator.pipeline.PipelineValidator;
import com.cipilot.orchestrator.service.CancellationSignal;
import com.cipilot.orchestrator.service.CommitCoordinator;
import com.cipilot.orchestrator.service.ExecutionMonitor;
import com.cipilot.orchestrator.service.WorkflowAbortedException;
import com.cipilot.orchestrator.service.WorkflowContext;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SelfHealingEngine.
 *
 * GitLab, the model, commits and the monitor are mocked; classifier, validator
 * and normalizer are real. Every fix the fake model proposes adds a uniquely
 * named job so no two proposals are identical.
 */
@ExtendWith(MockitoExtension.class)
class SelfHealingEngineTest {

    private static final GitLabProject PROJECT = new GitLabProject("http://gitlab", "group/app");
    private static final ExecutionHandle FIRST = new ExecutionHandle("c0", "cipilot/pipeline-1", Instant.EPOCH);
    private static final ExecutionReport FAILED = new ExecutionReport(ExecutionState.FAILED, 100L, List.of(), 3);

    @Mock GitLabClient      gitLab;
    @Mock ClaudeClient      claude;
    @Mock CommitCoordinator commits;
    @Mock ExecutionMonitor  monitor;
    @Mock HealingListener   listener;

    SimpleMeterRegistry meterRegistry;
    SelfHealingEngine   engine;
    PipelineArtifact    initial;

    private final AtomicInteger fixCounter    = new AtomicInteger();
    private final AtomicInteger commitCounter = new AtomicInteger();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ArtifactNormalizer normalizer = new ArtifactNormalizer("http://cb");
        engine = new SelfHealingEngine(gitLab, new ErrorClassifier(), claude, normalizer,
                new PipelineValidator(), commits, monitor, meterRegistry);
        initial = normalizer.normalize(DefaultTemplates.forLanguage("java"));
    }

    // ------------------------------------------------------------------
    // Loop termination
    // ------------------------------------------------------------------

    @Test
    void heal_fixedOnFirstAttempt_succeeds() {
        failingCompileLog();
        modelProposesFreshFixes();
        commitsReturnNewHandles();
        when(monitor.await(any(), any()))
                .thenReturn(new ExecutionReport(ExecutionState.SUCCEEDED, 101L, List.of(), 2));

        SelfHealingEngine.Outcome outcome = engine.heal(ctx(10), initial, FIRST, FAILED, listener);

        assertThat(outcome.result()).isEqualTo(SelfHealingEngine.Result.SUCCEEDED);
        assertThat(outcome.attempts()).hasSize(1);
        assertThat(outcome.artifact().pipelineDefinition()).contains("fix_1:").contains("learn_record:");
        assertThat(outcome.handle().commitId()).isEqualTo("c1");
        assertThat(outcome.lastClassification().errorClass()).isEqualTo(ErrorClass.BUILD_FAILURE);
        verify(listener).attemptStarted(eq(1), any(), eq("compile"));
        assertThat(meterRegistry.counter("cipilot.healing.attempts", "error_class", "build_failure").count())
                .isEqualTo(1.0);
    }

    @Test
    void heal_elevenConsecutiveFailures_exhaustsBudgetOfTen() {
        failingCompileLog();
        modelProposesFreshFixes();
        commitsReturnNewHandles();
        when(monitor.await(any(), any())).thenReturn(FAILED);

        SelfHealingEngine.Outcome outcome = engine.heal(ctx(10), initial, FIRST, FAILED, listener);

        assertThat(outcome.result()).isEqualTo(SelfHealingEngine.Result.EXHAUSTED);
        assertThat(outcome.attempts()).extracting(HealingAttempt::attemptNumber)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        verify(commits, times(10)).commitFix(any(), any(), any(), anyString());
        verify(monitor, times(10)).await(any(), any());
    }

    @Test
    void heal_monitorTimesOutAfterFix_reportsTimeout() {
        failingCompileLog();
        modelProposesFreshFixes();
        commitsReturnNewHandles();
        when(monitor.await(any(), any()))
                .thenReturn(new ExecutionReport(ExecutionState.TIMED_OUT, 101L, List.of(), 30));

        SelfHealingEngine.Outcome outcome = engine.heal(ctx(10), initial, FIRST, FAILED, listener);

        assertThat(outcome.result()).isEqualTo(SelfHealingEngine.Result.TIMED_OUT);
        assertThat(outcome.report().polls()).isEqualTo(30);
    }

    // ------------------------------------------------------------------
    // Fix generation failures
    // ------------------------------------------------------------------

    @Test
    void heal_modelFailsTwice_throwsFixGenerationException() {
        failingCompileLog();
        when(claude.complete(anyString(), anyString()))
                .thenThrow(new ModelUnavailableException(503, "unavailable"));

        assertThatThrownBy(() -> engine.heal(ctx(10), initial, FIRST, FAILED, listener))
                .isInstanceOf(FixGenerationException.class);

        verify(claude, times(2)).complete(anyString(), anyString());
        verify(commits, never()).commitFix(any(), any(), any(), anyString());
    }

    @Test
    void heal_invalidProposalThenValidOne_usesTheRetry() {
        failingCompileLog();
        when(claude.complete(anyString(), anyString()))
                .thenReturn("---GITLAB_CI---\nnot: [valid\n---END---\n")
                .thenReturn(fixResponse("fix_retry"));
        commitsReturnNewHandles();
        when(monitor.await(any(), any()))
                .thenReturn(new ExecutionReport(ExecutionState.SUCCEEDED, 101L, List.of(), 1));

        SelfHealingEngine.Outcome outcome = engine.heal(ctx(3), initial, FIRST, FAILED, listener);

        assertThat(outcome.result()).isEqualTo(SelfHealingEngine.Result.SUCCEEDED);
        assertThat(outcome.artifact().pipelineDefinition()).contains("fix_retry:");
    }

    @Test
    void heal_proposalIdenticalToFailingFiles_isRejected() {
        failingCompileLog();
        when(claude.complete(anyString(), anyString()))
                .thenReturn("---GITLAB_CI---\n" + initial.pipelineDefinition() + "---END---\n");

        assertThatThrownBy(() -> engine.heal(ctx(10), initial, FIRST, FAILED, listener))
                .isInstanceOf(FixGenerationException.class);
    }

    // ------------------------------------------------------------------
    // Pipeline-only workflows
    // ------------------------------------------------------------------

    @Test
    void heal_pipelineOnly_dockerfileOnlyProposalCountsAsNoFix() {
        failingCompileLog();
        when(claude.complete(anyString(), anyString()))
                .thenReturn("---EXPLANATION---\nNewer JDK.\n---DOCKERFILE---\nFROM eclipse-temurin:21\n---END---\n");

        assertThatThrownBy(() -> engine.heal(pipelineOnlyCtx(), initial, FIRST, FAILED, listener))
                .isInstanceOf(FixGenerationException.class);

        verify(claude, times(2)).complete(anyString(), contains("ONLY .gitlab-ci.yml IS COMMITTED"));
        verify(commits, never()).commitFix(any(), any(), any(), anyString());
    }

    @Test
    void heal_pipelineOnly_keepsCurrentDockerfile() {
        failingCompileLog();
        when(claude.complete(anyString(), anyString()))
                .thenReturn(fixResponse("fix_ci") + "---DOCKERFILE---\nFROM eclipse-temurin:21\n---END---\n");
        commitsReturnNewHandles();
        when(monitor.await(any(), any()))
                .thenReturn(new ExecutionReport(ExecutionState.SUCCEEDED, 101L, List.of(), 1));

        SelfHealingEngine.Outcome outcome = engine.heal(pipelineOnlyCtx(), initial, FIRST, FAILED, listener);

        assertThat(outcome.result()).isEqualTo(SelfHealingEngine.Result.SUCCEEDED);
        assertThat(outcome.artifact().pipelineDefinition()).contains("fix_ci:");
        assertThat(outcome.artifact().imageBuildDefinition()).isEqualTo(initial.imageBuildDefinition());
    }

    // ------------------------------------------------------------------
    // Preconditions and cancellation
    // ------------------------------------------------------------------

    @Test
    void heal_cancelledBeforeFirstAttempt_throwsAborted() {
        WorkflowContext ctx = ctx(10);
        ctx.signal().cancel("shutdown");

        assertThatThrownBy(() -> engine.heal(ctx, initial, FIRST, FAILED, listener))
                .isInstanceOf(WorkflowAbortedException.class);
        verify(claude, never()).complete(anyString(), anyString());
    }

    @Test
    void heal_reportNotFailed_isRejected() {
        ExecutionReport ok = new ExecutionReport(ExecutionState.SUCCEEDED, 100L, List.of(), 1);

        assertThatThrownBy(() -> engine.heal(ctx(10), initial, FIRST, ok, listener))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Root-cause selection
    // ------------------------------------------------------------------

    @Test
    void rootCause_prefersEarliestStageAndSkipsNotifyJobs() {
        List<String> stages = List.of("compile", "build", "test", "notify");
        JobLog notify  = new JobLog("notify_failure", "notify", "failed", false, "");
        JobLog test    = new JobLog("unit", "test", "failed", false, "1 test failed");
        JobLog compile = new JobLog("compile", "compile", "failed", false, "error: cannot find symbol");

        assertThat(SelfHealingEngine.rootCause(List.of(notify, test, compile), stages)).isSameAs(compile);
        assertThat(SelfHealingEngine.rootCause(List.of(notify), stages)).isSameAs(notify);
        assertThat(SelfHealingEngine.rootCause(List.of(), stages)).isNull();
    }

    @Test
    void rootCause_skipsEarlierJobThatIsAllowedToFail() {
        List<String> stages = List.of("compile", "security", "test", "notify");
        JobLog scan = new JobLog("dependency_scan", "compile", "failed", true, "3 vulnerabilities");
        JobLog unit = new JobLog("unit", "test", "failed", false, "Tests run: 12, Failures: 1");

        assertThat(SelfHealingEngine.rootCause(List.of(scan, unit), stages)).isSameAs(unit);
        assertThat(SelfHealingEngine.rootCause(List.of(scan), stages)).isSameAs(scan);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WorkflowContext ctx(int maxAttempts) {
        RepositoryProfile profile = new RepositoryProfile("java", "spring", "maven", false);
        return new WorkflowContext(UUID.randomUUID(), WorkflowRequest.of("group/app", "glpat-test"),
                PROJECT, profile, maxAttempts, new CancellationSignal());
    }

    private WorkflowContext pipelineOnlyCtx() {
        RepositoryProfile profile = new RepositoryProfile("java", "spring", "maven", false);
        WorkflowRequest request = new WorkflowRequest("group/app", "glpat-test", "", true, null, false, null);
        return new WorkflowContext(UUID.randomUUID(), request, PROJECT, profile, 10, new CancellationSignal());
    }

    private void failingCompileLog() {
        when(gitLab.getJobLogs(eq(PROJECT), eq("glpat-test"), anyLong())).thenReturn(List.of(
                new JobLog("notify_failure", "notify", "failed", false, "notify"),
                new JobLog("compile", "compile", "failed", false, "[ERROR] error: cannot find symbol")));
    }

    private void modelProposesFreshFixes() {
        when(claude.complete(anyString(), anyString()))
                .thenAnswer(inv -> fixResponse("fix_" + fixCounter.incrementAndGet()));
    }

    private void commitsReturnNewHandles() {
        when(commits.commitFix(any(), any(), any(), anyString())).thenAnswer(inv ->
                new ExecutionHandle("c" + commitCounter.incrementAndGet(), FIRST.branch(), Instant.EPOCH));
    }

    private static String fixResponse(String jobName) {
        return """
                ---EXPLANATION---
                Added %1$s.
                ---GITLAB_CI---
                stages:
                  - compile
                  - notify
                %1$s:
                  stage: compile
                  image: maven:3.9-eclipse-temurin-21
                  script:
                    - mvn -B compile
                ---END---
                """.formatted(jobName);
    }
}
