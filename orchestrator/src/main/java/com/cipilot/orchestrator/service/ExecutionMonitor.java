package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.ExecutionState;
import com.cipilot.orchestrator.model.JobStatus;
import com.cipilot.orchestrator.vcs.ExecutionStatus;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Polls GitLab until the pipeline for a commit finishes or the wait budget runs out.
 *
 * States: QUEUED → RUNNING → SUCCEEDED | FAILED | CANCELED, or TIMED_OUT when the
 * budget (max-wait / poll-interval polls) is used up first. A failed poll is
 * logged and does not change the state; the next poll simply tries again.
 * The cancellation signal is checked before every poll.
 */
@Component
public class ExecutionMonitor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMonitor.class);

    private final GitLabClient gitLab;
    private final Sleeper      sleeper;
    private final Duration     pollInterval;
    private final int          maxPolls;

    public ExecutionMonitor(GitLabClient gitLab,
                            Sleeper sleeper,
                            @Value("${cipilot.monitor.poll-interval:30s}") Duration pollInterval,
                            @Value("${cipilot.monitor.max-wait:15m}") Duration maxWait) {
        this.gitLab       = gitLab;
        this.sleeper      = sleeper;
        this.pollInterval = pollInterval;
        this.maxPolls     = (int) Math.max(1, maxWait.toMillis() / pollInterval.toMillis());
    }

    public int maxPolls() { return maxPolls; }

    /**
     * Block until the execution triggered by {@code handle} reaches a final state.
     *
     * @throws WorkflowAbortedException if the workflow is cancelled while waiting
     */
    public ExecutionReport await(WorkflowContext ctx, ExecutionHandle handle) {
        ExecutionState state = ExecutionState.QUEUED;
        Long pipelineId = null;

        for (int poll = 1; poll <= maxPolls; poll++) {
            ctx.signal().throwIfCancelled();

            try {
                Optional<ExecutionStatus> status = gitLab.getExecutionStatus(
                        ctx.project(), ctx.token(), handle.branch(), handle.commitId());
                if (status.isPresent()) {
                    pipelineId = status.get().id();
                    ExecutionState next = status.get().state();
                    if (next != state) {
                        log.info("Pipeline {} on {}: {} -> {}", pipelineId, handle.branch(), state, next);
                        state = next;
                    }
                }
            } catch (VcsException e) {
                log.warn("Poll {}/{} for {}@{} failed, retrying next interval: {}",
                        poll, maxPolls, handle.branch(), shortSha(handle), e.getMessage());
            }

            if (state.isFinished()) {
                return new ExecutionReport(state, pipelineId, jobs(ctx, pipelineId), poll);
            }
            if (poll < maxPolls) {
                pause();
            }
        }

        log.warn("Pipeline for {}@{} still {} after {} polls, giving up",
                handle.branch(), shortSha(handle), state, maxPolls);
        return new ExecutionReport(ExecutionState.TIMED_OUT, pipelineId,
                pipelineId == null ? List.of() : jobs(ctx, pipelineId), maxPolls);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private List<JobStatus> jobs(WorkflowContext ctx, Long pipelineId) {
        try {
            return gitLab.getJobs(ctx.project(), ctx.token(), pipelineId);
        } catch (VcsException e) {
            log.warn("Could not fetch jobs of pipeline {}: {}", pipelineId, e.getMessage());
            return List.of();
        }
    }

    private void pause() {
        try {
            sleeper.sleep(pollInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowAbortedException("interrupted while waiting for the pipeline");
        }
    }

    private static String shortSha(ExecutionHandle handle) {
        String sha = handle.commitId();
        return sha != null && sha.length() > 8 ? sha.substring(0, 8) : sha;
    }
}
