package com.cipilot.orchestrator.healing;

import com.cipilot.orchestrator.model.ExecutionReport;
import com.cipilot.orchestrator.model.HealingAttempt;
import com.cipilot.orchestrator.model.PipelineArtifact;

/**
 * Progress callbacks from the healing loop, used to persist workflow events.
 */
public interface HealingListener {

    void attemptStarted(int attempt, Classification classification, String failedJob);

    void fixCommitted(HealingAttempt attempt, PipelineArtifact artifact);

    void executionFinished(int attempt, ExecutionReport report);
}
