package com.cipilot.orchestrator.model;

import com.cipilot.orchestrator.healing.ErrorClass;

/**
 * Record of one self-healing iteration. attemptNumber starts at 1.
 */
public record HealingAttempt(
        int             attemptNumber,
        ErrorClass      errorClass,
        String          fixDescription,
        ExecutionHandle newExecution
) {}
