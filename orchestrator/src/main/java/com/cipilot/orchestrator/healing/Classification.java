package com.cipilot.orchestrator.healing;

/**
 * Result of classifying a failure log.
 *
 * @param evidence the first log line that matched, or "" when unclassified
 */
public record Classification(ErrorClass errorClass, String evidence) {

    public static Classification unclassified() {
        return new Classification(ErrorClass.UNCLASSIFIED, "");
    }
}
