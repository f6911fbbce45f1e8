package com.cipilot.orchestrator.healing;

/**
 * Failure categories recognised in CI job logs. {@link #label()} is the
 * snake_case form used in prompts, events and metric tags.
 */
public enum ErrorClass {
    SYNTAX("yaml_syntax"),
    ARTIFACT_MISSING("artifact_missing"),
    MISSING_IMAGE("missing_image"),
    NETWORK_TLS("network_tls"),
    PERMISSION("permission"),
    TIMEOUT("timeout"),
    MISSING_COMMAND("missing_command"),
    BUILD_FAILURE("build_failure"),
    UNCLASSIFIED("unclassified");

    private final String label;

    ErrorClass(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
