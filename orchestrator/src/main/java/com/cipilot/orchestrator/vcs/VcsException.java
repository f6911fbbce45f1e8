package com.cipilot.orchestrator.vcs;

/**
 * A GitLab call failed. statusCode is the HTTP status, or -1 when no
 * response was received (network error, timeout).
 */
public class VcsException extends RuntimeException {

    private final int statusCode;

    public VcsException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public VcsException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }

    public boolean isNotFound() { return statusCode == 404; }
}
