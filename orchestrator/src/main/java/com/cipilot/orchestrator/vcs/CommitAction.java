package com.cipilot.orchestrator.vcs;

/**
 * One file change in a GitLab commit. action is "create" or "update".
 */
public record CommitAction(String action, String filePath, String content) {

    public static CommitAction create(String filePath, String content) {
        return new CommitAction("create", filePath, content);
    }

    public static CommitAction update(String filePath, String content) {
        return new CommitAction("update", filePath, content);
    }
}
