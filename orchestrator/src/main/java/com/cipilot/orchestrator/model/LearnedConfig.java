package com.cipilot.orchestrator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * A pipeline configuration captured from a fully passing execution.
 *
 * The id depends only on language, framework and file content, so storing the
 * same files twice lands on the same record (the store upserts by id).
 * Entries are never updated in place; the selector picks the best one at read time.
 */
public record LearnedConfig(
        String  id,
        String  language,
        String  framework,
        String  pipelineId,
        long    durationSeconds,
        int     stagesPassedCount,
        Instant timestamp,
        String  content
) {

    private static final int HASH_LENGTH = 16;

    public static String idFor(String language, String framework,
                               String pipelineDefinition, String imageBuildDefinition) {
        return "learned_" + language.toLowerCase() + "_" + framework.toLowerCase() + "_"
                + contentHash(pipelineDefinition, imageBuildDefinition);
    }

    /** First 16 hex chars of SHA-256 over both files. */
    public static String contentHash(String pipelineDefinition, String imageBuildDefinition) {
        String joined = nullToEmpty(pipelineDefinition) + "\n---\n" + nullToEmpty(imageBuildDefinition);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(joined.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JRE
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
