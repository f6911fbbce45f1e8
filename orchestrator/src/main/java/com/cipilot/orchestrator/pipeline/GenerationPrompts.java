package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;

/**
 * System prompts and user-message builders for pipeline generation and adaptation.
 *
 * Both prompts require the same output sections so one parser handles every
 * response (see {@link ResponseParser}).
 */
public final class GenerationPrompts {

    private GenerationPrompts() {}

    // ------------------------------------------------------------------
    // System prompts
    // ------------------------------------------------------------------

    public static final String GENERATE = """
            You are a senior DevOps engineer writing GitLab CI/CD configuration.

            YOUR GOAL: write a complete .gitlab-ci.yml and a matching Dockerfile for the
            repository described in the user message.

            REQUIRED PIPELINE SHAPE:
              stages, in this order: compile, build, test, security, push, notify
              - compile:  compile the code with the language's own toolchain image
              - build:    build the container image from the Dockerfile (kaniko, no docker daemon)
              - test:     run the project's tests
              - security: scan the built image
              - push:     push the image to ${CI_REGISTRY_IMAGE}
              - notify:   one job with when: on_success and one with when: on_failure

            RULES:
              - Every job must declare its stage and a script.
              - Use pinned public image tags, never :latest.
              - The toolchain image MUST match the language (maven for Java, cargo for Rust, ...).
              - Do not add a "learn" stage; it is added automatically.

            {{OUTPUT_FORMAT}}
            """.replace("{{OUTPUT_FORMAT}}", outputFormat());

    public static final String ADAPT = """
            You are a senior DevOps engineer adapting a known-good GitLab CI/CD
            configuration to a new repository.

            YOUR GOAL: the user message contains a reference configuration that is
            incomplete or was written for a different framework. Keep everything that
            still applies, change what the repository needs, and write any file the
            reference is missing.

            RULES:
              - Keep the reference's stage names and order unless they cannot work.
              - Every job must declare its stage and a script.
              - Use pinned public image tags, never :latest.
              - Do not add a "learn" stage; it is added automatically.

            {{OUTPUT_FORMAT}}
            """.replace("{{OUTPUT_FORMAT}}", outputFormat());

    private static String outputFormat() {
        return """
                OUTPUT FORMAT (MUST FOLLOW EXACTLY):

                ---EXPLANATION---
                (one short paragraph)
                ---GITLAB_CI---
                (complete .gitlab-ci.yml)
                ---DOCKERFILE---
                (complete Dockerfile)
                ---END---
                """;
    }

    // ------------------------------------------------------------------
    // User messages
    // ------------------------------------------------------------------

    public static String generateContext(RepositoryProfile profile, String additionalContext) {
        return profileBlock(profile) + extra(additionalContext);
    }

    public static String adaptContext(RepositoryProfile profile, PipelineArtifact reference,
                                      String additionalContext) {
        StringBuilder sb = new StringBuilder(profileBlock(profile));
        sb.append("\nREFERENCE .gitlab-ci.yml:\n");
        sb.append(reference.hasPipeline()
                ? "```yaml\n" + reference.pipelineDefinition().strip() + "\n```\n"
                : "(missing: write one)\n");
        sb.append("\nREFERENCE Dockerfile:\n");
        sb.append(reference.hasImageBuild()
                ? "```dockerfile\n" + reference.imageBuildDefinition().strip() + "\n```\n"
                : "(missing: write one)\n");
        return sb.append(extra(additionalContext)).toString();
    }

    private static String profileBlock(RepositoryProfile profile) {
        return """
                REPOSITORY:
                  language:        %s
                  framework:       %s
                  package manager: %s
                """.formatted(profile.language(), profile.framework(),
                profile.packageManager().isEmpty() ? "unknown" : profile.packageManager());
    }

    private static String extra(String additionalContext) {
        if (additionalContext == null || additionalContext.isBlank()) return "";
        return "\nADDITIONAL REQUIREMENTS FROM THE USER:\n" + additionalContext.strip() + "\n";
    }
}
