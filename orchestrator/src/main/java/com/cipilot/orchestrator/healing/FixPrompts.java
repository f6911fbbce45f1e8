package com.cipilot.orchestrator.healing;

import com.cipilot.orchestrator.model.JobLog;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;

import java.util.List;

/**
 * Prompt for the repair call: the failing files, the classified error and the
 * tail of the relevant job logs.
 */
final class FixPrompts {

    static final int LOG_TAIL_CHARS = 3000;

    private FixPrompts() {}

    static final String SYSTEM = """
            You are a senior DevOps engineer repairing a failing GitLab CI/CD pipeline.

            YOUR GOAL: find the root cause of the failure shown in the user message and
            return corrected, COMPLETE versions of the files. Not a diff.

            COMMON FIXES BY ERROR CLASS:
              missing_image:    use an existing, pinned public image tag
              network_tls:      fix host names, ports or certificate settings
              permission:       fix file modes, users or registry credentials variables
              timeout:          split slow work, add caching, raise job timeout
              missing_command:  use an image that ships the tool, or install it first
              build_failure:    match build commands to the language and build tool
              artifact_missing: make producing jobs publish the paths consumers expect
              yaml_syntax:      fix indentation (2 spaces) and quoting

            RULES:
              - Fix the ROOT CAUSE job, not notification or downstream jobs.
              - Keep stage names, the learn stage and the learn_record job unchanged.
              - Keep the CIPILOT_CALLBACK_URL variable.
              - Change as little as possible.

            OUTPUT FORMAT (MUST FOLLOW EXACTLY):

            ---EXPLANATION---
            (what was wrong and what you changed, two sentences at most)
            ---GITLAB_CI---
            (complete fixed .gitlab-ci.yml)
            ---DOCKERFILE---
            (complete fixed Dockerfile)
            ---END---
            """;

    static String context(RepositoryProfile profile, Classification classification, JobLog primary,
                          List<JobLog> others, PipelineArtifact current, int attempt, int maxAttempts,
                          boolean pipelineOnly) {
        StringBuilder sb = new StringBuilder();
        sb.append("REPAIR ATTEMPT ").append(attempt).append(" of ").append(maxAttempts).append("\n\n");
        sb.append("FAILED JOB:  ").append(primary == null ? "(unknown)" : primary.jobName());
        if (primary != null && primary.stage() != null) {
            sb.append(" (stage ").append(primary.stage()).append(')');
        }
        sb.append('\n');
        sb.append("ERROR CLASS: ").append(classification.errorClass().label()).append('\n');
        if (!classification.evidence().isEmpty()) {
            sb.append("MATCHED:     ").append(classification.evidence()).append('\n');
        }
        sb.append("LANGUAGE:    ").append(profile.language()).append('\n');
        sb.append("FRAMEWORK:   ").append(profile.framework()).append("\n\n");

        sb.append("JOB LOG (last part):\n```\n")
          .append(primary == null ? "(no log available)" : tail(primary.logText()))
          .append("\n```\n");
        for (JobLog other : others) {
            sb.append("\nALSO FAILED: ").append(other.jobName()).append("\n```\n")
              .append(tail(other.logText())).append("\n```\n");
        }

        sb.append("\nCURRENT .gitlab-ci.yml:\n```yaml\n")
          .append(current.pipelineDefinition().strip()).append("\n```\n");
        if (pipelineOnly) {
            sb.append("\nONLY .gitlab-ci.yml IS COMMITTED. The repository's Dockerfile is not under your\n")
              .append("control and any Dockerfile you return is discarded; fix the failure in .gitlab-ci.yml.\n");
        } else {
            sb.append("\nCURRENT Dockerfile:\n```dockerfile\n")
              .append(current.hasImageBuild() ? current.imageBuildDefinition().strip() : "(none)")
              .append("\n```\n");
        }
        return sb.toString();
    }

    /** Last LOG_TAIL_CHARS characters; the end of a CI log is where the error is. */
    static String tail(String log) {
        if (log == null) return "";
        return log.length() <= LOG_TAIL_CHARS ? log : log.substring(log.length() - LOG_TAIL_CHARS);
    }
}
