package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.JobStatus;
import com.cipilot.orchestrator.pipeline.InvalidArtifactException;
import com.cipilot.orchestrator.pipeline.PipelineYaml;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a finished execution is good enough to learn from.
 *
 * Every job must have status "success". allow_failure does not change that: a
 * tolerated failure still fails the gate. The single exemption is a job the
 * pipeline declares with {@code when: on_failure} that was skipped, because in a
 * passing pipeline such a job never runs.
 */
@Component
public class QualityGate {

    public record Verdict(boolean passed, List<String> violations) {}

    public Verdict evaluate(List<JobStatus> jobs, String pipelineDefinition) {
        if (jobs == null || jobs.isEmpty()) {
            return new Verdict(false, List.of("no jobs reported"));
        }
        Set<String> onFailureJobs = onFailureJobs(pipelineDefinition);

        List<String> violations = new ArrayList<>();
        for (JobStatus job : jobs) {
            if (job.succeeded()) continue;
            if (job.skipped() && onFailureJobs.contains(job.name())) continue;
            violations.add(job.name() + " is " + job.status()
                    + (job.allowFailure() ? " (allow_failure)" : ""));
        }
        return new Verdict(violations.isEmpty(), List.copyOf(violations));
    }

    private static Set<String> onFailureJobs(String pipelineDefinition) {
        try {
            return PipelineYaml.jobsWithWhen(pipelineDefinition, "on_failure");
        } catch (InvalidArtifactException e) {
            return Set.of();
        }
    }
}
