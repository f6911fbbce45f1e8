package com.cipilot.orchestrator.pipeline;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Basic syntactic checks for generated or adapted artifacts: the pipeline must
 * parse, declare a non-empty stage list and put every job in a declared stage;
 * the image-build file must start from a base image.
 */
@Component
public class PipelineValidator {

    private static final Set<String> IMPLICIT_STAGES = Set.of(".pre", ".post");

    public ValidationResult validatePipeline(String pipelineDefinition) {
        Map<String, Object> doc;
        try {
            doc = PipelineYaml.load(pipelineDefinition);
        } catch (InvalidArtifactException e) {
            return ValidationResult.failed(e.getMessage());
        }

        ValidationResult result = ValidationResult.ok();
        List<String> stages = PipelineYaml.stages(doc);
        if (stages.isEmpty()) {
            result.addError("stages list is missing or empty");
        }

        Map<String, Map<String, Object>> jobs = PipelineYaml.jobs(doc);
        if (jobs.isEmpty()) {
            result.addError("no jobs defined");
        }
        jobs.forEach((name, job) -> {
            String stage = PipelineYaml.stageOf(job);
            if (!stages.isEmpty() && !stages.contains(stage) && !IMPLICIT_STAGES.contains(stage)) {
                result.addError("job '" + name + "' uses undeclared stage '" + stage + "'");
            }
            if (!job.containsKey("script") && !job.containsKey("trigger") && !job.containsKey("extends")) {
                result.addError("job '" + name + "' has no script");
            }
        });
        return result;
    }

    public ValidationResult validateImageBuild(String imageBuildDefinition) {
        if (imageBuildDefinition == null || imageBuildDefinition.isBlank()) {
            return ValidationResult.failed("image-build definition is empty");
        }
        boolean hasFrom = imageBuildDefinition.lines()
                .map(String::strip)
                .anyMatch(l -> l.regionMatches(true, 0, "FROM ", 0, 5));
        return hasFrom ? ValidationResult.ok() : ValidationResult.failed("image-build definition has no FROM instruction");
    }
}
