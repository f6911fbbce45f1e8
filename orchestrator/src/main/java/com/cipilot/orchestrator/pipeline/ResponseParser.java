package com.cipilot.orchestrator.pipeline;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls artifact files out of a model response.
 *
 * The prompts ask for marker sections:
 *
 *   ---EXPLANATION---
 *   ...
 *   ---GITLAB_CI---
 *   ...
 *   ---DOCKERFILE---
 *   ...
 *   ---END---
 *
 * Models do not always comply, so a fenced ```yaml / ```dockerfile block is
 * accepted when the marker is missing. Code fences inside a section are stripped.
 */
public class ResponseParser {

    /** Files found in one response; absent ones are null. */
    public record ParsedArtifacts(String explanation, String pipelineDefinition, String imageBuildDefinition) {

        public boolean isEmpty() {
            return pipelineDefinition == null && imageBuildDefinition == null;
        }
    }

    // Text after a marker up to the next marker (or end of text)
    private static final String SECTION = "---%s---[ \\t]*\\n?(.*?)(?=\\n?---[A-Z_]+---|\\z)";

    private static final Pattern EXPLANATION = Pattern.compile(SECTION.formatted("EXPLANATION"), Pattern.DOTALL);
    private static final Pattern GITLAB_CI   = Pattern.compile(SECTION.formatted("GITLAB_CI"),   Pattern.DOTALL);
    private static final Pattern DOCKERFILE  = Pattern.compile(SECTION.formatted("DOCKERFILE"),  Pattern.DOTALL);

    private static final Pattern YAML_FENCE = Pattern.compile(
            "```(?:yaml|yml)[^\\n]*\\n(.*?)\\n```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern DOCKER_FENCE = Pattern.compile(
            "```(?:dockerfile|docker)[^\\n]*\\n(.*?)\\n```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern OPEN_FENCE  = Pattern.compile("^```[\\w-]*[ \\t]*\\n?");
    private static final Pattern CLOSE_FENCE = Pattern.compile("\\n?```[ \\t]*$");

    private ResponseParser() {}

    public static ParsedArtifacts parse(String response) {
        if (response == null || response.isBlank()) {
            return new ParsedArtifacts("", null, null);
        }
        String explanation = section(EXPLANATION, response).orElse("");
        String pipeline = section(GITLAB_CI, response)
                .or(() -> fenced(YAML_FENCE, response))
                .orElse(null);
        String image = section(DOCKERFILE, response)
                .or(() -> fenced(DOCKER_FENCE, response))
                .orElse(null);
        return new ParsedArtifacts(explanation, pipeline, image);
    }

    private static Optional<String> section(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String body = stripFences(m.group(1).strip());
        return body.isEmpty() ? Optional.empty() : Optional.of(body + "\n");
    }

    private static Optional<String> fenced(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Optional.of(m.group(1).strip() + "\n") : Optional.empty();
    }

    static String stripFences(String text) {
        String out = OPEN_FENCE.matcher(text).replaceFirst("");
        out = CLOSE_FENCE.matcher(out).replaceFirst("");
        return out.strip();
    }
}
