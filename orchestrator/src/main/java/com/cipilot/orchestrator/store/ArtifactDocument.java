package com.cipilot.orchestrator.store;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text layout used to keep both pipeline files in a single store document:
 *
 * <pre>
 * ## Pipeline Configuration
 * Language: java
 * Framework: spring-boot
 *
 * ### .gitlab-ci.yml
 * ```yaml
 * ...
 * ```
 *
 * ### Dockerfile
 * ```dockerfile
 * ...
 * ```
 * </pre>
 *
 * Either section may be missing in manually seeded templates.
 */
public final class ArtifactDocument {

    public static final String PIPELINE_FILE    = ".gitlab-ci.yml";
    public static final String IMAGE_BUILD_FILE = "Dockerfile";

    private static final Pattern PIPELINE_SECTION = Pattern.compile(
            "###\\s*\\.gitlab-ci\\.yml\\s*\\n```ya?ml\\s*\\n(.*?)\\n```",
            Pattern.DOTALL);

    private static final Pattern IMAGE_BUILD_SECTION = Pattern.compile(
            "###\\s*Dockerfile\\s*\\n```(?:dockerfile|docker)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private ArtifactDocument() {}

    public static String render(String title, String language, String framework,
                                String pipelineDefinition, String imageBuildDefinition) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(title).append('\n');
        sb.append("Language: ").append(language).append('\n');
        sb.append("Framework: ").append(framework).append('\n');
        if (pipelineDefinition != null && !pipelineDefinition.isBlank()) {
            sb.append("\n### ").append(PIPELINE_FILE).append("\n```yaml\n")
              .append(pipelineDefinition.strip()).append("\n```\n");
        }
        if (imageBuildDefinition != null && !imageBuildDefinition.isBlank()) {
            sb.append("\n### ").append(IMAGE_BUILD_FILE).append("\n```dockerfile\n")
              .append(imageBuildDefinition.strip()).append("\n```\n");
        }
        return sb.toString();
    }

    public static Optional<String> pipelineDefinition(String document) {
        return section(PIPELINE_SECTION, document);
    }

    public static Optional<String> imageBuildDefinition(String document) {
        return section(IMAGE_BUILD_SECTION, document);
    }

    private static Optional<String> section(Pattern pattern, String document) {
        if (document == null) return Optional.empty();
        Matcher m = pattern.matcher(document);
        if (!m.find()) return Optional.empty();
        String body = m.group(1).strip();
        return body.isEmpty() ? Optional.empty() : Optional.of(body);
    }
}
