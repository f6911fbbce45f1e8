package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.PipelineArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guarantees the structural properties every committed pipeline must have,
 * whatever produced it:
 *
 *   1. a "learn" stage, placed right after "notify" (or last when there is no notify)
 *   2. a learn_record job in that stage which reports back to the orchestrator
 *   3. the CIPILOT_CALLBACK_URL variable the job posts to
 *
 * A compliant pipeline is returned untouched, which makes the transform idempotent.
 * Otherwise the missing pieces are spliced into the text so that comments, anchors
 * and formatting survive; only if that fails to produce a compliant document is the
 * YAML rewritten from its parsed form.
 */
@Component
public class ArtifactNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ArtifactNormalizer.class);

    public static final String NOTIFY_STAGE      = "notify";
    public static final String LEARN_STAGE       = "learn";
    public static final String LEARN_JOB         = "learn_record";
    public static final String CALLBACK_VARIABLE = "CIPILOT_CALLBACK_URL";

    private static final List<String> FALLBACK_STAGES = List.of("build", "test", "deploy");

    private static final Pattern STAGES_BLOCK = Pattern.compile("(?m)^stages:[ \\t]*(?:#.*)?$");
    private static final Pattern STAGES_FLOW  = Pattern.compile("(?m)^stages:[ \\t]*\\[(.*)\\][ \\t]*$");
    private static final Pattern LIST_ITEM    = Pattern.compile("^([ \\t]*)-[ \\t]*['\"]?([^'\"#\\s]+)['\"]?.*$");
    private static final Pattern VARS_BLOCK   = Pattern.compile("(?m)^variables:[ \\t]*(?:#.*)?$");

    private static final String LEARN_JOB_TEMPLATE = """
            learn_record:
              stage: learn
              image: curlimages/curl:8.8.0
              when: on_success
              allow_failure: true
              script:
                - >
                  curl -sf -X POST "${CIPILOT_CALLBACK_URL}/learn/record"
                  -H "Content-Type: application/json"
                  -d "{\\"projectUrl\\":\\"${CI_PROJECT_URL}\\",\\"branch\\":\\"${CI_COMMIT_REF_NAME}\\",\\"pipelineId\\":\\"${CI_PIPELINE_ID}\\"}"
            """;

    private final String callbackUrl;

    public ArtifactNormalizer(@Value("${cipilot.callback-url}") String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    /**
     * @throws InvalidArtifactException if the pipeline definition cannot be parsed
     */
    public PipelineArtifact normalize(PipelineArtifact artifact) {
        String original = artifact.pipelineDefinition();
        Map<String, Object> doc = PipelineYaml.load(original);
        if (isCompliant(doc)) {
            return artifact;
        }

        String edited = spliceMissingParts(original, doc);
        if (isCompliantText(edited)) {
            log.debug("Normalized pipeline by text insertion");
            return artifact.withPipelineDefinition(edited);
        }

        log.warn("Text insertion did not yield a compliant pipeline, rewriting structurally");
        String rewritten = rewrite(doc);
        if (!isCompliantText(rewritten)) {
            throw new InvalidArtifactException("Pipeline could not be normalized");
        }
        return artifact.withPipelineDefinition(rewritten);
    }

    public static boolean isCompliant(Map<String, Object> doc) {
        if (!PipelineYaml.stages(doc).contains(LEARN_STAGE)) return false;
        Map<String, Object> job = PipelineYaml.jobs(doc).get(LEARN_JOB);
        if (job == null || !LEARN_STAGE.equals(PipelineYaml.stageOf(job))) return false;
        return PipelineYaml.variables(doc).containsKey(CALLBACK_VARIABLE);
    }

    private static boolean isCompliantText(String text) {
        try {
            return isCompliant(PipelineYaml.load(text));
        } catch (InvalidArtifactException e) {
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Text insertion
    // ------------------------------------------------------------------

    private String spliceMissingParts(String text, Map<String, Object> doc) {
        String out = text.endsWith("\n") ? text : text + "\n";

        if (!PipelineYaml.stages(doc).contains(LEARN_STAGE)) {
            out = insertLearnStage(out, doc);
        }
        if (!PipelineYaml.variables(doc).containsKey(CALLBACK_VARIABLE)) {
            out = insertCallbackVariable(out, doc);
        }
        if (!PipelineYaml.jobs(doc).containsKey(LEARN_JOB)) {
            out = out + "\n" + LEARN_JOB_TEMPLATE;
        }
        return out;
    }

    private String insertLearnStage(String text, Map<String, Object> doc) {
        Matcher flow = STAGES_FLOW.matcher(text);
        if (flow.find()) {
            List<String> stages = new ArrayList<>(Arrays.stream(flow.group(1).split(","))
                    .map(s -> s.strip().replaceAll("^['\"]|['\"]$", ""))
                    .filter(s -> !s.isEmpty())
                    .toList());
            insertAfterNotify(stages);
            return text.substring(0, flow.start())
                    + "stages: [" + String.join(", ", stages) + "]"
                    + text.substring(flow.end());
        }

        Matcher block = STAGES_BLOCK.matcher(text);
        if (!block.find()) {
            return stagesHeader(doc) + text;
        }

        List<String> lines = new ArrayList<>(text.lines().toList());
        int header = lineIndexAt(text, block.start());
        int lastItem = -1;
        int notifyItem = -1;
        String indent = "  ";
        for (int i = header + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || line.stripLeading().startsWith("#")) continue;
            Matcher item = LIST_ITEM.matcher(line);
            if (!item.matches()) break;
            indent = item.group(1);
            lastItem = i;
            if (NOTIFY_STAGE.equals(item.group(2))) notifyItem = i;
        }
        if (lastItem < 0) {
            return stagesHeader(doc) + text.replaceFirst("(?m)^stages:[ \\t]*(?:#.*)?\\n", "");
        }
        int insertAt = (notifyItem >= 0 ? notifyItem : lastItem) + 1;
        lines.add(insertAt, indent + "- " + LEARN_STAGE);
        return String.join("\n", lines) + "\n";
    }

    /** Stage list for a document that declares none: GitLab's defaults plus any custom job stages. */
    private static String stagesHeader(Map<String, Object> doc) {
        List<String> stages = new ArrayList<>(FALLBACK_STAGES);
        PipelineYaml.jobs(doc).values().forEach(job -> {
            String stage = PipelineYaml.stageOf(job);
            if (!stages.contains(stage) && !stage.startsWith(".")) stages.add(stage);
        });
        insertAfterNotify(stages);
        StringBuilder sb = new StringBuilder("stages:\n");
        stages.forEach(s -> sb.append("  - ").append(s).append('\n'));
        return sb.append('\n').toString();
    }

    private String insertCallbackVariable(String text, Map<String, Object> doc) {
        String entry = CALLBACK_VARIABLE + ": \"" + callbackUrl + "\"";
        Matcher block = VARS_BLOCK.matcher(text);
        if (block.find() && doc.get("variables") instanceof Map) {
            List<String> lines = new ArrayList<>(text.lines().toList());
            int header = lineIndexAt(text, block.start());
            String indent = "  ";
            for (int i = header + 1; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isBlank()) continue;
                int n = line.length() - line.stripLeading().length();
                if (n > 0) indent = line.substring(0, n);
                break;
            }
            lines.add(header + 1, indent + entry);
            return String.join("\n", lines) + "\n";
        }
        if (doc.containsKey("variables")) {
            // present but not a block mapping; leave it to the structural rewrite
            return text;
        }
        return "variables:\n  " + entry + "\n\n" + text;
    }

    private static void insertAfterNotify(List<String> stages) {
        int notify = stages.indexOf(NOTIFY_STAGE);
        if (notify >= 0) {
            stages.add(notify + 1, LEARN_STAGE);
        } else {
            stages.add(LEARN_STAGE);
        }
    }

    private static int lineIndexAt(String text, int offset) {
        int line = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    // ------------------------------------------------------------------
    // Structural rewrite
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private String rewrite(Map<String, Object> parsed) {
        Map<String, Object> doc = new LinkedHashMap<>(parsed);

        List<String> stages = PipelineYaml.stages(doc);
        if (stages.isEmpty()) {
            stages = new ArrayList<>(FALLBACK_STAGES);
        }
        if (!stages.contains(LEARN_STAGE)) {
            insertAfterNotify(stages);
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        if (doc.get("variables") instanceof Map) {
            variables.putAll((Map<String, Object>) doc.get("variables"));
        }
        variables.putIfAbsent(CALLBACK_VARIABLE, callbackUrl);

        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("stages", stages);
        ordered.put("variables", variables);
        doc.remove("stages");
        doc.remove("variables");
        doc.remove(LEARN_JOB);
        ordered.putAll(doc);
        ordered.put(LEARN_JOB, PipelineYaml.load(LEARN_JOB_TEMPLATE).get(LEARN_JOB));
        return PipelineYaml.dump(ordered);
    }
}
