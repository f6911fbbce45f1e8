package com.cipilot.orchestrator.pipeline;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-side view of a .gitlab-ci.yml document.
 *
 * GitLab's custom tags (!reference) are loaded as plain lists so that valid CI
 * files never fail to parse. Yaml instances are not thread-safe, so every call
 * builds its own.
 */
public final class PipelineYaml {

    /** Top-level keys that configure the pipeline rather than declare a job. */
    static final Set<String> GLOBAL_KEYWORDS = Set.of(
            "stages", "variables", "default", "include", "workflow", "image", "services",
            "before_script", "after_script", "cache", "types");

    private PipelineYaml() {}

    /**
     * @throws InvalidArtifactException if the text is not YAML or not a mapping at the top
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> load(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidArtifactException("Pipeline definition is empty");
        }
        Object root;
        try {
            root = new Yaml(new CiConstructor()).load(text);
        } catch (YAMLException e) {
            throw new InvalidArtifactException("Pipeline definition is not valid YAML: " + e.getMessage(), e);
        }
        if (!(root instanceof Map)) {
            throw new InvalidArtifactException("Pipeline definition must be a YAML mapping");
        }
        return (Map<String, Object>) root;
    }

    /** Declared stages in order; empty when the document has no stages list. */
    public static List<String> stages(Map<String, Object> doc) {
        Object raw = doc.get("stages");
        List<String> stages = new ArrayList<>();
        if (raw instanceof List<?>) {
            for (Object s : (List<?>) raw) {
                if (s != null) stages.add(String.valueOf(s));
            }
        }
        return stages;
    }

    /** Visible jobs (hidden ".template" jobs and global keywords excluded), in file order. */
    @SuppressWarnings("unchecked")
    public static Map<String, Map<String, Object>> jobs(Map<String, Object> doc) {
        Map<String, Map<String, Object>> jobs = new LinkedHashMap<>();
        ((Map<?, ?>) doc).forEach((k, value) -> {
            String key = String.valueOf(k);
            if (k == null || key.startsWith(".") || GLOBAL_KEYWORDS.contains(key)) return;
            if (value instanceof Map) {
                jobs.put(key, (Map<String, Object>) value);
            }
        });
        return jobs;
    }

    /** Stage a job runs in; GitLab puts jobs without one in "test". */
    public static String stageOf(Map<String, Object> job) {
        Object stage = job.get("stage");
        return stage == null ? "test" : String.valueOf(stage);
    }

    public static Map<?, ?> variables(Map<String, Object> doc) {
        Object vars = doc.get("variables");
        return vars instanceof Map ? (Map<?, ?>) vars : Map.of();
    }

    /** Names of jobs declared with the given {@code when:} value, e.g. "on_failure". */
    public static Set<String> jobsWithWhen(String text, String when) {
        Set<String> names = new HashSet<>();
        jobs(load(text)).forEach((name, job) -> {
            if (when.equals(String.valueOf(job.get("when")))) names.add(name);
        });
        return names;
    }

    public static String dump(Map<String, Object> doc) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setIndicatorIndent(0);
        options.setWidth(200);
        return new Yaml(options).dump(doc);
    }

    // ------------------------------------------------------------------
    // Loader
    // ------------------------------------------------------------------

    /** SafeConstructor that turns unknown local tags into their untagged value. */
    static final class CiConstructor extends SafeConstructor {

        CiConstructor() {
            super(new LoaderOptions());
            this.yamlConstructors.put(null, new AbstractConstruct() {
                @Override
                public Object construct(Node node) {
                    if (node instanceof SequenceNode) {
                        return constructSequence((SequenceNode) node);
                    }
                    if (node instanceof MappingNode) {
                        return constructMapping((MappingNode) node);
                    }
                    return constructScalar((ScalarNode) node);
                }
            });
        }
    }
}
