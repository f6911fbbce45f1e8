package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.PipelineArtifact;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ArtifactNormalizer. Pure text in, text out: no mocks.
 */
class ArtifactNormalizerTest {

    private static final String CALLBACK = "http://cipilot.test:8080";

    private final ArtifactNormalizer normalizer = new ArtifactNormalizer(CALLBACK);

    // ------------------------------------------------------------------
    // Stage insertion
    // ------------------------------------------------------------------

    @Test
    void normalize_blockStagesWithNotify_insertsLearnRightAfterNotify() {
        String pipeline = """
                stages:
                  - build
                  - notify
                  - cleanup

                build:
                  stage: build
                  script:
                    - make

                notify_success:
                  stage: notify
                  script:
                    - echo ok

                cleanup:
                  stage: cleanup
                  script:
                    - echo done
                """;

        Map<String, Object> doc = PipelineYaml.load(normalize(pipeline));

        assertThat(PipelineYaml.stages(doc)).containsExactly("build", "notify", "learn", "cleanup");
        assertThat(ArtifactNormalizer.isCompliant(doc)).isTrue();
    }

    @Test
    void normalize_flowStages_appendsLearnWhenThereIsNoNotify() {
        String pipeline = """
                stages: [build, test]
                build:
                  stage: build
                  script: [make]
                unit:
                  stage: test
                  script: [make test]
                """;

        String out = normalize(pipeline);

        assertThat(out).contains("stages: [build, test, learn]");
        assertThat(ArtifactNormalizer.isCompliant(PipelineYaml.load(out))).isTrue();
    }

    @Test
    void normalize_noStagesDeclared_addsStageHeaderCoveringExistingJobs() {
        String pipeline = """
                lint:
                  stage: lint
                  script:
                    - ./lint.sh
                unit:
                  script:
                    - ./test.sh
                """;

        Map<String, Object> doc = PipelineYaml.load(normalize(pipeline));

        assertThat(PipelineYaml.stages(doc)).containsExactly("build", "test", "deploy", "lint", "learn");
        assertThat(ArtifactNormalizer.isCompliant(doc)).isTrue();
    }

    // ------------------------------------------------------------------
    // Variables and learning job
    // ------------------------------------------------------------------

    @Test
    void normalize_existingVariablesBlock_addsCallbackWithTheSameIndent() {
        String pipeline = """
                stages:
                  - build
                variables:
                    MAVEN_OPTS: "-Xmx1g"
                build:
                  stage: build
                  script:
                    - mvn package
                """;

        String out = normalize(pipeline);
        Map<String, Object> doc = PipelineYaml.load(out);

        assertThat(out).contains("    CIPILOT_CALLBACK_URL: \"" + CALLBACK + "\"");
        Map<Object, Object> variables = new LinkedHashMap<>(PipelineYaml.variables(doc));
        assertThat(variables)
                .containsEntry("MAVEN_OPTS", "-Xmx1g")
                .containsEntry("CIPILOT_CALLBACK_URL", CALLBACK);
    }

    @Test
    void normalize_addsLearnRecordJobThatRunsOnlyOnSuccess() {
        Map<String, Object> doc = PipelineYaml.load(normalize("""
                stages:
                  - build
                build:
                  script:
                    - make
                """));

        Map<String, Object> job = PipelineYaml.jobs(doc).get("learn_record");
        assertThat(job).containsEntry("stage", "learn")
                       .containsEntry("when", "on_success")
                       .containsEntry("allow_failure", true);
        assertThat(job.get("script").toString()).contains("${CIPILOT_CALLBACK_URL}/learn/record");
    }

    @Test
    void normalize_keepsCommentsAndAnchorsOfTheOriginal() {
        String pipeline = """
                # owned by the platform team
                stages:
                  - build

                .defaults: &defaults
                  image: maven:3.9

                build:
                  <<: *defaults
                  stage: build
                  script:
                    - mvn -B package   # skip nothing
                """;

        String out = normalize(pipeline);

        assertThat(out).contains("# owned by the platform team")
                       .contains("&defaults")
                       .contains("# skip nothing");
    }

    @Test
    void normalize_scalarVariables_fallsBackToStructuralRewrite() {
        String pipeline = """
                stages:
                  - build
                variables: none
                build:
                  script:
                    - make
                """;

        Map<String, Object> doc = PipelineYaml.load(normalize(pipeline));

        assertThat(ArtifactNormalizer.isCompliant(doc)).isTrue();
        assertThat(PipelineYaml.jobs(doc)).containsKey("build");
    }

    // ------------------------------------------------------------------
    // Idempotence and failure
    // ------------------------------------------------------------------

    @Test
    void normalize_isIdempotent() {
        PipelineArtifact once = normalizer.normalize(DefaultTemplates.forLanguage("python"));
        PipelineArtifact twice = normalizer.normalize(once);

        assertThat(twice).isSameAs(once);
        assertThat(twice.pipelineDefinition()).isEqualTo(once.pipelineDefinition());
    }

    @Test
    void normalize_everyBuiltInDefault_yieldsAValidCompliantPipeline() {
        PipelineValidator validator = new PipelineValidator();
        for (String language : new String[]{"java", "go", "rust", "typescript", "csharp", "cobol"}) {
            PipelineArtifact out = normalizer.normalize(DefaultTemplates.forLanguage(language));

            assertThat(validator.validatePipeline(out.pipelineDefinition()).isValid())
                    .as(language).isTrue();
            assertThat(PipelineYaml.stages(PipelineYaml.load(out.pipelineDefinition())))
                    .as(language).endsWith("notify", "learn");
        }
    }

    @Test
    void normalize_topLevelListIsRejected() {
        PipelineArtifact artifact = PipelineArtifact.of("- build\n- test\n", null, ArtifactSource.GENERATED);

        assertThatThrownBy(() -> normalizer.normalize(artifact))
                .isInstanceOf(InvalidArtifactException.class);
    }

    private String normalize(String pipeline) {
        return normalizer.normalize(PipelineArtifact.of(pipeline, "FROM alpine:3.20\n", ArtifactSource.GENERATED))
                .pipelineDefinition();
    }
}
