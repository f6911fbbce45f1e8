package com.cipilot.orchestrator.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineValidatorTest {

    private final PipelineValidator validator = new PipelineValidator();

    @Test
    void validatePipeline_builtInDefault_isValid() {
        ValidationResult result = validator.validatePipeline(
                DefaultTemplates.forLanguage("kotlin").pipelineDefinition());

        assertThat(result.isValid()).as(result.toString()).isTrue();
    }

    @Test
    void validatePipeline_jobInUndeclaredStage_reportsTheJob() {
        ValidationResult result = validator.validatePipeline("""
                stages:
                  - build
                deploy_prod:
                  stage: deploy
                  script:
                    - ./deploy.sh
                """);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).singleElement().asString()
                .contains("deploy_prod").contains("'deploy'");
    }

    @Test
    void validatePipeline_implicitStagesHiddenJobsAndExtends_areAccepted() {
        ValidationResult result = validator.validatePipeline("""
                stages:
                  - build
                .base:
                  image: alpine:3.20
                setup:
                  stage: .pre
                  script:
                    - echo setup
                build:
                  stage: build
                  extends: .base
                """);

        assertThat(result.isValid()).as(result.toString()).isTrue();
    }

    @Test
    void validatePipeline_missingStagesAndScript_collectsBothErrors() {
        ValidationResult result = validator.validatePipeline("""
                build:
                  image: alpine:3.20
                """);

        assertThat(result.getErrors()).hasSize(2);
        assertThat(result.toString()).contains("stages").contains("no script");
    }

    @Test
    void validatePipeline_notYaml_isInvalid() {
        assertThat(validator.validatePipeline("stages: [build").isValid()).isFalse();
        assertThat(validator.validatePipeline("   ").isValid()).isFalse();
    }

    @Test
    void validateImageBuild_requiresFromInstruction() {
        assertThat(validator.validateImageBuild("# base\nfrom eclipse-temurin:21-jre\n").isValid()).isTrue();
        assertThat(validator.validateImageBuild("RUN echo hi\n").isValid()).isFalse();
        assertThat(validator.validateImageBuild(null).isValid()).isFalse();
    }
}
