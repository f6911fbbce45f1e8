package com.cipilot.orchestrator.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactDocumentTest {

    @Test
    void render_pipelineOnly_omitsDockerfileSection() {
        String doc = ArtifactDocument.render("Learned Pipeline", "go", "generic", "stages:\n  - build\n", null);

        assertThat(doc).startsWith("## Learned Pipeline\nLanguage: go\nFramework: generic\n");
        assertThat(doc).contains("### .gitlab-ci.yml\n```yaml\nstages:\n  - build\n```");
        assertThat(doc).doesNotContain("### Dockerfile");
        assertThat(ArtifactDocument.imageBuildDefinition(doc)).isEmpty();
    }

    @Test
    void sections_handSeededDocument() {
        String doc = """
                ## Pipeline Configuration
                Language: python
                Framework: django

                ### .gitlab-ci.yml
                ```yml
                stages: [test]
                ```

                ### dockerfile
                ```docker
                FROM python:3.12-slim
                ```
                """;

        assertThat(ArtifactDocument.pipelineDefinition(doc)).contains("stages: [test]");
        assertThat(ArtifactDocument.imageBuildDefinition(doc)).contains("FROM python:3.12-slim");
    }

    @Test
    void sections_emptyFence_isMissing() {
        String doc = "### .gitlab-ci.yml\n```yaml\n\n```\n";

        assertThat(ArtifactDocument.pipelineDefinition(doc)).isEmpty();
        assertThat(ArtifactDocument.pipelineDefinition(null)).isEmpty();
    }
}
