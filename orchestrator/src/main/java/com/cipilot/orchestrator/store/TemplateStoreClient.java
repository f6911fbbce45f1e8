package com.cipilot.orchestrator.store;

import com.cipilot.orchestrator.model.LearnedConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the two collections the orchestrator uses: learned configs
 * and pipeline templates. Maps store metadata to records and back; no
 * selection logic lives here.
 */
@Component
public class TemplateStoreClient {

    private final TemplateStore store;
    private final String        learnedCollection;
    private final String        templateCollection;

    public TemplateStoreClient(TemplateStore store,
                               @Value("${cipilot.store.learned-collection:learned_pipelines}") String learnedCollection,
                               @Value("${cipilot.store.template-collection:pipeline_templates}") String templateCollection) {
        this.store              = store;
        this.learnedCollection  = learnedCollection;
        this.templateCollection = templateCollection;
    }

    // ------------------------------------------------------------------
    // Learned configs
    // ------------------------------------------------------------------

    public List<LearnedConfig> findLearnedConfigs(String language, String framework, int limit) {
        return store.query(learnedCollection, filter(language, framework), limit).stream()
                .map(TemplateStoreClient::toLearnedConfig)
                .toList();
    }

    public void upsertLearnedConfig(LearnedConfig config) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("language",     config.language());
        meta.put("framework",    config.framework());
        meta.put("pipeline_id",  config.pipelineId());
        meta.put("duration",     config.durationSeconds());
        meta.put("stages_count", config.stagesPassedCount());
        meta.put("source",       "learned");
        meta.put("timestamp",    config.timestamp().toString());
        store.upsert(learnedCollection, config.id(), config.content(), meta);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    public List<PipelineTemplate> findTemplates(String language, String framework, int limit) {
        return store.query(templateCollection, filter(language, framework), limit).stream()
                .map(TemplateStoreClient::toTemplate)
                .toList();
    }

    public List<PipelineTemplate> findTemplatesForLanguage(String language, int limit) {
        return store.query(templateCollection, Map.of("language", language.toLowerCase()), limit).stream()
                .map(TemplateStoreClient::toTemplate)
                .toList();
    }

    public void upsertTemplate(PipelineTemplate template, String description) {
        String content = ArtifactDocument.render(
                description == null || description.isBlank() ? "Pipeline Template" : description,
                template.language(), template.framework(),
                template.pipelineDefinition(), template.imageBuildDefinition());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("language",  template.language().toLowerCase());
        meta.put("framework", template.framework().toLowerCase());
        meta.put("source",    "manual_upload");
        meta.put("timestamp", Instant.now().toString());
        store.upsert(templateCollection, template.id(), content, meta);
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    private static Map<String, Object> filter(String language, String framework) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("language",  language.toLowerCase());
        f.put("framework", framework.toLowerCase());
        return f;
    }

    static LearnedConfig toLearnedConfig(StoreDocument doc) {
        return new LearnedConfig(
                doc.id(),
                doc.stringValue("language", "unknown"),
                doc.stringValue("framework", "generic"),
                doc.stringValue("pipeline_id", ""),
                // Unknown duration sorts last among equal stage counts.
                doc.longValue("duration", Long.MAX_VALUE),
                (int) doc.longValue("stages_count", 0),
                parseInstant(doc.stringValue("timestamp", null)),
                doc.content());
    }

    static PipelineTemplate toTemplate(StoreDocument doc) {
        return new PipelineTemplate(
                doc.id(),
                doc.stringValue("language", "unknown"),
                doc.stringValue("framework", "generic"),
                ArtifactDocument.pipelineDefinition(doc.content()).orElse(null),
                ArtifactDocument.imageBuildDefinition(doc.content()).orElse(null));
    }

    private static Instant parseInstant(String value) {
        if (value == null) return Instant.EPOCH;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
