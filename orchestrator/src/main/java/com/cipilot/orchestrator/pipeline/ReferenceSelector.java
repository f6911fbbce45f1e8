package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.LearnedConfig;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.store.ArtifactDocument;
import com.cipilot.orchestrator.store.PipelineTemplate;
import com.cipilot.orchestrator.store.TemplateStoreClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Four-tier reference lookup for a (language, framework) pair:
 *
 *   1. LEARNED           best learned config (most stages passed, then shortest run)
 *   2. EXACT_TEMPLATE    template for language + framework with both files
 *   3. PARTIAL_TEMPLATE  incomplete template for language + framework, or any
 *                        template for the language alone
 *   4. DEFAULT           built-in per-language default, polyglot when unknown
 *
 * Store failures are misses: the tier is logged and skipped. Learned configs and
 * exact templates whose pipeline does not pass validation are misses too, so a
 * corrupt entry never shadows the candidates below it. Only when the default
 * tier itself fails does an exception reach the caller.
 */
@Component
public class ReferenceSelector {

    private static final Logger log = LoggerFactory.getLogger(ReferenceSelector.class);

    private static final int TEMPLATE_CANDIDATES = 5;

    /**
     * Best first: more stages passed, then shorter duration. The id is the final
     * tie-breaker so the choice never depends on store ordering.
     */
    static final Comparator<LearnedConfig> BEST_LEARNED = Comparator
            .comparingInt(LearnedConfig::stagesPassedCount).reversed()
            .thenComparingLong(LearnedConfig::durationSeconds)
            .thenComparing(LearnedConfig::id);

    private final TemplateStoreClient store;
    private final PipelineValidator   validator;
    private final MeterRegistry       meterRegistry;
    private final int                 learnedCandidates;

    public ReferenceSelector(TemplateStoreClient store,
                             PipelineValidator validator,
                             MeterRegistry meterRegistry,
                             @Value("${cipilot.store.learned-candidates:10}") int learnedCandidates) {
        this.store             = store;
        this.validator         = validator;
        this.meterRegistry     = meterRegistry;
        this.learnedCandidates = learnedCandidates;
    }

    public Reference select(String language, String framework) {
        Reference ref = learned(language, framework)
                .or(() -> exactTemplate(language, framework))
                .or(() -> partialTemplate(language, framework))
                .orElseGet(() -> builtInDefault(language));

        meterRegistry.counter("cipilot.reference.selections", "tier", ref.tier().name().toLowerCase())
                .increment();
        log.info("Reference for {}/{}: {} ({})", language, framework, ref.tier(), ref.artifact().templateId());
        return ref;
    }

    // ------------------------------------------------------------------
    // Tiers
    // ------------------------------------------------------------------

    private Optional<Reference> learned(String language, String framework) {
        try {
            List<LearnedConfig> candidates = store.findLearnedConfigs(language, framework, learnedCandidates);
            return candidates.stream()
                    .filter(c -> usable(c.id(), ArtifactDocument.pipelineDefinition(c.content()).orElse(null)))
                    .min(BEST_LEARNED)
                    .map(best -> new Reference(ReferenceTier.LEARNED, new PipelineArtifact(
                            ArtifactDocument.pipelineDefinition(best.content()).orElseThrow(),
                            ArtifactDocument.imageBuildDefinition(best.content()).orElse(null),
                            ArtifactSource.LEARNED,
                            best.id())));
        } catch (RuntimeException e) {
            log.warn("Learned-config lookup failed for {}/{}, trying templates: {}",
                    language, framework, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Reference> exactTemplate(String language, String framework) {
        try {
            return store.findTemplates(language, framework, TEMPLATE_CANDIDATES).stream()
                    .filter(PipelineTemplate::isComplete)
                    .filter(t -> usable(t.id(), t.pipelineDefinition()))
                    .findFirst()
                    .map(t -> new Reference(ReferenceTier.EXACT_TEMPLATE,
                            toArtifact(t, ArtifactSource.EXACT_TEMPLATE)));
        } catch (RuntimeException e) {
            log.warn("Exact template lookup failed for {}/{}: {}", language, framework, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Reference> partialTemplate(String language, String framework) {
        try {
            Optional<PipelineTemplate> sameFramework = store.findTemplates(language, framework, TEMPLATE_CANDIDATES)
                    .stream()
                    .filter(t -> !t.isEmpty())
                    .findFirst();
            Optional<PipelineTemplate> match = sameFramework.isPresent()
                    ? sameFramework
                    : store.findTemplatesForLanguage(language, TEMPLATE_CANDIDATES).stream()
                            .filter(t -> !t.isEmpty())
                            .findFirst();
            return match.map(t -> new Reference(ReferenceTier.PARTIAL_TEMPLATE,
                    toArtifact(t, ArtifactSource.PARTIAL_TEMPLATE)));
        } catch (RuntimeException e) {
            log.warn("Partial template lookup failed for {}/{}: {}", language, framework, e.getMessage());
            return Optional.empty();
        }
    }

    private Reference builtInDefault(String language) {
        if (!DefaultTemplates.isKnown(language)) {
            log.info("No built-in default for language '{}', using the polyglot default", language);
        }
        return new Reference(ReferenceTier.DEFAULT, DefaultTemplates.forLanguage(language));
    }

    private boolean usable(String id, String pipelineDefinition) {
        if (pipelineDefinition == null) return false;
        ValidationResult result = validator.validatePipeline(pipelineDefinition);
        if (!result.isValid()) {
            log.warn("Skipping stored reference {}: {}", id, result);
        }
        return result.isValid();
    }

    private static PipelineArtifact toArtifact(PipelineTemplate t, ArtifactSource source) {
        return new PipelineArtifact(t.pipelineDefinition(), t.imageBuildDefinition(), source, t.id());
    }
}
