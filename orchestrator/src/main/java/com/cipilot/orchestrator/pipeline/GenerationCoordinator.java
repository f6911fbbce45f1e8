package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.claude.ClaudeClient;
import com.cipilot.orchestrator.claude.ModelTimeoutException;
import com.cipilot.orchestrator.claude.ModelUnavailableException;
import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.pipeline.ResponseParser.ParsedArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a repository profile into a committed-ready artifact pair.
 *
 * Decision by reference tier:
 *
 *   LEARNED, EXACT_TEMPLATE  use the reference as-is
 *   PARTIAL_TEMPLATE         ask the model to adapt it, keep whatever valid files come back,
 *                            fill the rest from the reference, then from the default
 *   DEFAULT                  ask the model to generate from scratch (provenance GENERATED)
 *
 * Model errors and invalid model output never fail generation; the built-in
 * default fills in. Every result goes through the normalizer before it is returned.
 */
@Component
public class GenerationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(GenerationCoordinator.class);

    private final ReferenceSelector  selector;
    private final ArtifactNormalizer normalizer;
    private final PipelineValidator  validator;
    private final ClaudeClient       claude;

    public GenerationCoordinator(ReferenceSelector selector,
                                 ArtifactNormalizer normalizer,
                                 PipelineValidator validator,
                                 ClaudeClient claude) {
        this.selector   = selector;
        this.normalizer = normalizer;
        this.validator  = validator;
        this.claude     = claude;
    }

    /**
     * @param additionalContext free text from the user, passed to the model
     * @param templateOnly      never call the model; missing files come from the default
     */
    public Generation generate(RepositoryProfile profile, String additionalContext, boolean templateOnly) {
        Reference ref = selector.select(profile.language(), profile.framework());
        PipelineArtifact fallback = DefaultTemplates.forLanguage(profile.language());

        PipelineArtifact candidate;
        Optional<ParsedArtifacts> modelOutput = Optional.empty();
        switch (ref.tier()) {
            case LEARNED, EXACT_TEMPLATE -> candidate = fillMissing(ref.artifact(), fallback);
            case PARTIAL_TEMPLATE -> {
                if (!templateOnly) {
                    modelOutput = callModel(GenerationPrompts.ADAPT,
                            GenerationPrompts.adaptContext(profile, ref.artifact(), additionalContext));
                }
                candidate = merge(modelOutput, ref.artifact(), fallback);
            }
            case DEFAULT -> {
                if (!templateOnly) {
                    modelOutput = callModel(GenerationPrompts.GENERATE,
                            GenerationPrompts.generateContext(profile, additionalContext));
                }
                candidate = merge(modelOutput, fallback, fallback);
                if (usable(modelOutput)) {
                    candidate = new PipelineArtifact(candidate.pipelineDefinition(),
                            candidate.imageBuildDefinition(), ArtifactSource.GENERATED, null);
                }
            }
            default -> throw new IllegalStateException("Unhandled tier " + ref.tier());
        }

        return new Generation(normalizeOrDefault(candidate, fallback), ref.tier(), usable(modelOutput));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Empty when the model failed or returned nothing we can use. */
    private Optional<ParsedArtifacts> callModel(String systemPrompt, String context) {
        try {
            ParsedArtifacts parsed = ResponseParser.parse(claude.complete(systemPrompt, context));
            if (parsed.isEmpty()) {
                log.warn("Model response contained no artifact files, using fallback");
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (ModelUnavailableException | ModelTimeoutException e) {
            log.warn("Model call failed, using fallback: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Prefer valid model output per file, then the reference file, then the default.
     */
    private PipelineArtifact merge(Optional<ParsedArtifacts> model, PipelineArtifact reference,
                                   PipelineArtifact fallback) {
        String pipeline = model.map(ParsedArtifacts::pipelineDefinition)
                .filter(this::validPipeline)
                .orElseGet(() -> validPipeline(reference.pipelineDefinition())
                        ? reference.pipelineDefinition()
                        : fallback.pipelineDefinition());
        String image = model.map(ParsedArtifacts::imageBuildDefinition)
                .filter(this::validImageBuild)
                .orElseGet(() -> validImageBuild(reference.imageBuildDefinition())
                        ? reference.imageBuildDefinition()
                        : fallback.imageBuildDefinition());
        return reference.withFiles(pipeline, image);
    }

    private static PipelineArtifact fillMissing(PipelineArtifact artifact, PipelineArtifact fallback) {
        if (artifact.hasImageBuild()) return artifact;
        return artifact.withFiles(artifact.pipelineDefinition(), fallback.imageBuildDefinition());
    }

    private boolean usable(Optional<ParsedArtifacts> modelOutput) {
        return modelOutput.map(ParsedArtifacts::pipelineDefinition).filter(this::validPipeline).isPresent();
    }

    private PipelineArtifact normalizeOrDefault(PipelineArtifact candidate, PipelineArtifact fallback) {
        try {
            return normalizer.normalize(candidate);
        } catch (InvalidArtifactException e) {
            log.warn("Candidate from {} could not be normalized ({}), using built-in default",
                    candidate.source(), e.getMessage());
            return normalizer.normalize(fallback.withSource(ArtifactSource.GENERATED));
        }
    }

    private boolean validPipeline(String pipeline) {
        if (pipeline == null) return false;
        ValidationResult result = validator.validatePipeline(pipeline);
        if (!result.isValid()) {
            log.debug("Rejected pipeline definition: {}", result);
        }
        return result.isValid();
    }

    private boolean validImageBuild(String imageBuild) {
        return imageBuild != null && validator.validateImageBuild(imageBuild).isValid();
    }
}
