package com.evidence.consensus.pipeline;

import com.evidence.consensus.config.EngineConfig;
import com.evidence.consensus.consensus.WeightedConsensusCalculator;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.core.model.ValueKind;
import com.evidence.consensus.identity.IdentityResolver;
import com.evidence.consensus.identity.cache.CaffeineResolutionCache;
import com.evidence.consensus.landscape.CompetitiveLandscape;
import com.evidence.consensus.landscape.LandscapeBuilder;
import com.evidence.consensus.merge.EntityMergeEngine;
import com.evidence.consensus.merge.MergeBatch;
import com.evidence.consensus.metrics.MetricsService;
import com.evidence.consensus.metrics.NoOpMetricsService;
import com.evidence.consensus.rules.DefaultNormalizationRules;
import com.evidence.consensus.scoring.QualityRecencyScorer;
import com.evidence.consensus.validation.PlausibilityValidator;
import com.evidence.consensus.verify.ContextualStatusVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregates one target end-to-end: consensus per value kind, identity resolution and
 * merge, per-context status verification, then plausibility validation.
 *
 * <p>All steps are synchronous in-memory reductions. Nothing is shared between targets
 * except immutable configuration and the identity cache.</p>
 */
public class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final WeightedConsensusCalculator consensusCalculator;
    private final EntityMergeEngine mergeEngine;
    private final ContextualStatusVerifier statusVerifier;
    private final PlausibilityValidator validator;
    private final LandscapeBuilder landscapeBuilder;
    private final MetricsService metrics;

    public AggregationEngine(WeightedConsensusCalculator consensusCalculator,
                             EntityMergeEngine mergeEngine,
                             ContextualStatusVerifier statusVerifier,
                             PlausibilityValidator validator,
                             LandscapeBuilder landscapeBuilder,
                             MetricsService metrics) {
        this.consensusCalculator = Objects.requireNonNull(consensusCalculator, "consensusCalculator is required");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.statusVerifier = Objects.requireNonNull(statusVerifier, "statusVerifier is required");
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.landscapeBuilder = Objects.requireNonNull(landscapeBuilder, "landscapeBuilder is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public static AggregationEngine create(EngineConfig config) {
        return create(config, new NoOpMetricsService());
    }

    /**
     * Wires every component from one configuration.
     */
    public static AggregationEngine create(EngineConfig config, MetricsService metrics) {
        IdentityResolver resolver = new IdentityResolver(
                config.getAliasTable(),
                DefaultNormalizationRules.createDefaultEngine(),
                config.getExternalIdAttributes(),
                CaffeineResolutionCache.create(config.getCache()));
        return new AggregationEngine(
                new WeightedConsensusCalculator(new QualityRecencyScorer(config.getScoring()), config.getConsensus()),
                new EntityMergeEngine(config.getPhaseRanking(), resolver),
                new ContextualStatusVerifier(config.getApprovalRegistry(), config.getAliasTable()),
                new PlausibilityValidator(config.getValidation(), config.getConsensus()),
                new LandscapeBuilder(config.getEstablishedDrugs()),
                metrics);
    }

    public TargetAggregate aggregate(AggregationTarget target) {
        Map<ValueKind, ConsensusResult> consensus = new EnumMap<>(ValueKind.class);
        for (ValueKind kind : kindsFor(target)) {
            ConsensusResult result = consensusCalculator.consensus(target.targetId(), target.estimates(), kind);
            consensus.put(kind, result);
            metrics.recordConsensus(kind, result.confidence());
        }

        MergeBatch merged = mergeEngine.mergeAll(target.candidates());
        List<MergedEntity> entities = statusVerifier.verifyAll(merged.entities(), target.contextIds());
        metrics.incrementEntitiesMerged(entities.size());

        List<ValidationIssue> issues = new ArrayList<>(merged.issues());
        issues.addAll(validator.validate(consensus.values(), entities));
        issues.forEach(issue -> metrics.recordIssue(issue.severity()));

        log.info("aggregation.completed targetId={} kinds={} entities={} issues={}",
                target.targetId(), consensus.keySet(), entities.size(), issues.size());
        return new TargetAggregate(target.targetId(), consensus, entities, issues);
    }

    /**
     * Builds the competitive landscape of an aggregate's entities in one of its contexts.
     */
    public CompetitiveLandscape landscape(TargetAggregate aggregate, String contextId) {
        return landscapeBuilder.build(contextId, aggregate.entities());
    }

    private static Set<ValueKind> kindsFor(AggregationTarget target) {
        Set<ValueKind> kinds = EnumSet.noneOf(ValueKind.class);
        kinds.addAll(target.requiredKinds());
        for (SourceEstimate estimate : target.estimates()) {
            kinds.add(estimate.valueKind());
        }
        return kinds;
    }
}
