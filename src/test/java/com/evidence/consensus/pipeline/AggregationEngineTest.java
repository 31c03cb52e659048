package com.evidence.consensus.pipeline;

import com.evidence.consensus.config.EngineConfig;
import com.evidence.consensus.core.model.ApprovalClassification;
import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.StatusDetail;
import com.evidence.consensus.core.model.ValueKind;
import com.evidence.consensus.identity.DrugKeyGenerator;
import com.evidence.consensus.landscape.CompetitiveLandscape;
import com.evidence.consensus.metrics.MetricsService;
import com.evidence.consensus.verify.ApprovalRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AggregationEngineTest {

    private static final String RA = "Rheumatoid Arthritis";
    private static final String LN = "Lupus Nephritis";

    private static EngineConfig config() {
        return EngineConfig.builder()
                .approvalRegistry(ApprovalRegistry.builder().approve(RA, "upadacitinib").build())
                .establishedDrugs(List.of("methotrexate"))
                .build();
    }

    private static SourceEstimate prevalence(String id, double value, QualityTier tier, int year) {
        return SourceEstimate.builder()
                .sourceId(id)
                .value(value)
                .valueKind(ValueKind.PREVALENCE)
                .qualityTier(tier)
                .year(year)
                .build();
    }

    private static CandidateEntity drug(String name, DevelopmentPhase phase, String ref) {
        return CandidateEntity.builder()
                .canonicalNameRaw(name)
                .phase(phase)
                .sourceRef(ref)
                .build();
    }

    private static AggregationTarget lupusNephritis() {
        return AggregationTarget.builder(LN)
                .estimate(prevalence("pmid:1", 101_500, QualityTier.TIER_1, 2022))
                .estimate(prevalence("pmid:2", 150_500, QualityTier.TIER_2, 2019))
                .estimate(prevalence("pmid:3", 120_500, QualityTier.TIER_1, 2023))
                .candidate(drug("Upadacitinib", DevelopmentPhase.APPROVED, "NCT0001"))
                .candidate(drug("upadacitinib", DevelopmentPhase.PHASE_3, "NCT0002"))
                .candidate(CandidateEntity.builder()
                        .canonicalNameRaw("Iscalimab")
                        .phase(DevelopmentPhase.PHASE_2)
                        .developmentStatus(DevelopmentStatus.DISCONTINUED)
                        .statusDetail(StatusDetail.of("2023-04", "Lack of efficacy"))
                        .sourceRef("news:1")
                        .build())
                .candidate(drug("Methotrexate", DevelopmentPhase.APPROVED, "label:1"))
                .context(RA)
                .context(LN)
                .require(ValueKind.TREATMENT_RATE)
                .build();
    }

    @Nested
    @DisplayName("End-to-end aggregation")
    class EndToEndTests {

        private AggregationEngine engine;

        @BeforeEach
        void setUp() {
            engine = AggregationEngine.create(config());
        }

        @Test
        @DisplayName("Should compute consensus for present and required kinds")
        void testConsensusPerKind() {
            TargetAggregate aggregate = engine.aggregate(lupusNephritis());

            assertEquals(LN, aggregate.targetId());
            ConsensusResult prevalence = aggregate.consensusFor(ValueKind.PREVALENCE).orElseThrow();
            assertEquals(3, prevalence.estimateCount());
            assertEquals(ConfidenceLevel.HIGH, prevalence.confidence());
            assertEquals(120_500.0, prevalence.recommendedValue(), 1e-9);

            ConsensusResult treatment = aggregate.consensusFor(ValueKind.TREATMENT_RATE).orElseThrow();
            assertTrue(treatment.isEmpty());
            assertTrue(aggregate.consensusFor(ValueKind.INCIDENCE).isEmpty());
        }

        @Test
        @DisplayName("Should merge sightings and verify status per context")
        void testMergeAndVerify() {
            TargetAggregate aggregate = engine.aggregate(lupusNephritis());

            assertEquals(3, aggregate.entities().size());
            MergedEntity upadacitinib = aggregate.entity("upadacitinib").orElseThrow();
            assertEquals(DevelopmentPhase.APPROVED, upadacitinib.phase());
            assertEquals(2, upadacitinib.mergedSourceRefs().size());
            assertEquals(DrugKeyGenerator.generate("upadacitinib"), upadacitinib.drugKey());
            assertEquals(ApprovalClassification.APPROVED, upadacitinib.statusIn(RA).orElseThrow().status());
            assertEquals(ApprovalClassification.INVESTIGATIONAL, upadacitinib.statusIn(LN).orElseThrow().status());
            assertEquals(DevelopmentPhase.PHASE_3, upadacitinib.statusIn(LN).orElseThrow().phase());

            MergedEntity iscalimab = aggregate.entity("iscalimab").orElseThrow();
            assertEquals(ApprovalClassification.DISCONTINUED, iscalimab.statusIn(LN).orElseThrow().status());
        }

        @Test
        @DisplayName("Should report a missing required kind as a warning without errors")
        void testIssues() {
            TargetAggregate aggregate = engine.aggregate(lupusNephritis());

            assertFalse(aggregate.hasErrors());
            assertTrue(aggregate.issuesOf(Severity.WARNING).stream()
                    .anyMatch(i -> i.field().equals("treatmentRate")
                            && i.message().equals("No treatmentRate estimates extracted")));
        }

        @Test
        @DisplayName("Should flag values outside the domain as errors")
        void testOutOfDomainIsError() {
            AggregationTarget target = AggregationTarget.builder("sle")
                    .estimate(prevalence("pmid:1", 50_000, QualityTier.TIER_1, 2022))
                    .estimate(prevalence("pmid:2", -10, QualityTier.TIER_1, 2022))
                    .build();

            TargetAggregate aggregate = engine.aggregate(target);

            assertTrue(aggregate.hasErrors());
            assertEquals(1, aggregate.consensusFor(ValueKind.PREVALENCE).orElseThrow().estimateCount());
        }

        @Test
        @DisplayName("Should build the landscape from contextual status")
        void testLandscape() {
            TargetAggregate aggregate = engine.aggregate(lupusNephritis());

            CompetitiveLandscape ln = engine.landscape(aggregate, LN);
            assertEquals(LN, ln.contextId());
            assertTrue(ln.approved().isEmpty());
            assertEquals(List.of("upadacitinib"), ln.phase3().stream().map(MergedEntity::identityKey).toList());
            assertEquals(List.of("iscalimab"), ln.discontinued().stream().map(MergedEntity::identityKey).toList());
            assertEquals(2, ln.totalCount());
            assertFalse(ln.excludedComparators().isEmpty());

            CompetitiveLandscape ra = engine.landscape(aggregate, RA);
            assertEquals(List.of("upadacitinib"), ra.approved().stream().map(MergedEntity::identityKey).toList());
        }

        @Test
        @DisplayName("Should aggregate an empty target without failing")
        void testEmptyTarget() {
            TargetAggregate aggregate = engine.aggregate(AggregationTarget.builder("empty").build());

            assertTrue(aggregate.consensus().isEmpty());
            assertTrue(aggregate.entities().isEmpty());
            assertTrue(aggregate.issues().isEmpty());
        }
    }

    @Nested
    @DisplayName("Metrics")
    @ExtendWith(MockitoExtension.class)
    class MetricsTests {

        @Mock
        private MetricsService metrics;

        @Test
        @DisplayName("Should record consensus, merged entities and issues")
        void testMetricsRecorded() {
            AggregationEngine engine = AggregationEngine.create(config(), metrics);

            engine.aggregate(lupusNephritis());

            verify(metrics).recordConsensus(ValueKind.PREVALENCE, ConfidenceLevel.HIGH);
            verify(metrics).recordConsensus(eq(ValueKind.TREATMENT_RATE), any(ConfidenceLevel.class));
            verify(metrics).incrementEntitiesMerged(3);
            verify(metrics, atLeastOnce()).recordIssue(Severity.WARNING);
            verify(metrics, never()).recordIssue(Severity.ERROR);
        }
    }
}
