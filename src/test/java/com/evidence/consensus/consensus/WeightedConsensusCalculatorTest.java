package com.evidence.consensus.consensus;

import com.evidence.consensus.config.ConsensusConfig;
import com.evidence.consensus.config.ScoringConfig;
import com.evidence.consensus.config.ValueDomain;
import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValueKind;
import com.evidence.consensus.scoring.QualityRecencyScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeightedConsensusCalculatorTest {

    private WeightedConsensusCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new WeightedConsensusCalculator();
    }

    private static SourceEstimate estimate(String id, double value, ValueKind kind, QualityTier tier, Integer year) {
        return SourceEstimate.builder()
                .sourceId(id)
                .value(value)
                .valueKind(kind)
                .qualityTier(tier)
                .year(year)
                .build();
    }

    private static SourceEstimate prevalence(String id, double value, QualityTier tier, Integer year) {
        return estimate(id, value, ValueKind.PREVALENCE, tier, year);
    }

    @Nested
    @DisplayName("Confidence classification")
    class ConfidenceTests {

        @Test
        @DisplayName("Two agreeing Tier 1 sources give HIGH confidence")
        void testTwoTier1SourcesAgree() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("pmid:1", 100_000, QualityTier.TIER_1, 2022),
                    prevalence("pmid:2", 150_000, QualityTier.TIER_2, 2019),
                    prevalence("pmid:3", 120_000, QualityTier.TIER_1, 2023));

            ConsensusResult result = calculator.consensus("lupus", estimates, ValueKind.PREVALENCE);

            assertEquals(2, result.tier1Count());
            assertEquals(3, result.estimateCount());
            assertEquals(ConfidenceLevel.HIGH, result.confidence());
            assertEquals(120_000.0, result.recommendedValue(), 1e-9);
            assertEquals(120_000.0, result.simpleMedian(), 1e-9);
            assertEquals(100_000.0, result.rangeLow(), 1e-9);
            assertEquals(150_000.0, result.rangeHigh(), 1e-9);
            assertEquals(0.204, result.coefficientOfVariation(), 1e-9);
            assertEquals("2 Tier-1 sources agree within 30% CV", result.rationale());
            assertEquals("lupus", result.targetId());
        }

        @Test
        @DisplayName("One Tier 1 source with moderate spread gives MEDIUM")
        void testMediumConfidence() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 100, QualityTier.TIER_1, 2015),
                    prevalence("b", 110, QualityTier.TIER_3, 2015));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.PREVALENCE);

            assertEquals(ConfidenceLevel.MEDIUM, result.confidence());
            assertTrue(result.rationale().startsWith("Tier-1 source available"));
        }

        @Test
        @DisplayName("No Tier 1 source never reaches HIGH or MEDIUM")
        void testNoTier1IsLow() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 100, QualityTier.TIER_2, 2021),
                    prevalence("b", 100, QualityTier.TIER_2, 2021),
                    prevalence("c", 100, QualityTier.TIER_3, 2021));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.PREVALENCE);

            assertEquals(0, result.tier1Count());
            assertEquals(0.0, result.coefficientOfVariation());
            assertEquals(ConfidenceLevel.LOW, result.confidence());
        }

        @Test
        @DisplayName("High variability drops to LOW even with Tier 1 sources")
        void testHighVariabilityIsLow() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 10, QualityTier.TIER_1, 2021),
                    prevalence("b", 1_000, QualityTier.TIER_1, 2021));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.PREVALENCE);

            assertEquals(ConfidenceLevel.LOW, result.confidence());
            assertTrue(result.coefficientOfVariation() >= 0.5);
        }

        @Test
        void testCustomThresholds() {
            ConsensusConfig strict = ConsensusConfig.builder()
                    .highConfidence(3, 0.1)
                    .mediumConfidence(2, 0.3)
                    .build();
            WeightedConsensusCalculator custom = new WeightedConsensusCalculator(new QualityRecencyScorer(), strict);
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 100, QualityTier.TIER_1, 2022),
                    prevalence("b", 105, QualityTier.TIER_1, 2022));

            assertEquals(ConfidenceLevel.MEDIUM, custom.consensus(estimates, ValueKind.PREVALENCE).confidence());
        }
    }

    @Nested
    @DisplayName("Filtering and degraded results")
    class FilteringTests {

        @Test
        @DisplayName("Empty input yields LOW with no recommended value")
        void testEmpty() {
            ConsensusResult result = calculator.consensus("t", List.of(), ValueKind.INCIDENCE);

            assertTrue(result.isEmpty());
            assertNull(result.recommendedValue());
            assertEquals(ConfidenceLevel.LOW, result.confidence());
            assertEquals(ConsensusResult.NO_ESTIMATES_RATIONALE, result.rationale());
        }

        @Test
        void testNullCollectionTreatedAsEmpty() {
            assertTrue(calculator.consensus(null, ValueKind.PREVALENCE).isEmpty());
        }

        @Test
        @DisplayName("Only estimates of the requested kind are used")
        void testKindFilter() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 1_000, QualityTier.TIER_1, 2022),
                    estimate("b", 40, ValueKind.FAILURE_RATE, QualityTier.TIER_1, 2022));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.FAILURE_RATE);

            assertEquals(1, result.estimateCount());
            assertEquals(40.0, result.recommendedValue(), 1e-9);
        }

        @Test
        @DisplayName("Out-of-domain failure rate is excluded, the rest still aggregate")
        void testOutOfDomainExcluded() {
            List<SourceEstimate> estimates = List.of(
                    estimate("a", 150, ValueKind.FAILURE_RATE, QualityTier.TIER_1, 2022),
                    estimate("b", 40, ValueKind.FAILURE_RATE, QualityTier.TIER_1, 2022),
                    estimate("c", 50, ValueKind.FAILURE_RATE, QualityTier.TIER_2, 2022));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.FAILURE_RATE);

            assertEquals(2, result.estimateCount());
            assertEquals(List.of(150.0), result.rejectedValues());
            assertEquals(50.0, result.rangeHigh(), 1e-9);
            assertNotNull(result.recommendedValue());
        }

        @Test
        void testNegativePrevalenceExcluded() {
            ConsensusResult result = calculator.consensus(
                    List.of(prevalence("a", -5, QualityTier.TIER_1, 2022)), ValueKind.PREVALENCE);

            assertTrue(result.isEmpty());
            assertEquals(List.of(-5.0), result.rejectedValues());
        }

        @Test
        void testEstimateWithoutValueIgnored() {
            SourceEstimate noValue = SourceEstimate.builder()
                    .sourceId("x")
                    .valueKind(ValueKind.PREVALENCE)
                    .build();

            ConsensusResult result = calculator.consensus(List.of(noValue), ValueKind.PREVALENCE);

            assertTrue(result.isEmpty());
            assertTrue(result.rejectedValues().isEmpty());
        }

        @Test
        void testCustomDomain() {
            ConsensusConfig config = ConsensusConfig.builder()
                    .domain(ValueKind.INCIDENCE, new ValueDomain(0, 1_000))
                    .build();
            WeightedConsensusCalculator custom = new WeightedConsensusCalculator(new QualityRecencyScorer(), config);

            ConsensusResult result = custom.consensus(List.of(
                    estimate("a", 5_000, ValueKind.INCIDENCE, QualityTier.TIER_1, 2022),
                    estimate("b", 500, ValueKind.INCIDENCE, QualityTier.TIER_1, 2022)), ValueKind.INCIDENCE);

            assertEquals(1, result.estimateCount());
            assertEquals(List.of(5_000.0), result.rejectedValues());
        }
    }

    @Nested
    @DisplayName("Medians")
    class MedianTests {

        @Test
        @DisplayName("Recommended value always lies within the range")
        void testRecommendedWithinRange() {
            QualityTier[] tiers = QualityTier.values();
            for (int seed = 1; seed <= 25; seed++) {
                List<SourceEstimate> estimates = new ArrayList<>();
                for (int i = 0; i < seed % 7 + 1; i++) {
                    double value = (seed * 7919L + i * 104729L) % 10_000;
                    estimates.add(prevalence("s" + i, value, tiers[(seed + i) % tiers.length], 2015 + (i % 10)));
                }
                ConsensusResult result = calculator.consensus(estimates, ValueKind.PREVALENCE);

                assertTrue(result.rangeLow() <= result.recommendedValue(), result.toString());
                assertTrue(result.recommendedValue() <= result.rangeHigh(), result.toString());
            }
        }

        @Test
        void testEvenCountAveragesMiddleValues() {
            assertEquals(2.5, WeightedConsensusCalculator.median(new double[]{4, 1, 3, 2}), 1e-9);
            assertEquals(3.0, WeightedConsensusCalculator.median(new double[]{5, 3, 1}), 1e-9);
        }

        @Test
        @DisplayName("Heavier source pulls the weighted median towards its value")
        void testWeightingShiftsMedian() {
            List<SourceEstimate> estimates = List.of(
                    prevalence("a", 100, QualityTier.TIER_1, 2022),
                    prevalence("b", 200, QualityTier.TIER_3, 2010));

            ConsensusResult result = calculator.consensus(estimates, ValueKind.PREVALENCE);

            assertEquals(150.0, result.simpleMedian(), 1e-9);
            assertEquals(100.0, result.recommendedValue(), 1e-9);
        }

        @Test
        @DisplayName("Zero weights fall back to the simple median")
        void testZeroWeightFallback() {
            ScoringConfig weightless = ScoringConfig.builder()
                    .tierWeight(QualityTier.TIER_1, 0.0)
                    .tierWeight(QualityTier.TIER_2, 0.0)
                    .build();
            WeightedConsensusCalculator custom = new WeightedConsensusCalculator(
                    new QualityRecencyScorer(weightless), ConsensusConfig.defaults());

            ConsensusResult result = custom.consensus(List.of(
                    prevalence("a", 10, QualityTier.TIER_1, 2022),
                    prevalence("b", 30, QualityTier.TIER_2, 2022)), ValueKind.PREVALENCE);

            assertEquals(20.0, result.recommendedValue(), 1e-9);
        }

        @Test
        void testReplicationFactorMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> ConsensusConfig.builder().replicationFactor(0));
        }

        @Test
        void testSingleValueHasZeroCv() {
            assertEquals(0.0, WeightedConsensusCalculator.coefficientOfVariation(List.of(42.0)));
        }
    }
}
