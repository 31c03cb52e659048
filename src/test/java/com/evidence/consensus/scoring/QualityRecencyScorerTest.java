package com.evidence.consensus.scoring;

import com.evidence.consensus.config.SampleSizeThreshold;
import com.evidence.consensus.config.ScoringConfig;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityRecencyScorerTest {

    private QualityRecencyScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new QualityRecencyScorer();
    }

    private static SourceEstimate estimate(QualityTier tier, Integer year, Long sampleSize) {
        return SourceEstimate.builder()
                .sourceId("src")
                .value(1.0)
                .valueKind(ValueKind.PREVALENCE)
                .qualityTier(tier)
                .year(year)
                .sampleSize(sampleSize)
                .build();
    }

    @ParameterizedTest
    @CsvSource({
            "TIER_1, 2019, 3.0",
            "TIER_1, 2020, 4.5",
            "TIER_2, 2018, 2.0",
            "TIER_2, 2023, 3.0",
            "TIER_3, 2010, 1.0",
            "UNKNOWN, 2021, 1.5"
    })
    void testTierAndRecency(QualityTier tier, int year, double expected) {
        assertEquals(expected, scorer.weight(estimate(tier, year, null)), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "500, 1.0",
            "1000000, 1.0",
            "1000001, 1.1",
            "10000000, 1.1",
            "10000001, 1.3",
            "250000000, 1.3"
    })
    void testOnlyLargestSampleSizeThresholdApplies(long sampleSize, double multiplier) {
        double weight = scorer.weight(estimate(QualityTier.TIER_3, 2000, sampleSize));
        assertEquals(multiplier, weight, 1e-9);
    }

    @Test
    @DisplayName("Missing metadata contributes a neutral factor")
    void testMissingMetadata() {
        assertEquals(2.0, scorer.weight(estimate(QualityTier.TIER_2, null, null)), 1e-9);
        assertEquals(1.0, scorer.weight(estimate(null, null, null)), 1e-9);
    }

    @Test
    void testAllFactorsMultiply() {
        double weight = scorer.weight(estimate(QualityTier.TIER_1, 2022, 20_000_000L));
        assertEquals(3.0 * 1.5 * 1.3, weight, 1e-9);
    }

    @Test
    void testCustomConfig() {
        ScoringConfig config = ScoringConfig.builder()
                .tierWeight(QualityTier.TIER_1, 5.0)
                .recencyCutoffYear(2015)
                .recencyMultiplier(2.0)
                .sampleSizeThresholds(List.of(new SampleSizeThreshold(100L, 1.5)))
                .build();
        QualityRecencyScorer custom = new QualityRecencyScorer(config);

        assertEquals(5.0 * 2.0 * 1.5, custom.weight(estimate(QualityTier.TIER_1, 2016, 101L)), 1e-9);
        assertSame(config, custom.getConfig());
    }

    @Test
    void testNegativeTierWeightRejected() {
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.builder()
                .tierWeight(QualityTier.TIER_2, -1.0)
                .build());
    }
}
