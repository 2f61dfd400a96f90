package org.carball.adapt.analyzer;

import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.config.SkewStatistic;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistributionAnalyzerTest {

    private static final Map<String, Long> SKEWED = Map.of(
            "a", 900L, "b", 40L, "c", 30L, "d", 20L, "e", 10L);
    private static final Map<String, Long> NEAR_UNIFORM = Map.of(
            "a", 210L, "b", 200L, "c", 200L, "d", 195L, "e", 195L);

    private final DistributionAnalyzer topK = new DistributionAnalyzer(PartitionThresholds.defaults());
    private final DistributionAnalyzer gini = new DistributionAnalyzer(PartitionThresholds.builder()
            .skewStatistic(SkewStatistic.GINI)
            .build());

    @Test
    void shouldScoreSkewedHistogramBelowNearUniform() {
        assertThat(topK.analyze(SKEWED).value()).isLessThan(topK.analyze(NEAR_UNIFORM).value());
        assertThat(gini.analyze(SKEWED).value()).isLessThan(gini.analyze(NEAR_UNIFORM).value());
    }

    @Test
    void shouldComputeTopKExcessShare() {
        // Given - top three hold 970 of 1000 rows against a uniform 3/5
        double expectedConcentration = (0.97 - 0.6) / 0.4;

        // When
        FactorResult result = topK.analyze(SKEWED);

        // Then
        assertThat(result.value()).isCloseTo(1.0 - 0.9 * expectedConcentration, within(1e-9));
    }

    @Test
    void shouldTreatPerfectlyUniformHistogramAsUnskewed() {
        // Given
        Map<String, Long> uniform = new HashMap<>();
        for (int i = 0; i < 10; i++) {
            uniform.put("v" + i, 100L);
        }

        // Then
        assertThat(topK.analyze(uniform).value()).isCloseTo(1.0, within(1e-9));
        assertThat(gini.analyze(uniform).value()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldComputeNormalizedGini() {
        // Given - one value holds every row: maximal inequality
        List<Long> frequencies = List.of(0L, 0L, 0L, 100L);

        // When / Then
        assertThat(gini.gini(frequencies, 100)).isCloseTo(1.0, within(1e-9));
        assertThat(gini.analyze(Map.of("a", 0L, "b", 0L, "c", 0L, "d", 100L)).value())
                .isCloseTo(0.1, within(1e-9));
    }

    @Test
    void shouldMeasureConcentrationWithNoMoreValuesThanK() {
        // Given - three values, the default k
        Map<String, Long> skewed = Map.of("a", 900L, "b", 50L, "c", 50L);
        Map<String, Long> nearUniform = Map.of("a", 340L, "b", 330L, "c", 330L);

        // Then
        assertThat(topK.analyze(skewed).value()).isLessThan(topK.analyze(nearUniform).value());
        assertThat(gini.analyze(skewed).value()).isLessThan(gini.analyze(nearUniform).value());
        assertThat(topK.analyze(nearUniform).value()).isGreaterThan(0.95);
    }

    @Test
    void shouldUseOneLessThanValueCountWhenKIsTooLarge() {
        // Given - top value holds 95% against a uniform 1/2
        double expectedConcentration = (0.95 - 0.5) / 0.5;

        // Then
        assertThat(topK.analyze(Map.of("a", 95L, "b", 5L)).value())
                .isCloseTo(1.0 - 0.9 * expectedConcentration, within(1e-9));
    }

    @Test
    void shouldTreatSingleValueHistogramAsFullySkewed() {
        assertThat(topK.analyze(Map.of("a", 1_000L)).value()).isCloseTo(0.1, within(1e-9));
        assertThat(gini.analyze(Map.of("a", 1_000L)).value()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void shouldStayWithinBounds() {
        assertThat(topK.analyze(Map.of("a", Long.MAX_VALUE / 4, "b", 1L, "c", 1L, "d", 1L, "e", 1L)).value())
                .isBetween(0.1, 1.0);
        assertThat(gini.analyze(SKEWED).value()).isBetween(0.1, 1.0);
    }

    @Test
    void shouldFallBackToNeutralWithoutHistogram() {
        // When
        FactorResult missing = topK.analyze(null);
        FactorResult empty = topK.analyze(Map.of());
        FactorResult zeroRows = topK.analyze(Map.of("a", 0L, "b", 0L));

        // Then
        assertThat(missing.value()).isEqualTo(1.0);
        assertThat(missing.defaultedFor()).isEqualTo(StatisticGap.HISTOGRAM);
        assertThat(empty.defaultedFor()).isEqualTo(StatisticGap.HISTOGRAM);
        assertThat(zeroRows.defaultedFor()).isEqualTo(StatisticGap.HISTOGRAM);
    }
}
