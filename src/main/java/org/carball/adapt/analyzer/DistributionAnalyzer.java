package org.carball.adapt.analyzer;

import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.config.SkewStatistic;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a value-frequency histogram into a skew factor that falls as the values
 * concentrate: {@code 1 - (1 - minSkewFactor) * concentration}.
 */
public class DistributionAnalyzer {

    private final SkewStatistic statistic;
    private final int topK;
    private final double minSkewFactor;
    private final double neutral;

    public DistributionAnalyzer(PartitionThresholds thresholds) {
        this.statistic = thresholds.getSkewStatistic();
        this.topK = thresholds.getSkewTopK();
        this.minSkewFactor = thresholds.getMinSkewFactor();
        this.neutral = thresholds.getNeutralSkewFactor();
    }

    public FactorResult analyze(Map<String, Long> histogram) {
        if (histogram == null || histogram.isEmpty()) {
            return FactorResult.neutral(neutral, StatisticGap.HISTOGRAM);
        }
        List<Long> frequencies = histogram.values().stream()
                .map(frequency -> frequency == null ? 0L : Math.max(0L, frequency))
                .collect(Collectors.toList());
        long total = frequencies.stream().mapToLong(Long::longValue).sum();
        if (total <= 0) {
            return FactorResult.neutral(neutral, StatisticGap.HISTOGRAM);
        }

        double concentration = statistic == SkewStatistic.GINI
                ? gini(frequencies, total)
                : topKExcessShare(frequencies, total);
        return FactorResult.of(1.0 - (1.0 - minSkewFactor) * concentration);
    }

    /**
     * Share of rows held by the k most frequent values beyond what a uniform split
     * would give them, scaled to [0, 1]. Histograms with at most k values use
     * {@code k = n - 1}; a single value is fully concentrated.
     */
    double topKExcessShare(List<Long> frequencies, long total) {
        int n = frequencies.size();
        if (n == 1) {
            return 1.0;
        }
        int k = Math.min(topK, n - 1);
        List<Long> descending = frequencies.stream()
                .sorted(Collections.reverseOrder())
                .collect(Collectors.toList());
        long topRows = descending.subList(0, k).stream().mapToLong(Long::longValue).sum();

        double share = (double) topRows / total;
        double uniformShare = (double) k / n;
        return clamp((share - uniformShare) / (1.0 - uniformShare));
    }

    /**
     * Gini coefficient of the frequencies normalized by its maximum {@code (n-1)/n}.
     * A single value is fully concentrated.
     */
    double gini(List<Long> frequencies, long total) {
        int n = frequencies.size();
        if (n == 1) {
            return 1.0;
        }
        List<Long> ascending = frequencies.stream().sorted().collect(Collectors.toList());
        double weighted = 0.0;
        for (int i = 0; i < n; i++) {
            weighted += (i + 1) * (double) ascending.get(i);
        }
        double coefficient = (2.0 * weighted) / (n * (double) total) - (n + 1.0) / n;
        return clamp(coefficient / ((n - 1.0) / n));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
