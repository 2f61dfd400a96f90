package org.carball.adapt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.schema.ColumnDescriptor;
import org.carball.adapt.model.schema.TableDescriptor;

/**
 * Scores how well a column's distinct-to-row ratio suits partitioning.
 * <p>
 * Ratios inside the configured band score 1.0. Outside it the factor decays as a
 * Gaussian of the distance in decades from the nearest band edge, narrower below
 * the band than above it, and never drops under the configured floor.
 */
@Slf4j
public class CardinalityAnalyzer {

    private final double logBandLow;
    private final double logBandHigh;
    private final double decayBelow;
    private final double decayAbove;
    private final double floor;
    private final double neutral;

    public CardinalityAnalyzer(PartitionThresholds thresholds) {
        this.logBandLow = Math.log10(thresholds.getCardinalityBandLow());
        this.logBandHigh = Math.log10(thresholds.getCardinalityBandHigh());
        this.decayBelow = thresholds.getCardinalityDecayBelow();
        this.decayAbove = thresholds.getCardinalityDecayAbove();
        this.floor = thresholds.getCardinalityFloor();
        this.neutral = thresholds.getNeutralCardinalityFactor();
    }

    public FactorResult analyze(ColumnDescriptor column, TableDescriptor table) {
        FactorResult result = analyze(column.getDistinctCount(), table.getRowCount());
        if (result.isDefaulted()) {
            log.debug("No {} for {}.{}; using neutral cardinality factor {}",
                    result.defaultedFor(), table.getSimpleName(), column.getNormalizedName(), result.value());
        }
        return result;
    }

    public FactorResult analyze(Long distinctCount, Long rowCount) {
        if (distinctCount == null || distinctCount <= 0) {
            return FactorResult.neutral(neutral, StatisticGap.DISTINCT_COUNT);
        }
        if (rowCount == null || rowCount <= 0) {
            return FactorResult.neutral(neutral, StatisticGap.ROW_COUNT);
        }

        double ratio = Math.min((double) distinctCount / rowCount, 1.0);
        double decades = Math.log10(ratio);

        if (decades < logBandLow) {
            return FactorResult.of(decay(logBandLow - decades, decayBelow));
        }
        if (decades > logBandHigh) {
            return FactorResult.of(decay(decades - logBandHigh, decayAbove));
        }
        return FactorResult.of(1.0);
    }

    private double decay(double distance, double sigma) {
        return floor + (1.0 - floor) * Math.exp(-(distance * distance) / (2.0 * sigma * sigma));
    }
}
