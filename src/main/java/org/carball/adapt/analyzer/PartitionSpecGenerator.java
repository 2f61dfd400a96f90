package org.carball.adapt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.recommendation.PartitionField;
import org.carball.adapt.model.recommendation.PartitionRecommendation;
import org.carball.adapt.model.recommendation.PartitionTransform;
import org.carball.adapt.model.schema.ColumnDescriptor;
import org.carball.adapt.model.schema.ColumnType;
import org.carball.adapt.model.schema.TableDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the top-ranked columns of a table and assigns each a partition transform.
 */
@Slf4j
public class PartitionSpecGenerator {

    private final PartitionThresholds thresholds;

    public PartitionSpecGenerator(PartitionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param rankedScores scores in ranking order, as produced by {@link ScoringEngine}
     */
    public PartitionRecommendation generate(TableDescriptor table, List<ColumnScore> rankedScores) {
        List<PartitionField> fields = new ArrayList<>();

        for (ColumnScore score : rankedScores) {
            if (fields.size() >= thresholds.getTopN()) {
                break;
            }
            if (score.score() <= thresholds.getMinimumScore()) {
                continue;
            }
            ColumnDescriptor column = table.findColumn(score.column());
            if (column == null) {
                log.warn("Scored column {}.{} is not in the catalog; skipping", table.getSimpleName(), score.column());
                continue;
            }

            PartitionTransform transform = selectTransform(column);
            String rationale = describeTransform(column, transform) + "; " + score.describe();
            fields.add(new PartitionField(fields.size() + 1, score.column(), transform, score, rationale));
        }

        if (fields.isEmpty()) {
            log.info("No column of {} scored above {}", table.getSimpleName(), thresholds.getMinimumScore());
        } else {
            log.debug("Recommended partitioning for {}: {}", table.getSimpleName(), fields.stream()
                    .map(field -> field.transform().expression())
                    .collect(Collectors.toList()));
        }
        return new PartitionRecommendation(table.getSimpleName(), fields);
    }

    public PartitionTransform selectTransform(ColumnDescriptor column) {
        String name = column.getNormalizedName();

        if (column.getType() == ColumnType.TEMPORAL) {
            if (column.hasTemporalRange()) {
                return temporalTransform(name, column.temporalSpanDays());
            }
            if (column.hasDistinctCount()) {
                return temporalTransform(name, column.getDistinctCount());
            }
            return PartitionTransform.months(name);
        }

        if (column.hasDistinctCount() && column.getDistinctCount() > thresholds.getHighCardinalityThreshold()) {
            return PartitionTransform.bucket(name, bucketCount(column.getDistinctCount()));
        }
        return PartitionTransform.identity(name);
    }

    /**
     * Smallest power of two giving each bucket at most the configured number of
     * distinct values, clamped to the configured bucket range.
     */
    public int bucketCount(long distinctCount) {
        long perBucket = thresholds.getDistinctValuesPerBucket();
        long needed = Math.max(1L, (distinctCount + perBucket - 1) / perBucket);
        long buckets = Long.highestOneBit(needed);
        if (buckets < needed) {
            buckets <<= 1;
        }
        return (int) Math.max(thresholds.getMinBucketCount(), Math.min(thresholds.getMaxBucketCount(), buckets));
    }

    private PartitionTransform temporalTransform(String column, long spanDays) {
        if (spanDays <= thresholds.getDailySpanDays()) {
            return PartitionTransform.days(column);
        }
        if (spanDays <= thresholds.getMonthlySpanDays()) {
            return PartitionTransform.months(column);
        }
        return PartitionTransform.years(column);
    }

    private String describeTransform(ColumnDescriptor column, PartitionTransform transform) {
        switch (transform.type()) {
            case DAYS:
            case MONTHS:
            case YEARS:
                if (column.hasTemporalRange()) {
                    return String.format("temporal column spanning %d days", column.temporalSpanDays());
                }
                if (column.hasDistinctCount()) {
                    return String.format("temporal column with %d distinct dates", column.getDistinctCount());
                }
                return "temporal column without range statistics";
            case BUCKET:
                return String.format("%d distinct values exceed %d, hashed into %d buckets",
                        column.getDistinctCount(), thresholds.getHighCardinalityThreshold(), transform.bucketCount());
            default:
                return column.hasDistinctCount()
                        ? String.format("%d distinct values partitioned by value", column.getDistinctCount())
                        : "partitioned by value";
        }
    }
}
