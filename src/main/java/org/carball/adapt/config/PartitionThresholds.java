package org.carball.adapt.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class PartitionThresholds {

    // Recommendation shape
    @Builder.Default
    @JsonProperty("top_n")
    private int topN = 3;

    @Builder.Default
    @JsonProperty("minimum_score")
    private double minimumScore = 0.0;

    // Query classification
    @Builder.Default
    @JsonProperty("interactive_threshold_ms")
    private long interactiveThresholdMs = 10_000;

    // Transform selection
    @Builder.Default
    @JsonProperty("high_cardinality_threshold")
    private long highCardinalityThreshold = 10_000;

    @Builder.Default
    @JsonProperty("min_bucket_count")
    private int minBucketCount = 4;

    @Builder.Default
    @JsonProperty("max_bucket_count")
    private int maxBucketCount = 128;

    @Builder.Default
    @JsonProperty("distinct_values_per_bucket")
    private long distinctValuesPerBucket = 500;

    @Builder.Default
    @JsonProperty("daily_span_days")
    private long dailySpanDays = 90;

    @Builder.Default
    @JsonProperty("monthly_span_days")
    private long monthlySpanDays = 3650;

    // Cardinality factor, ratios of distinct values to rows
    @Builder.Default
    @JsonProperty("cardinality_band_low")
    private double cardinalityBandLow = 1e-4;

    @Builder.Default
    @JsonProperty("cardinality_band_high")
    private double cardinalityBandHigh = 1e-2;

    @Builder.Default
    @JsonProperty("cardinality_decay_below")
    private double cardinalityDecayBelow = 0.5;

    @Builder.Default
    @JsonProperty("cardinality_decay_above")
    private double cardinalityDecayAbove = 2.0;

    @Builder.Default
    @JsonProperty("cardinality_floor")
    private double cardinalityFloor = 0.05;

    @Builder.Default
    @JsonProperty("neutral_cardinality_factor")
    private double neutralCardinalityFactor = 0.5;

    // Skew factor
    @Builder.Default
    @JsonProperty("skew_statistic")
    private SkewStatistic skewStatistic = SkewStatistic.TOP_K_SHARE;

    @Builder.Default
    @JsonProperty("skew_top_k")
    private int skewTopK = 3;

    @Builder.Default
    @JsonProperty("min_skew_factor")
    private double minSkewFactor = 0.1;

    @Builder.Default
    @JsonProperty("neutral_skew_factor")
    private double neutralSkewFactor = 1.0;

    // Resource impact
    @Builder.Default
    @JsonProperty("cpu_weight")
    private double cpuWeight = 0.6;

    @Builder.Default
    @JsonProperty("memory_weight")
    private double memoryWeight = 0.4;

    @Builder.Default
    @JsonProperty("interactive_weight")
    private double interactiveWeight = 2.0;

    @Builder.Default
    @JsonProperty("batch_weight")
    private double batchWeight = 1.0;

    @Builder.Default
    @JsonProperty("min_resource_multiplier")
    private double minResourceMultiplier = 0.5;

    @Builder.Default
    @JsonProperty("max_resource_multiplier")
    private double maxResourceMultiplier = 1.5;

    // Execution
    @Builder.Default
    @JsonProperty("parallelism")
    private int parallelism = 1;

    @Builder.Default
    @JsonProperty("scoring_weights")
    private ScoringWeights weights = ScoringWeights.defaults();

    // Profile information
    @Builder.Default
    @JsonProperty("profile_name")
    private String profileName = "default";

    @Builder.Default
    @JsonProperty("profile_description")
    private String profileDescription = "Default balanced thresholds";

    /**
     * Creates default thresholds suitable for most query logs.
     */
    public static PartitionThresholds defaults() {
        return PartitionThresholds.builder().build();
    }

    /**
     * Rejects configurations the pipeline cannot run with and logs warnings for
     * values that are legal but probably unintended.
     *
     * @throws IllegalArgumentException listing every invalid setting
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (topN <= 0) {
            problems.add("top_n must be positive but was " + topN);
        }
        if (interactiveThresholdMs <= 0) {
            problems.add("interactive_threshold_ms must be positive but was " + interactiveThresholdMs);
        }
        if (highCardinalityThreshold <= 0) {
            problems.add("high_cardinality_threshold must be positive but was " + highCardinalityThreshold);
        }
        if (minBucketCount <= 0) {
            problems.add("min_bucket_count must be positive but was " + minBucketCount);
        }
        if (maxBucketCount < minBucketCount) {
            problems.add("max_bucket_count (" + maxBucketCount + ") must not be below min_bucket_count ("
                    + minBucketCount + ")");
        }
        if (distinctValuesPerBucket <= 0) {
            problems.add("distinct_values_per_bucket must be positive but was " + distinctValuesPerBucket);
        }
        if (dailySpanDays <= 0 || monthlySpanDays <= dailySpanDays) {
            problems.add("span thresholds must satisfy 0 < daily_span_days < monthly_span_days but were "
                    + dailySpanDays + " and " + monthlySpanDays);
        }
        if (cardinalityBandLow <= 0 || cardinalityBandHigh > 1 || cardinalityBandLow >= cardinalityBandHigh) {
            problems.add("cardinality band must satisfy 0 < low < high <= 1 but was ["
                    + cardinalityBandLow + ", " + cardinalityBandHigh + "]");
        }
        if (cardinalityDecayBelow <= 0 || cardinalityDecayAbove <= 0) {
            problems.add("cardinality decay widths must be positive");
        }
        if (cardinalityFloor < 0 || cardinalityFloor >= 1) {
            problems.add("cardinality_floor must be in [0, 1) but was " + cardinalityFloor);
        }
        if (neutralCardinalityFactor < cardinalityFloor || neutralCardinalityFactor > 1) {
            problems.add("neutral_cardinality_factor must be within [cardinality_floor, 1] but was "
                    + neutralCardinalityFactor);
        }
        if (skewTopK <= 0) {
            problems.add("skew_top_k must be positive but was " + skewTopK);
        }
        if (minSkewFactor < 0 || minSkewFactor > 1) {
            problems.add("min_skew_factor must be in [0, 1] but was " + minSkewFactor);
        }
        if (neutralSkewFactor < minSkewFactor || neutralSkewFactor > 1) {
            problems.add("neutral_skew_factor must be within [min_skew_factor, 1] but was " + neutralSkewFactor);
        }
        if (cpuWeight < 0 || memoryWeight < 0 || interactiveWeight < 0 || batchWeight < 0) {
            problems.add("resource and query class weights must not be negative");
        }
        if (minResourceMultiplier < 0 || maxResourceMultiplier < minResourceMultiplier) {
            problems.add("resource multiplier range must satisfy 0 <= min <= max but was ["
                    + minResourceMultiplier + ", " + maxResourceMultiplier + "]");
        }
        if (parallelism <= 0) {
            problems.add("parallelism must be positive but was " + parallelism);
        }
        if (weights == null) {
            problems.add("scoring_weights must be present");
        } else if (weights.getBaseWeight() < 0 || weights.getUsageExponent() < 0
                || weights.getCardinalityExponent() < 0 || weights.getResourceExponent() < 0
                || weights.getSkewExponent() < 0 || weights.getPredicateBonusWeight() < 0) {
            problems.add("scoring weights must not be negative: " + weights.getDescription());
        }

        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration: " + String.join("; ", problems));
        }

        if (interactiveWeight < batchWeight) {
            log.warn("Interactive weight ({}) is below batch weight ({}); latency-sensitive queries will count less",
                    interactiveWeight, batchWeight);
        }
        if (Integer.bitCount(maxBucketCount) != 1) {
            log.warn("Max bucket count ({}) is not a power of two; bucket counts will be capped at it", maxBucketCount);
        }
        if (cpuWeight + memoryWeight == 0) {
            log.warn("CPU and memory weights are both zero; resource impact will be neutral for every column");
        }
        if (minResourceMultiplier > 1.0 || maxResourceMultiplier < 1.0) {
            log.warn("Resource multiplier range [{}, {}] does not contain the neutral value 1.0",
                    minResourceMultiplier, maxResourceMultiplier);
        }

        log.debug("Using thresholds - TopN: {}, Interactive: {}ms, HighCardinality: {}, MaxBuckets: {}, Profile: {}",
                topN, interactiveThresholdMs, highCardinalityThreshold, maxBucketCount, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Top N: %d | Interactive < %dms | High cardinality: %d | Max buckets: %d | Skew: %s",
                profileName, topN, interactiveThresholdMs, highCardinalityThreshold, maxBucketCount, skewStatistic);
    }
}
