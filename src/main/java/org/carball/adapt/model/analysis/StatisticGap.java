package org.carball.adapt.model.analysis;

/**
 * Inputs that were missing and replaced by a neutral default while scoring.
 */
public enum StatisticGap {
    DISTINCT_COUNT,
    ROW_COUNT,
    HISTOGRAM,
    QUERY_USAGE,
    RESOURCE_METRICS
}
