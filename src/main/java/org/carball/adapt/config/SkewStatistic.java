package org.carball.adapt.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Concentration statistic used to turn a value-frequency histogram into a skew measure.
 */
public enum SkewStatistic {
    /** Excess share of rows held by the k most frequent values over a uniform split. */
    TOP_K_SHARE,
    /** Normalized Gini coefficient of the value frequencies. */
    GINI;

    @JsonCreator
    public static SkewStatistic fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
