package org.carball.adapt.model.analysis;

/**
 * A bounded scoring factor, optionally tagged with the statistic whose absence
 * forced the neutral default.
 */
public record FactorResult(double value, StatisticGap defaultedFor) {

    public static FactorResult of(double value) {
        return new FactorResult(value, null);
    }

    public static FactorResult neutral(double value, StatisticGap gap) {
        return new FactorResult(value, gap);
    }

    public boolean isDefaulted() {
        return defaultedFor != null;
    }
}
