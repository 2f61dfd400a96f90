package org.carball.adapt.model.analysis;

import java.util.Comparator;
import java.util.Locale;
import java.util.Set;

/**
 * Composite partition-suitability score for one column with the factor values
 * that produced it.
 */
public record ColumnScore(
        String table,
        String column,
        double score,
        double usageFactor,
        double cardinalityFactor,
        double skewFactor,
        double resourceMultiplier,
        double predicateBonus,
        long globalMentions,
        long predicateMentions,
        Set<StatisticGap> defaultedStatistics
) {

    /**
     * Score descending, then predicate mentions descending, then column name.
     */
    public static final Comparator<ColumnScore> RANKING = Comparator
            .comparingDouble(ColumnScore::score).reversed()
            .thenComparing(Comparator.comparingLong(ColumnScore::predicateMentions).reversed())
            .thenComparing(ColumnScore::column);

    public ColumnScore {
        defaultedStatistics = Set.copyOf(defaultedStatistics);
    }

    public String describe() {
        String breakdown = String.format(Locale.ROOT,
                "usage=%.3f x cardinality=%.3f x resource=%.3f x skew=%.3f + predicate bonus=%.3f = %.4f"
                        + " (%d queries, %d in predicates)",
                usageFactor, cardinalityFactor, resourceMultiplier, skewFactor, predicateBonus, score,
                globalMentions, predicateMentions);
        if (defaultedStatistics.isEmpty()) {
            return breakdown;
        }
        return breakdown + "; defaults used for " + defaultedStatistics.stream()
                .sorted()
                .map(gap -> gap.name().toLowerCase(Locale.ROOT))
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
    }
}
