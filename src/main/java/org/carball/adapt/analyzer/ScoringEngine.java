package org.carball.adapt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.config.ScoringWeights;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.analysis.ColumnUsageStat;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.schema.ColumnDescriptor;
import org.carball.adapt.model.schema.TableDescriptor;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines usage, cardinality, resource and skew factors into one ranked score per
 * catalog column:
 * <pre>
 * base * usage^u * cardinality^c * resource^r * skew^s + predicateBonus * predicate/global
 * </pre>
 * Columns seen in queries but missing from the catalog are not scored.
 */
@Slf4j
public class ScoringEngine {

    private static final double NEUTRAL_USAGE = 1.0;

    private final ScoringWeights weights;
    private final CardinalityAnalyzer cardinalityAnalyzer;
    private final DistributionAnalyzer distributionAnalyzer;

    public ScoringEngine(PartitionThresholds thresholds) {
        this(thresholds.getWeights(), new CardinalityAnalyzer(thresholds), new DistributionAnalyzer(thresholds));
    }

    public ScoringEngine(ScoringWeights weights, CardinalityAnalyzer cardinalityAnalyzer,
                         DistributionAnalyzer distributionAnalyzer) {
        this.weights = weights;
        this.cardinalityAnalyzer = cardinalityAnalyzer;
        this.distributionAnalyzer = distributionAnalyzer;
    }

    /**
     * @param usage     usage per column name, from {@link UsageAggregator}
     * @param resources resource multiplier per column name, from {@link ResourceImpactAnalyzer}
     * @return one score per catalog column in ranking order
     */
    public List<ColumnScore> score(TableDescriptor table, Map<String, ColumnUsageStat> usage,
                                   Map<String, FactorResult> resources) {
        String tableName = table.getSimpleName();
        long maxGlobal = table.getColumns().stream()
                .map(ColumnDescriptor::getNormalizedName)
                .map(usage::get)
                .filter(stat -> stat != null)
                .mapToLong(ColumnUsageStat::globalMentions)
                .max()
                .orElse(0L);

        if (maxGlobal == 0) {
            log.debug("No query references catalog columns of {}; usage factor is neutral", tableName);
        }

        return table.getColumns().stream()
                .map(column -> scoreColumn(table, column, usage, resources, maxGlobal))
                .sorted(ColumnScore.RANKING)
                .collect(Collectors.toList());
    }

    private ColumnScore scoreColumn(TableDescriptor table, ColumnDescriptor column,
                                    Map<String, ColumnUsageStat> usage,
                                    Map<String, FactorResult> resources, long maxGlobal) {
        String tableName = table.getSimpleName();
        String columnName = column.getNormalizedName();
        ColumnUsageStat stat = usage.getOrDefault(columnName, ColumnUsageStat.unused(tableName, columnName));

        FactorResult usageFactor = maxGlobal == 0
                ? FactorResult.neutral(NEUTRAL_USAGE, StatisticGap.QUERY_USAGE)
                : FactorResult.of((double) stat.globalMentions() / maxGlobal);
        FactorResult cardinality = cardinalityAnalyzer.analyze(column, table);
        FactorResult skew = distributionAnalyzer.analyze(column.getHistogram());
        FactorResult resource = resources.getOrDefault(columnName,
                FactorResult.neutral(1.0, StatisticGap.RESOURCE_METRICS));

        Set<StatisticGap> gaps = EnumSet.noneOf(StatisticGap.class);
        for (FactorResult factor : List.of(usageFactor, cardinality, skew, resource)) {
            if (factor.isDefaulted()) {
                gaps.add(factor.defaultedFor());
            }
        }

        double product = weights.getBaseWeight()
                * Math.pow(usageFactor.value(), weights.getUsageExponent())
                * Math.pow(cardinality.value(), weights.getCardinalityExponent())
                * Math.pow(resource.value(), weights.getResourceExponent())
                * Math.pow(skew.value(), weights.getSkewExponent());
        double predicateBonus = weights.getPredicateBonusWeight() * stat.predicateRatio();

        return new ColumnScore(tableName, columnName, product + predicateBonus,
                usageFactor.value(), cardinality.value(), skew.value(), resource.value(), predicateBonus,
                stat.globalMentions(), stat.predicateMentions(), gaps);
    }
}
