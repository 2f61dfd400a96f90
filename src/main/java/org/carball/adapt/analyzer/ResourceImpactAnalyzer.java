package org.carball.adapt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.query.AnalyzedQuery;
import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.QueryClass;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Credits each query's CPU and memory cost, weighted by its class, to every column
 * it references and maps the per-column totals onto the configured multiplier range.
 */
@Slf4j
public class ResourceImpactAnalyzer {

    private static final double NEUTRAL_MULTIPLIER = 1.0;

    private final double cpuWeight;
    private final double memoryWeight;
    private final double interactiveWeight;
    private final double batchWeight;
    private final double minMultiplier;
    private final double maxMultiplier;

    public ResourceImpactAnalyzer(PartitionThresholds thresholds) {
        this.cpuWeight = thresholds.getCpuWeight();
        this.memoryWeight = thresholds.getMemoryWeight();
        this.interactiveWeight = thresholds.getInteractiveWeight();
        this.batchWeight = thresholds.getBatchWeight();
        this.minMultiplier = thresholds.getMinResourceMultiplier();
        this.maxMultiplier = thresholds.getMaxResourceMultiplier();
    }

    public double classWeight(QueryClass queryClass) {
        return queryClass == QueryClass.INTERACTIVE ? interactiveWeight : batchWeight;
    }

    /**
     * @param table   simple name of the table being analyzed
     * @param queries queries routed to the table
     * @param columns columns to produce multipliers for
     * @return multiplier per requested column, keyed by column name
     */
    public Map<String, FactorResult> analyze(String table, Collection<AnalyzedQuery> queries,
                                             Collection<String> columns) {
        List<AnalyzedQuery> usable = queries.stream()
                .filter(query -> !query.extraction().isParseFailure())
                .collect(Collectors.toList());

        Map<String, Double> impact = rawImpact(table, usable);
        double maxImpact = columns.stream()
                .mapToDouble(column -> impact.getOrDefault(column, 0.0))
                .max()
                .orElse(0.0);

        Map<String, FactorResult> multipliers = new TreeMap<>();
        if (maxImpact <= 0.0) {
            log.debug("No resource impact recorded for table {}; using neutral multiplier", table);
            columns.forEach(column ->
                    multipliers.put(column, FactorResult.neutral(NEUTRAL_MULTIPLIER, StatisticGap.RESOURCE_METRICS)));
            return multipliers;
        }

        for (String column : columns) {
            double share = impact.getOrDefault(column, 0.0) / maxImpact;
            multipliers.put(column, FactorResult.of(minMultiplier + (maxMultiplier - minMultiplier) * share));
        }
        return multipliers;
    }

    /**
     * Unnormalized impact per column. CPU and memory are scaled by the largest
     * value in the corpus so the two measures are comparable.
     */
    Map<String, Double> rawImpact(String table, List<AnalyzedQuery> queries) {
        double maxCpu = queries.stream()
                .mapToDouble(query -> nonNegative(query.query().cpuTimeMs()))
                .max()
                .orElse(0.0);
        double maxMemory = queries.stream()
                .mapToDouble(query -> nonNegative(query.query().peakMemoryBytes()))
                .max()
                .orElse(0.0);

        Map<String, Double> impact = new HashMap<>();
        for (AnalyzedQuery query : queries) {
            double intensity = 0.0;
            if (maxCpu > 0) {
                intensity += cpuWeight * nonNegative(query.query().cpuTimeMs()) / maxCpu;
            }
            if (maxMemory > 0) {
                intensity += memoryWeight * nonNegative(query.query().peakMemoryBytes()) / maxMemory;
            }
            double weighted = intensity * classWeight(query.queryClass());

            for (ColumnReference reference : query.referencedColumnsOf(table)) {
                impact.merge(reference.column(), weighted, Double::sum);
            }
        }
        return impact;
    }

    private static double nonNegative(double value) {
        return Double.isNaN(value) ? 0.0 : Math.max(0.0, value);
    }
}
