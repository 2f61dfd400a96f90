package org.carball.adapt.analyzer;

import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.config.ScoringWeights;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.analysis.ColumnUsageStat;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.QueryClass;
import org.carball.adapt.model.schema.TableDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private static ColumnUsageStat usage(String column, int predicate, int selectOnly) {
        ColumnUsageStat stat = ColumnUsageStat.unused("t", column);
        for (int i = 0; i < predicate; i++) {
            stat = stat.combine(ColumnUsageStat.ofQuery(new ColumnReference("t", column), true, QueryClass.INTERACTIVE));
        }
        for (int i = 0; i < selectOnly; i++) {
            stat = stat.combine(ColumnUsageStat.ofQuery(new ColumnReference("t", column), false, QueryClass.BATCH));
        }
        return stat;
    }

    private static TableDescriptor table(long rows) {
        TableDescriptor table = new TableDescriptor("t", rows);
        table.addColumn(AnalyzerTestSupport.column("a", "varchar", 1_000L));
        table.addColumn(AnalyzerTestSupport.column("b", "varchar", 1_000L));
        return table;
    }

    @Test
    void shouldCombineFactorsWithConfiguredWeights() {
        // Given
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());
        Map<String, ColumnUsageStat> usage = Map.of("a", usage("a", 4, 0), "b", usage("b", 1, 1));
        Map<String, FactorResult> resources = Map.of("a", FactorResult.of(1.5), "b", FactorResult.of(0.5));

        // When
        List<ColumnScore> scores = engine.score(table(1_000_000L), usage, resources);

        // Then
        assertThat(scores).extracting(ColumnScore::column).containsExactly("a", "b");
        ColumnScore a = scores.get(0);
        assertThat(a.usageFactor()).isEqualTo(1.0);
        assertThat(a.cardinalityFactor()).isEqualTo(1.0);
        assertThat(a.skewFactor()).isEqualTo(1.0);
        assertThat(a.predicateBonus()).isCloseTo(0.2, within(1e-12));
        assertThat(a.score()).isCloseTo(1.5 + 0.2, within(1e-12));

        ColumnScore b = scores.get(1);
        assertThat(b.usageFactor()).isCloseTo(0.5, within(1e-12));
        assertThat(b.score()).isCloseTo(0.5 * 0.5 + 0.2 * 0.5, within(1e-12));
        assertThat(b.defaultedStatistics()).containsExactly(StatisticGap.HISTOGRAM);
    }

    @Test
    void shouldRemoveFactorWhenItsExponentIsZero() {
        // Given - only the resource multiplier differs between the columns
        ScoringWeights onlyResourceIgnored = ScoringWeights.builder()
                .resourceExponent(0.0)
                .predicateBonusWeight(0.0)
                .build();
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.builder().weights(onlyResourceIgnored).build());
        Map<String, ColumnUsageStat> usage = Map.of("a", usage("a", 2, 0), "b", usage("b", 2, 0));
        Map<String, FactorResult> resources = Map.of("a", FactorResult.of(1.5), "b", FactorResult.of(0.5));

        // When
        List<ColumnScore> scores = engine.score(table(1_000_000L), usage, resources);

        // Then
        assertThat(scores.get(0).score()).isEqualTo(scores.get(1).score());
        assertThat(scores).extracting(ColumnScore::column).containsExactly("a", "b");
    }

    @Test
    void shouldBreakTiesByPredicateCountThenName() {
        // Given
        ScoringWeights noBonus = ScoringWeights.builder().predicateBonusWeight(0.0).build();
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.builder().weights(noBonus).build());
        TableDescriptor table = new TableDescriptor("t", 1_000_000L);
        table.addColumn(AnalyzerTestSupport.column("z", "varchar", 1_000L));
        table.addColumn(AnalyzerTestSupport.column("y", "varchar", 1_000L));
        table.addColumn(AnalyzerTestSupport.column("x", "varchar", 1_000L));
        Map<String, ColumnUsageStat> usage = Map.of(
                "z", usage("z", 2, 0),
                "y", usage("y", 0, 2),
                "x", usage("x", 0, 2));

        // When
        List<ColumnScore> scores = engine.score(table, usage, Map.of());

        // Then
        assertThat(scores).extracting(ColumnScore::column).containsExactly("z", "x", "y");
    }

    @Test
    void shouldScoreUnreferencedCatalogColumnsWithZeroUsage() {
        // Given
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());

        // When
        List<ColumnScore> scores = engine.score(table(1_000_000L), Map.of("a", usage("a", 1, 0)), Map.of());

        // Then
        ColumnScore b = scores.get(1);
        assertThat(b.column()).isEqualTo("b");
        assertThat(b.usageFactor()).isZero();
        assertThat(b.score()).isZero();
    }

    @Test
    void shouldNotScoreColumnsMissingFromCatalog() {
        // Given
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());
        Map<String, ColumnUsageStat> usage = Map.of("a", usage("a", 1, 0), "ghost", usage("ghost", 9, 0));

        // When
        List<ColumnScore> scores = engine.score(table(1_000_000L), usage, Map.of());

        // Then
        assertThat(scores).extracting(ColumnScore::column).containsExactly("a", "b");
        assertThat(scores.get(0).usageFactor()).isEqualTo(1.0);
    }

    @Test
    void shouldUseNeutralUsageForEmptyCorpus() {
        // Given
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());

        // When
        List<ColumnScore> scores = engine.score(table(1_000_000L), Map.of(), Map.of());

        // Then
        assertThat(scores).allSatisfy(score -> {
            assertThat(score.usageFactor()).isEqualTo(1.0);
            assertThat(score.defaultedStatistics())
                    .contains(StatisticGap.QUERY_USAGE, StatisticGap.RESOURCE_METRICS);
            assertThat(score.score()).isPositive();
        });
    }

    @Test
    void shouldScoreSkewedLowCardinalityColumnBelowUniformOne() {
        // Given - identical usage and cardinality, three values each
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());
        TableDescriptor table = new TableDescriptor("t", 1_000L);
        table.addColumn(AnalyzerTestSupport.histogramColumn("skewed", Map.of("a", 900L, "b", 50L, "c", 50L)));
        table.addColumn(AnalyzerTestSupport.histogramColumn("uniform", Map.of("a", 340L, "b", 330L, "c", 330L)));
        Map<String, ColumnUsageStat> usage = Map.of("skewed", usage("skewed", 1, 0), "uniform", usage("uniform", 1, 0));

        // When
        List<ColumnScore> scores = engine.score(table, usage, Map.of());

        // Then
        assertThat(scores).extracting(ColumnScore::column).containsExactly("uniform", "skewed");
        assertThat(scores.get(1).skewFactor()).isLessThan(scores.get(0).skewFactor());
        assertThat(scores.get(1).score()).isLessThan(scores.get(0).score());
    }

    @Test
    void shouldDescribeFactorBreakdown() {
        // Given
        ScoringEngine engine = new ScoringEngine(PartitionThresholds.defaults());

        // When
        ColumnScore score = engine.score(table(1_000_000L), Map.of("a", usage("a", 1, 0)), Map.of()).get(0);

        // Then
        assertThat(score.describe())
                .contains("usage=1.000", "cardinality=1.000", "predicate bonus=0.200")
                .contains("defaults used for histogram, resource_metrics");
    }
}
