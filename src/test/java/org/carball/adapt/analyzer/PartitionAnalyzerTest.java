package org.carball.adapt.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.AnalysisResult;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.analysis.ColumnUsageStat;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.analysis.TableAnalysis;
import org.carball.adapt.model.query.AnalyzedQuery;
import org.carball.adapt.model.query.QueryRecord;
import org.carball.adapt.model.recommendation.PartitionRecommendation;
import org.carball.adapt.model.recommendation.TransformType;
import org.carball.adapt.model.schema.ColumnDescriptor;
import org.carball.adapt.model.schema.TableDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.adapt.analyzer.AnalyzerTestSupport.ordersTable;

class PartitionAnalyzerTest {

    private static final List<QueryRecord> ORDERS_QUERIES = List.of(
            new QueryRecord("q1",
                    "SELECT order_id, total FROM orders WHERE order_date >= '2024-06-01' AND status = 'SHIPPED'",
                    1_200, 800, 100_000_000L, List.of("iceberg.sales.orders")),
            new QueryRecord("q2",
                    "SELECT count(*) FROM orders WHERE order_date BETWEEN '2024-01-01' AND '2024-03-31' AND status = 'PENDING'",
                    800, 600, 50_000_000L, List.of("iceberg.sales.orders")),
            new QueryRecord("q3",
                    "SELECT status, sum(total) FROM orders WHERE order_date > '2023-01-01' AND status <> 'CANCELLED' GROUP BY status",
                    30_000, 20_000, 4_000_000_000L, List.of("iceberg.sales.orders")),
            new QueryRecord("q4",
                    "SELECT c.name, o.total FROM orders o JOIN customers c ON o.customer_id = c.id",
                    45_000, 40_000, 8_000_000_000L, List.of("iceberg.sales.orders")));

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(PartitionAnalyzer.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.INFO);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldRecommendMonthsOfOrderDateThenBucketedCustomerId() {
        // Given
        PartitionAnalyzer analyzer = new PartitionAnalyzer(PartitionThresholds.defaults());

        // When
        AnalysisResult result = analyzer.analyze(ORDERS_QUERIES, List.of(ordersTable()));

        // Then
        TableAnalysis orders = result.findTable("orders");
        assertThat(orders).isNotNull();
        assertThat(orders.scores()).extracting(ColumnScore::column)
                .containsExactly("order_date", "customer_id", "status");

        PartitionRecommendation recommendation = orders.recommendation();
        assertThat(recommendation.fields().get(0).transform().expression()).isEqualTo("months(order_date)");
        assertThat(recommendation.fields().get(1).transform().type()).isEqualTo(TransformType.BUCKET);
        assertThat(recommendation.fields().get(1).column()).isEqualTo("customer_id");
        assertThat(recommendation.fields().get(1).transform().bucketCount()).isBetween(4, 128);
    }

    @Test
    void shouldExcludeNearConstantStatusWhenTopNIsTwo() {
        // Given
        PartitionAnalyzer analyzer = new PartitionAnalyzer(PartitionThresholds.builder().topN(2).build());

        // When
        AnalysisResult result = analyzer.analyze(ORDERS_QUERIES, List.of(ordersTable()));

        // Then
        assertThat(result.findTable("orders").recommendation().transformExpressions())
                .containsExactly("months(order_date)", "bucket(customer_id, 128)");
    }

    @Test
    void shouldScoreSkewedColumnBelowOtherwiseIdenticalUniformColumn() {
        // Given
        TableDescriptor events = new TableDescriptor("events", 1_000_000L);
        events.addColumn(ColumnDescriptor.builder().name("skewed").dataType("varchar").distinctCount(1_000L)
                .histogram(Map.of("a", 900_000L, "b", 40_000L, "c", 30_000L, "d", 20_000L, "e", 10_000L))
                .build());
        events.addColumn(ColumnDescriptor.builder().name("uniform").dataType("varchar").distinctCount(1_000L)
                .histogram(Map.of("a", 200_000L, "b", 200_000L, "c", 200_000L, "d", 200_000L, "e", 200_000L))
                .build());
        List<QueryRecord> queries = List.of(
                new QueryRecord("q1", "SELECT * FROM events WHERE skewed = 'a' AND uniform = 'b'", 100, 10, 10, List.of()));

        // When
        List<ColumnScore> scores = new PartitionAnalyzer(PartitionThresholds.defaults())
                .analyze(queries, List.of(events))
                .findTable("events")
                .scores();

        // Then
        assertThat(scores).extracting(ColumnScore::column).containsExactly("uniform", "skewed");
        assertThat(scores.get(1).score()).isLessThan(scores.get(0).score());
    }

    @Test
    void shouldProduceIdenticalResultsAcrossRunsAndParallelism() {
        // Given
        TableDescriptor customers = new TableDescriptor("customers", 50_000L);
        customers.addColumn(ColumnDescriptor.builder().name("id").dataType("bigint").distinctCount(50_000L).build());
        customers.addColumn(ColumnDescriptor.builder().name("region").dataType("varchar").distinctCount(12L).build());
        List<TableDescriptor> catalog = List.of(ordersTable(), customers);

        // When
        AnalysisResult sequential = new PartitionAnalyzer(PartitionThresholds.defaults()).analyze(ORDERS_QUERIES, catalog);
        AnalysisResult again = new PartitionAnalyzer(PartitionThresholds.defaults()).analyze(ORDERS_QUERIES, catalog);
        AnalysisResult parallel = new PartitionAnalyzer(PartitionThresholds.builder().parallelism(4).build())
                .analyze(ORDERS_QUERIES, catalog);

        // Then
        assertThat(again.recommendations()).isEqualTo(sequential.recommendations());
        assertThat(parallel.recommendations()).isEqualTo(sequential.recommendations());
        assertThat(sequential.tables()).extracting(TableAnalysis::table).containsExactly("customers", "orders");
    }

    @Test
    void shouldRouteQueriesWithoutTargetsToTablesFoundInText() {
        // Given
        List<QueryRecord> queries = List.of(
                new QueryRecord("q1", "SELECT * FROM orders WHERE status = 'OPEN'", 100, 10, 10, List.of()));

        // When
        TableAnalysis orders = new PartitionAnalyzer(PartitionThresholds.defaults())
                .analyze(queries, List.of(ordersTable()))
                .findTable("orders");

        // Then
        assertThat(orders.diagnostics().queriesRouted()).isEqualTo(1);
        assertThat(orders.usage()).extracting(ColumnUsageStat::column).containsExactly("status");
    }

    @Test
    void shouldRecommendFromCatalogStatisticsForEmptyCorpus() {
        // When
        AnalysisResult result = new PartitionAnalyzer(PartitionThresholds.defaults())
                .analyze(List.of(), List.of(ordersTable()));

        // Then
        TableAnalysis orders = result.findTable("orders");
        assertThat(orders.diagnostics().isEmptyCorpus()).isTrue();
        assertThat(orders.recommendation().isEmpty()).isFalse();
        assertThat(orders.recommendation().fields().get(0).column()).isEqualTo("order_date");
        assertThat(orders.scores()).allSatisfy(score ->
                assertThat(score.defaultedStatistics()).contains(StatisticGap.QUERY_USAGE));
        assertThat(logAppender.list).anySatisfy(event ->
                assertThat(event.getFormattedMessage()).contains("No usable queries for table orders"));
    }

    @Test
    void shouldCountAndLogParseFailuresWithoutAborting() {
        // Given
        List<QueryRecord> queries = List.of(
                new QueryRecord("broken", "SELEC FROM WHERE", 100, 10, 10, List.of("orders")),
                ORDERS_QUERIES.get(0));

        // When
        AnalysisResult result = new PartitionAnalyzer(PartitionThresholds.defaults())
                .analyze(queries, List.of(ordersTable()));

        // Then
        assertThat(result.parseFailures()).isEqualTo(1);
        assertThat(result.findTable("orders").diagnostics().parseFailures()).isEqualTo(1);
        assertThat(result.findTable("orders").diagnostics().unknownColumnReferences()).isEqualTo(2);
        assertThat(logAppender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("Failed to parse query broken");
        });
    }

    @Test
    void shouldIsolateFailureOfOneTable() {
        // Given
        TableDescriptor customers = new TableDescriptor("customers", 50_000L);
        customers.addColumn(ColumnDescriptor.builder().name("region").dataType("varchar").distinctCount(12L).build());
        PartitionAnalyzer analyzer = new PartitionAnalyzer(PartitionThresholds.defaults()) {
            @Override
            protected TableAnalysis analyzeTable(TableDescriptor table, List<AnalyzedQuery> queries) {
                if (table.getSimpleName().equals("customers")) {
                    throw new IllegalStateException("statistics unavailable");
                }
                return super.analyzeTable(table, queries);
            }
        };

        // When
        AnalysisResult result = analyzer.analyze(ORDERS_QUERIES, List.of(ordersTable(), customers));

        // Then
        assertThat(result.failedTables()).containsEntry("customers", "statistics unavailable");
        assertThat(result.findTable("orders")).isNotNull();
        assertThat(result.findTable("customers")).isNull();
        assertThat(logAppender.list).anySatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR));
    }

    @Test
    void shouldRejectInvalidConfigurationBeforeAnalysis() {
        assertThatThrownBy(() -> new PartitionAnalyzer(PartitionThresholds.builder().topN(0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("top_n must be positive");
    }
}
