package org.carball.adapt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.AnalysisResult;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.analysis.ColumnUsageStat;
import org.carball.adapt.model.analysis.FactorResult;
import org.carball.adapt.model.analysis.TableAnalysis;
import org.carball.adapt.model.analysis.TableDiagnostics;
import org.carball.adapt.model.query.AnalyzedQuery;
import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.ExtractionResult;
import org.carball.adapt.model.query.QueryRecord;
import org.carball.adapt.model.recommendation.PartitionRecommendation;
import org.carball.adapt.model.schema.TableDescriptor;
import org.carball.adapt.parser.PredicateExtractor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Runs the partition advisor pipeline over a query log and a catalog.
 * <p>
 * Every query is extracted and classified once, then routed to the tables it
 * targets. Each catalog table is analyzed independently; a failure in one table is
 * logged and reported in {@link AnalysisResult#failedTables()} without affecting
 * the others.
 */
@Slf4j
public class PartitionAnalyzer {

    private final PartitionThresholds thresholds;
    private final QueryClassifier classifier;
    private final UsageAggregator usageAggregator;
    private final ResourceImpactAnalyzer resourceAnalyzer;
    private final ScoringEngine scoringEngine;
    private final PartitionSpecGenerator specGenerator;

    /**
     * @throws IllegalArgumentException if the thresholds are invalid
     */
    public PartitionAnalyzer(PartitionThresholds thresholds) {
        thresholds.validate();
        this.thresholds = thresholds;
        this.classifier = new QueryClassifier(thresholds);
        this.usageAggregator = new UsageAggregator();
        this.resourceAnalyzer = new ResourceImpactAnalyzer(thresholds);
        this.scoringEngine = new ScoringEngine(thresholds);
        this.specGenerator = new PartitionSpecGenerator(thresholds);

        log.info("Initialized PartitionAnalyzer: {}", thresholds.getConfigurationSummary());
        log.debug("Scoring weights: {}", thresholds.getWeights().getDescription());
    }

    public AnalysisResult analyze(List<QueryRecord> queries, List<TableDescriptor> catalog) {
        log.info("Starting partition analysis of {} queries across {} tables", queries.size(), catalog.size());

        Map<String, TableDescriptor> tables = indexTables(catalog);
        List<AnalyzedQuery> analyzedQueries = extractAndClassify(queries, tables.values());
        int parseFailures = (int) analyzedQueries.stream()
                .filter(query -> query.extraction().isParseFailure())
                .count();

        Map<String, List<AnalyzedQuery>> routed = route(analyzedQueries, tables.keySet());

        Map<String, TableAnalysis> results = new TreeMap<>();
        Map<String, String> failedTables = new TreeMap<>();
        if (thresholds.getParallelism() > 1 && tables.size() > 1) {
            analyzeInParallel(tables, routed, results, failedTables);
        } else {
            for (TableDescriptor table : tables.values()) {
                String name = table.getSimpleName();
                try {
                    results.put(name, analyzeTable(table, routed.getOrDefault(name, List.of())));
                } catch (RuntimeException e) {
                    recordFailure(name, e, failedTables);
                }
            }
        }

        log.info("Analysis complete. {} tables analyzed, {} failed, {} of {} queries could not be parsed",
                results.size(), failedTables.size(), parseFailures, queries.size());

        return new AnalysisResult(new ArrayList<>(results.values()), failedTables, queries.size(), parseFailures);
    }

    /**
     * Runs usage aggregation, resource impact, scoring and spec generation for one table.
     */
    protected TableAnalysis analyzeTable(TableDescriptor table, List<AnalyzedQuery> queries) {
        String name = table.getSimpleName();
        TableDiagnostics diagnostics = diagnose(table, queries);

        if (diagnostics.isEmptyCorpus()) {
            log.info("No usable queries for table {}; scoring from catalog statistics only", name);
        }
        if (diagnostics.parseFailures() > 0 || diagnostics.unresolvedReferences() > 0) {
            log.info("Table {}: {} of {} routed queries unparseable, {} unresolved column references",
                    name, diagnostics.parseFailures(), diagnostics.queriesRouted(), diagnostics.unresolvedReferences());
        }

        Map<String, ColumnUsageStat> usage = usageAggregator.aggregate(name, queries);
        Map<String, FactorResult> resources = resourceAnalyzer.analyze(name, queries, table.getColumnNames());
        List<ColumnScore> scores = scoringEngine.score(table, usage, resources);
        PartitionRecommendation recommendation = specGenerator.generate(table, scores);

        log.debug("Table {}: {} columns scored, recommendation {}",
                name, scores.size(), recommendation.transformExpressions());

        return new TableAnalysis(name, new ArrayList<>(usage.values()), scores, recommendation, diagnostics);
    }

    private Map<String, TableDescriptor> indexTables(List<TableDescriptor> catalog) {
        Map<String, TableDescriptor> tables = new TreeMap<>();
        for (TableDescriptor table : catalog) {
            TableDescriptor previous = tables.putIfAbsent(table.getSimpleName(), table);
            if (previous != null) {
                log.warn("Catalog lists table {} more than once ({} and {}); keeping the first",
                        table.getSimpleName(), previous.getName(), table.getName());
            }
        }
        return tables;
    }

    private List<AnalyzedQuery> extractAndClassify(List<QueryRecord> queries, Collection<TableDescriptor> tables) {
        Map<String, Set<String>> knownColumns = new HashMap<>();
        tables.forEach(table -> knownColumns.put(table.getSimpleName(), table.getColumnNames()));
        PredicateExtractor extractor = new PredicateExtractor(knownColumns);

        List<AnalyzedQuery> analyzed = new ArrayList<>(queries.size());
        for (QueryRecord query : queries) {
            ExtractionResult extraction = extractor.extract(query.sqlText());
            if (extraction.isParseFailure()) {
                log.warn("Failed to parse query {}: {}", query.queryId(), extraction.failureReason());
            }
            analyzed.add(new AnalyzedQuery(query, extraction, classifier.classify(query)));
        }
        return analyzed;
    }

    private Map<String, List<AnalyzedQuery>> route(List<AnalyzedQuery> queries, Set<String> catalogTables) {
        Map<String, List<AnalyzedQuery>> routed = new HashMap<>();
        Map<String, Integer> uncataloged = new TreeMap<>();

        for (AnalyzedQuery query : queries) {
            for (String table : query.routedTables()) {
                if (catalogTables.contains(table)) {
                    routed.computeIfAbsent(table, t -> new ArrayList<>()).add(query);
                } else {
                    uncataloged.merge(table, 1, Integer::sum);
                }
            }
        }

        if (!uncataloged.isEmpty()) {
            log.debug("Queries reference tables missing from the catalog: {}", uncataloged);
        }
        return routed;
    }

    private TableDiagnostics diagnose(TableDescriptor table, List<AnalyzedQuery> queries) {
        String name = table.getSimpleName();
        Set<String> catalogColumns = table.getColumnNames();

        int parseFailures = 0;
        int unresolved = 0;
        int interactive = 0;
        int batch = 0;
        for (AnalyzedQuery query : queries) {
            if (query.extraction().isParseFailure()) {
                parseFailures++;
                continue;
            }
            unresolved += query.extraction().unresolvedReferences();
            if (query.isInteractive()) {
                interactive++;
            } else {
                batch++;
            }
        }

        Set<String> unknownColumns = queries.stream()
                .flatMap(query -> query.referencedColumnsOf(name).stream())
                .map(ColumnReference::column)
                .filter(column -> !catalogColumns.contains(column))
                .collect(Collectors.toSet());
        if (!unknownColumns.isEmpty()) {
            log.debug("Table {}: columns referenced by queries but not in the catalog: {}", name, unknownColumns);
        }

        return new TableDiagnostics(queries.size(), parseFailures, unresolved, interactive, batch,
                unknownColumns.size());
    }

    private void analyzeInParallel(Map<String, TableDescriptor> tables,
                                   Map<String, List<AnalyzedQuery>> routed,
                                   Map<String, TableAnalysis> results,
                                   Map<String, String> failedTables) {
        int poolSize = Math.min(thresholds.getParallelism(), tables.size());
        log.debug("Analyzing {} tables on {} threads", tables.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            Map<String, Future<TableAnalysis>> futures = new LinkedHashMap<>();
            for (TableDescriptor table : tables.values()) {
                String name = table.getSimpleName();
                List<AnalyzedQuery> tableQueries = routed.getOrDefault(name, List.of());
                futures.put(name, executor.submit(() -> analyzeTable(table, tableQueries)));
            }

            for (Map.Entry<String, Future<TableAnalysis>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    recordFailure(entry.getKey(), e.getCause(), failedTables);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Partition analysis was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private void recordFailure(String table, Throwable failure, Map<String, String> failedTables) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        log.error("Analysis of table {} failed: {}", table, message, failure);
        failedTables.put(table, message);
    }
}
