package org.carball.adapt.model.analysis;

import org.carball.adapt.model.recommendation.PartitionRecommendation;
import org.carball.adapt.model.schema.TableNames;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one analysis run. Tables whose analysis failed are listed in
 * {@code failedTables} with the failure message and are absent from {@code tables}.
 */
public record AnalysisResult(
        List<TableAnalysis> tables,
        Map<String, String> failedTables,
        int totalQueries,
        int parseFailures
) {

    public AnalysisResult {
        tables = List.copyOf(tables);
        failedTables = Map.copyOf(failedTables);
    }

    public List<PartitionRecommendation> recommendations() {
        return tables.stream()
                .map(TableAnalysis::recommendation)
                .collect(Collectors.toList());
    }

    public TableAnalysis findTable(String name) {
        String simpleName = TableNames.simpleName(name);
        return tables.stream()
                .filter(t -> TableNames.simpleName(t.table()).equals(simpleName))
                .findFirst()
                .orElse(null);
    }
}
