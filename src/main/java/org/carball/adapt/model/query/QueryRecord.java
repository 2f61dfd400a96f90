package org.carball.adapt.model.query;

import java.util.List;

/**
 * Represents a query captured from the engine's query log with execution statistics.
 */
public record QueryRecord(
        String queryId,
        String sqlText,
        double executionTimeMs,
        double cpuTimeMs,
        long peakMemoryBytes,
        List<String> targetTables
) {

    public QueryRecord {
        targetTables = targetTables == null ? List.of() : List.copyOf(targetTables);
    }
}
