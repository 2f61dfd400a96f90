package org.carball.adapt.model.query;

import org.carball.adapt.model.schema.TableNames;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * A query after extraction and classification, ready to be routed to the tables it touches.
 */
public record AnalyzedQuery(
        QueryRecord query,
        ExtractionResult extraction,
        QueryClass queryClass
) {

    /**
     * Tables this query contributes to. Declared target tables win; when the log
     * row carries none, the tables found in the SQL text are used.
     */
    public Set<String> routedTables() {
        if (!query.targetTables().isEmpty()) {
            return query.targetTables().stream()
                    .map(TableNames::simpleName)
                    .collect(Collectors.toSet());
        }
        return extraction.sourceTables();
    }

    public boolean isInteractive() {
        return queryClass == QueryClass.INTERACTIVE;
    }

    public Set<ColumnReference> referencedColumnsOf(String table) {
        return extraction.referencedColumns().stream()
                .filter(ref -> ref.table().equals(table))
                .collect(Collectors.toSet());
    }

    public Set<ColumnReference> predicateColumnsOf(String table) {
        return extraction.predicateColumns().stream()
                .filter(ref -> ref.table().equals(table))
                .collect(Collectors.toSet());
    }
}
