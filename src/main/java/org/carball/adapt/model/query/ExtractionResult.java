package org.carball.adapt.model.query;

import java.util.Set;

/**
 * Outcome of extracting column references from one query's SQL text.
 * Either {@link Status#RESOLVED} with the references found, or
 * {@link Status#PARSE_FAILURE} with the parser's reason and no references.
 */
public record ExtractionResult(
        Status status,
        Set<String> sourceTables,
        Set<ColumnReference> predicateColumns,
        Set<ColumnReference> referencedColumns,
        int unresolvedReferences,
        String failureReason
) {

    public enum Status {
        RESOLVED,
        PARSE_FAILURE
    }

    public ExtractionResult {
        sourceTables = Set.copyOf(sourceTables);
        predicateColumns = Set.copyOf(predicateColumns);
        referencedColumns = Set.copyOf(referencedColumns);
    }

    public static ExtractionResult resolved(Set<String> sourceTables,
                                            Set<ColumnReference> predicateColumns,
                                            Set<ColumnReference> referencedColumns,
                                            int unresolvedReferences) {
        return new ExtractionResult(Status.RESOLVED, sourceTables, predicateColumns,
                referencedColumns, unresolvedReferences, null);
    }

    public static ExtractionResult empty() {
        return resolved(Set.of(), Set.of(), Set.of(), 0);
    }

    public static ExtractionResult parseFailure(String reason) {
        return new ExtractionResult(Status.PARSE_FAILURE, Set.of(), Set.of(), Set.of(), 0, reason);
    }

    public boolean isParseFailure() {
        return status == Status.PARSE_FAILURE;
    }
}
