package org.carball.adapt.model.analysis;

/**
 * Per-table counters for queries that were skipped or only partly understood.
 */
public record TableDiagnostics(
        int queriesRouted,
        int parseFailures,
        int unresolvedReferences,
        int interactiveQueries,
        int batchQueries,
        int unknownColumnReferences
) {

    public boolean isEmptyCorpus() {
        return queriesRouted - parseFailures <= 0;
    }
}
