package org.carball.adapt.analyzer;

import org.carball.adapt.model.analysis.ColumnUsageStat;
import org.carball.adapt.model.query.AnalyzedQuery;
import org.carball.adapt.model.query.ColumnReference;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Folds the extraction results routed to one table into a usage statistic per column.
 */
public class UsageAggregator {

    /**
     * @return usage keyed by column name, sorted by name; queries that failed to
     *         parse and references to other tables contribute nothing
     */
    public Map<String, ColumnUsageStat> aggregate(String table, Collection<AnalyzedQuery> queries) {
        return queries.stream()
                .filter(query -> !query.extraction().isParseFailure())
                .flatMap(query -> contributions(table, query))
                .collect(Collectors.toMap(
                        ColumnUsageStat::column,
                        Function.identity(),
                        ColumnUsageStat::combine,
                        TreeMap::new));
    }

    private Stream<ColumnUsageStat> contributions(String table, AnalyzedQuery query) {
        Set<ColumnReference> predicates = query.predicateColumnsOf(table);
        return query.referencedColumnsOf(table).stream()
                .map(ref -> ColumnUsageStat.ofQuery(ref, predicates.contains(ref), query.queryClass()));
    }
}
