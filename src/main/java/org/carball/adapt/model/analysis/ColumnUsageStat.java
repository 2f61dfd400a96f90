package org.carball.adapt.model.analysis;

import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.QueryClass;

/**
 * Usage counts for one column across a table's query corpus. Counts are per
 * distinct query, so a column mentioned several times in one query counts once.
 */
public record ColumnUsageStat(
        String table,
        String column,
        long globalMentions,
        long predicateMentions,
        long interactiveMentions,
        long batchMentions
) {

    public ColumnUsageStat {
        if (predicateMentions > globalMentions) {
            throw new IllegalArgumentException(String.format(
                    "Predicate mentions (%d) exceed global mentions (%d) for %s.%s",
                    predicateMentions, globalMentions, table, column));
        }
        if (interactiveMentions + batchMentions != globalMentions) {
            throw new IllegalArgumentException(String.format(
                    "Interactive (%d) and batch (%d) mentions do not sum to global mentions (%d) for %s.%s",
                    interactiveMentions, batchMentions, globalMentions, table, column));
        }
    }

    /**
     * Contribution of a single query that references the column.
     */
    public static ColumnUsageStat ofQuery(ColumnReference reference, boolean inPredicate, QueryClass queryClass) {
        boolean interactive = queryClass == QueryClass.INTERACTIVE;
        return new ColumnUsageStat(reference.table(), reference.column(), 1,
                inPredicate ? 1 : 0,
                interactive ? 1 : 0,
                interactive ? 0 : 1);
    }

    public static ColumnUsageStat unused(String table, String column) {
        return new ColumnUsageStat(table, column, 0, 0, 0, 0);
    }

    public ColumnUsageStat combine(ColumnUsageStat other) {
        if (!table.equals(other.table) || !column.equals(other.column)) {
            throw new IllegalArgumentException("Cannot combine usage of " + table + "." + column
                    + " with " + other.table + "." + other.column);
        }
        return new ColumnUsageStat(table, column,
                globalMentions + other.globalMentions,
                predicateMentions + other.predicateMentions,
                interactiveMentions + other.interactiveMentions,
                batchMentions + other.batchMentions);
    }

    public double predicateRatio() {
        return globalMentions == 0 ? 0.0 : (double) predicateMentions / globalMentions;
    }
}
