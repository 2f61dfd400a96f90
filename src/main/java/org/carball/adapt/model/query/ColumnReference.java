package org.carball.adapt.model.query;

import org.carball.adapt.model.schema.TableNames;

import java.util.Comparator;

/**
 * A column resolved to the table it belongs to. Both parts are normalized to
 * unquoted lower case so references from different queries compare equal.
 */
public record ColumnReference(String table, String column) implements Comparable<ColumnReference> {

    private static final Comparator<ColumnReference> ORDER = Comparator
            .comparing(ColumnReference::table)
            .thenComparing(ColumnReference::column);

    public static ColumnReference of(String table, String column) {
        return new ColumnReference(TableNames.simpleName(table), TableNames.normalizeIdentifier(column));
    }

    @Override
    public int compareTo(ColumnReference other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
