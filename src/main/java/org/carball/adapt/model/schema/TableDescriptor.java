package org.carball.adapt.model.schema;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Data
@RequiredArgsConstructor
public class TableDescriptor {
    private final String name;
    private Long rowCount;
    private List<ColumnDescriptor> columns = new ArrayList<>();

    public TableDescriptor(String name, Long rowCount) {
        this.name = name;
        this.rowCount = rowCount;
    }

    public void addColumn(ColumnDescriptor column) {
        columns.add(column);
    }

    public String getSimpleName() {
        return TableNames.simpleName(name);
    }

    public boolean hasRowCount() {
        return rowCount != null && rowCount > 0;
    }

    public ColumnDescriptor findColumn(String columnName) {
        String normalized = TableNames.normalizeIdentifier(columnName);
        return columns.stream()
                .filter(c -> c.getNormalizedName().equals(normalized))
                .findFirst()
                .orElse(null);
    }

    public Set<String> getColumnNames() {
        return columns.stream()
                .map(ColumnDescriptor::getNormalizedName)
                .collect(Collectors.toSet());
    }
}
