package org.carball.adapt.model.schema;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Catalog metadata and sampled statistics for one column.
 */
@Data
@Builder(toBuilder = true)
public class ColumnDescriptor {
    private String table;
    private String name;
    private String dataType;
    private ColumnType type;
    private Long distinctCount;
    private Map<String, Long> histogram;
    private LocalDate earliest;
    private LocalDate latest;

    public ColumnType getType() {
        return type != null ? type : ColumnType.fromDeclaredType(dataType);
    }

    public boolean hasDistinctCount() {
        return distinctCount != null && distinctCount > 0;
    }

    public boolean hasHistogram() {
        return histogram != null && !histogram.isEmpty();
    }

    public boolean hasTemporalRange() {
        return earliest != null && latest != null;
    }

    public long temporalSpanDays() {
        if (!hasTemporalRange()) {
            return 0;
        }
        return Math.abs(ChronoUnit.DAYS.between(earliest, latest));
    }

    public String getNormalizedName() {
        return TableNames.normalizeIdentifier(name);
    }
}
