package org.carball.adapt.model.recommendation;

import org.carball.adapt.model.analysis.ColumnScore;

/**
 * One chosen partition column with the score that earned it its rank.
 */
public record PartitionField(
        int rank,
        String column,
        PartitionTransform transform,
        ColumnScore evidence,
        String rationale
) {}
