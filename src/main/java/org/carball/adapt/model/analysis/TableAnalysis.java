package org.carball.adapt.model.analysis;

import org.carball.adapt.model.recommendation.PartitionRecommendation;

import java.util.List;

public record TableAnalysis(
        String table,
        List<ColumnUsageStat> usage,
        List<ColumnScore> scores,
        PartitionRecommendation recommendation,
        TableDiagnostics diagnostics
) {

    public TableAnalysis {
        usage = List.copyOf(usage);
        scores = List.copyOf(scores);
    }
}
