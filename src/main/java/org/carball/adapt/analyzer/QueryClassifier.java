package org.carball.adapt.analyzer;

import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.query.QueryClass;
import org.carball.adapt.model.query.QueryRecord;

/**
 * Labels queries interactive or batch by execution time. A missing or negative
 * execution time counts as zero, so such queries are interactive.
 */
public class QueryClassifier {

    private final long interactiveThresholdMs;

    public QueryClassifier(PartitionThresholds thresholds) {
        this.interactiveThresholdMs = thresholds.getInteractiveThresholdMs();
    }

    public QueryClass classify(QueryRecord query) {
        return classify(query.executionTimeMs());
    }

    public QueryClass classify(double executionTimeMs) {
        double elapsed = Double.isNaN(executionTimeMs) ? 0.0 : Math.max(0.0, executionTimeMs);
        return elapsed < interactiveThresholdMs ? QueryClass.INTERACTIVE : QueryClass.BATCH;
    }
}
