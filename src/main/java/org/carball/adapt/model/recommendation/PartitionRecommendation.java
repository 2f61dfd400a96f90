package org.carball.adapt.model.recommendation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Recommended partition spec for one table, fields in rank order.
 */
public record PartitionRecommendation(String table, List<PartitionField> fields) {

    public PartitionRecommendation {
        fields = List.copyOf(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<String> transformExpressions() {
        return fields.stream()
                .map(field -> field.transform().expression())
                .collect(Collectors.toList());
    }
}
