package org.carball.adapt.model.recommendation;

import lombok.Getter;

@Getter
public enum TransformType {
    DAYS("days"),
    MONTHS("months"),
    YEARS("years"),
    BUCKET("bucket"),
    IDENTITY("identity");

    private final String functionName;

    TransformType(String functionName) {
        this.functionName = functionName;
    }

    public boolean isTemporal() {
        return this == DAYS || this == MONTHS || this == YEARS;
    }
}
