package org.carball.adapt.model.query;

public enum QueryClass {
    INTERACTIVE,
    BATCH
}
