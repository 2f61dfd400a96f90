package org.carball.adapt.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
