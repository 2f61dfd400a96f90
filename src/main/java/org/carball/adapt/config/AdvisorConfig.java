package org.carball.adapt.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class AdvisorConfig {
    private Path queryLogFile;
    private Path catalogFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String scriptFile;
    private ScriptDialect scriptDialect;
    private boolean verbose;
    private PartitionThresholds thresholds;
}
