package org.carball.adapt.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
@Slf4j
public enum AnalysisProfile {

    BALANCED("balanced", "Balanced approach - default settings for most query logs",
            10_000, 2.0, 3),

    INTERACTIVE_FIRST("interactive-first", "Favors columns filtered by short ad hoc queries",
            5_000, 3.0, 3) {
        @Override
        public PartitionThresholds buildThresholds() {
            PartitionThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .weights(base.getWeights().toBuilder()
                            .resourceExponent(1.5)
                            .predicateBonusWeight(0.3)
                            .build())
                    .build();
        }
    },

    BATCH_TOLERANT("batch-tolerant", "Treats long-running ETL queries nearly as important as dashboards",
            60_000, 1.2, 3) {
        @Override
        public PartitionThresholds buildThresholds() {
            PartitionThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .cpuWeight(0.5)
                    .memoryWeight(0.5)
                    .build();
        }
    },

    CONSERVATIVE("conservative", "Recommends only a few well-supported partition columns",
            10_000, 2.0, 2) {
        @Override
        public PartitionThresholds buildThresholds() {
            PartitionThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .minimumScore(0.25)
                    .maxBucketCount(64)
                    .cardinalityDecayAbove(1.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final long interactiveThresholdMs;
    private final double interactiveWeight;
    private final int topN;

    AnalysisProfile(String name, String description, long interactiveThresholdMs,
                    double interactiveWeight, int topN) {
        this.name = name;
        this.description = description;
        this.interactiveThresholdMs = interactiveThresholdMs;
        this.interactiveWeight = interactiveWeight;
        this.topN = topN;
    }

    /**
     * Creates PartitionThresholds based on this profile's settings.
     */
    public PartitionThresholds buildThresholds() {
        return PartitionThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .interactiveThresholdMs(interactiveThresholdMs)
                .interactiveWeight(interactiveWeight)
                .topN(topN)
                .build();
    }

    public static AnalysisProfile fromName(String name) {
        return Arrays.stream(values())
                .filter(profile -> profile.name.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis profile: " + name
                        + ". Available profiles: " + getAvailableProfiles()));
    }

    public static String getAvailableProfiles() {
        return Arrays.stream(values())
                .map(AnalysisProfile::getName)
                .collect(Collectors.joining(", "));
    }
}
