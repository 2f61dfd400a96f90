package org.carball.adapt.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public PartitionThresholds loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return overlay(PartitionThresholds.defaults(), args);
    }

    /**
     * Loads configuration from a specific profile.
     */
    public PartitionThresholds loadProfile(String profileName) {
        try {
            AnalysisProfile profile = AnalysisProfile.fromName(profileName);
            PartitionThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public PartitionThresholds loadConfigurationWithProfile(String profileName, String[] args) {
        PartitionThresholds thresholds = overlay(loadProfile(profileName), args);
        log.info("Configuration loaded with profile '{}': {}", profileName, thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads a YAML thresholds file, then overlays env vars and CLI args.
     */
    public PartitionThresholds loadConfigurationFromFile(Path thresholdsFile, String[] args) throws IOException {
        return overlay(readThresholdsFile(thresholdsFile), args);
    }

    /**
     * Reads thresholds from a YAML file. Keys are snake_case; absent keys keep their defaults.
     */
    public PartitionThresholds readThresholdsFile(Path thresholdsFile) throws IOException {
        if (!Files.exists(thresholdsFile)) {
            throw new IOException("Thresholds file not found: " + thresholdsFile);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        PartitionThresholds thresholds = mapper.readValue(thresholdsFile.toFile(), PartitionThresholds.class);
        log.info("Loaded thresholds from {}", thresholdsFile);
        return thresholds;
    }

    private PartitionThresholds overlay(PartitionThresholds base, String[] args) {
        PartitionThresholds.PartitionThresholdsBuilder builder = base.toBuilder();
        ScoringWeights.ScoringWeightsBuilder weights = base.getWeights() != null
                ? base.getWeights().toBuilder()
                : ScoringWeights.builder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder, weights);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, weights, args);

        PartitionThresholds thresholds = builder.weights(weights.build()).build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyEnvironmentVariables(PartitionThresholds.PartitionThresholdsBuilder builder,
                                           ScoringWeights.ScoringWeightsBuilder weights) {
        applyEnvironmentVariable("ADAPT_TOP_N", value -> builder.topN(Integer.parseInt(value)));
        applyEnvironmentVariable("ADAPT_INTERACTIVE_THRESHOLD_MS",
                value -> builder.interactiveThresholdMs(Long.parseLong(value)));
        applyEnvironmentVariable("ADAPT_HIGH_CARDINALITY_THRESHOLD",
                value -> builder.highCardinalityThreshold(Long.parseLong(value)));
        applyEnvironmentVariable("ADAPT_MAX_BUCKET_COUNT", value -> builder.maxBucketCount(Integer.parseInt(value)));
        applyEnvironmentVariable("ADAPT_PARALLELISM", value -> builder.parallelism(Integer.parseInt(value)));
        applyEnvironmentVariable("ADAPT_PREDICATE_BONUS_WEIGHT",
                value -> weights.predicateBonusWeight(Double.parseDouble(value)));
    }

    private void applyEnvironmentVariable(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(PartitionThresholds.PartitionThresholdsBuilder builder,
                                   ScoringWeights.ScoringWeightsBuilder weights, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.top-n":
                        builder.topN(Integer.parseInt(value));
                        break;
                    case "--thresholds.min-score":
                        builder.minimumScore(Double.parseDouble(value));
                        break;
                    case "--thresholds.interactive-ms":
                        builder.interactiveThresholdMs(Long.parseLong(value));
                        break;
                    case "--thresholds.high-cardinality":
                        builder.highCardinalityThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.min-buckets":
                        builder.minBucketCount(Integer.parseInt(value));
                        break;
                    case "--thresholds.max-buckets":
                        builder.maxBucketCount(Integer.parseInt(value));
                        break;
                    case "--thresholds.skew-statistic":
                        builder.skewStatistic(SkewStatistic.fromName(value));
                        break;
                    case "--thresholds.parallelism":
                        builder.parallelism(Integer.parseInt(value));
                        break;
                    case "--weights.usage":
                        weights.usageExponent(Double.parseDouble(value));
                        break;
                    case "--weights.cardinality":
                        weights.cardinalityExponent(Double.parseDouble(value));
                        break;
                    case "--weights.resource":
                        weights.resourceExponent(Double.parseDouble(value));
                        break;
                    case "--weights.skew":
                        weights.skewExponent(Double.parseDouble(value));
                        break;
                    case "--weights.predicate-bonus":
                        weights.predicateBonusWeight(Double.parseDouble(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.top-n <num>              Partition columns recommended per table (default 3)
              --thresholds.min-score <num>          Minimum composite score for a recommended column
              --thresholds.interactive-ms <num>     Queries faster than this are interactive (default 10000)
              --thresholds.high-cardinality <num>   Distinct count above which columns are bucketed
              --thresholds.min-buckets <num>        Smallest bucket count for bucket transforms
              --thresholds.max-buckets <num>        Largest bucket count for bucket transforms
              --thresholds.skew-statistic <name>    top-k-share or gini
              --thresholds.parallelism <num>        Tables analyzed concurrently
              --weights.usage <num>                 Exponent of the usage factor
              --weights.cardinality <num>           Exponent of the cardinality factor
              --weights.resource <num>              Exponent of the resource multiplier
              --weights.skew <num>                  Exponent of the skew factor
              --weights.predicate-bonus <num>       Weight of the predicate usage bonus

            Environment Variables:
              ADAPT_TOP_N                          Same as --thresholds.top-n
              ADAPT_INTERACTIVE_THRESHOLD_MS       Same as --thresholds.interactive-ms
              ADAPT_HIGH_CARDINALITY_THRESHOLD     Same as --thresholds.high-cardinality
              ADAPT_MAX_BUCKET_COUNT               Same as --thresholds.max-buckets
              ADAPT_PARALLELISM                    Same as --thresholds.parallelism
              ADAPT_PREDICATE_BONUS_WEIGHT         Same as --weights.predicate-bonus

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds file, profile defaults or built-in defaults
            """;
    }
}
