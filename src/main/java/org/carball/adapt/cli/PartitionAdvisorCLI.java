package org.carball.adapt.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.analyzer.PartitionAnalyzer;
import org.carball.adapt.config.AdvisorConfig;
import org.carball.adapt.config.AnalysisProfile;
import org.carball.adapt.config.ConfigurationLoader;
import org.carball.adapt.config.OutputFormat;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.config.ScriptDialect;
import org.carball.adapt.model.analysis.AnalysisResult;
import org.carball.adapt.model.analysis.TableAnalysis;
import org.carball.adapt.model.query.QueryRecord;
import org.carball.adapt.model.schema.TableDescriptor;
import org.carball.adapt.output.RecommendationReport;
import org.carball.adapt.parser.CatalogFileConnector;
import org.carball.adapt.parser.QueryLogFileConnector;
import org.carball.adapt.script.PartitionScriptGenerator;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class PartitionAdvisorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            Adaptive Partition Advisor v%s                  ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 2 && !isHelpRequested(args) ? 1 : 0);
        }

        try {
            AdvisorConfig config = parseArgs(args, new ConfigurationLoader());
            if (config.isVerbose()) {
                enableVerboseLogging();
            }

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Query log: " + config.getQueryLogFile());
            System.out.println("   Catalog: " + config.getCatalogFile());
            System.out.println("   " + config.getThresholds().getConfigurationSummary());
            System.out.println();

            System.out.print("📥 Loading query log and catalog... ");
            QueryLogFileConnector queryLog = new QueryLogFileConnector(config.getQueryLogFile());
            List<QueryRecord> queries = queryLog.getAllQueries();
            List<TableDescriptor> catalog = new CatalogFileConnector(config.getCatalogFile()).getTables();
            System.out.println("✓");
            if (config.isVerbose()) {
                System.out.println("     - " + queryLog.getExportMetadata());
                System.out.println("     - Loaded " + queries.size() + " queries and " + catalog.size() + " tables");
            }

            System.out.print("📊 Scoring partition candidates... ");
            PartitionAnalyzer analyzer = new PartitionAnalyzer(config.getThresholds());
            AnalysisResult result = analyzer.analyze(queries, catalog);
            System.out.println("✓");

            if (config.getScriptFile() != null) {
                System.out.print("🏗️ Generating partition DDL script... ");
                writeScript(result, catalog, config);
                System.out.println("✓");
            }

            System.out.print("📝 Writing results... ");
            outputResults(result, config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Analysis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }
            if (config.getScriptFile() != null) {
                System.out.println("   Script file: " + config.getScriptFile());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar adapt-partition-advisor.jar <query-log-file> <catalog-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  query-log-file      JSON export of the engine's query history");
        System.out.println("  catalog-file        Table and column statistics (.json, .yml or .yaml)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for recommendations (default: partition-recommendations.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --profile           Analysis profile: " + AnalysisProfile.getAvailableProfiles());
        System.out.println("  --thresholds        YAML file with custom analysis thresholds");
        System.out.println("  --script            Write partition DDL to this file");
        System.out.println("  --dialect           DDL dialect for --script: trino|spark (default: trino)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println("Examples:");
        System.out.println("  # Basic analysis");
        System.out.println("  java -jar adapt-partition-advisor.jar query-log.json catalog.yml");
        System.out.println();
        System.out.println("  # Markdown and JSON report with a Trino script");
        System.out.println("  java -jar adapt-partition-advisor.jar query-log.json catalog.yml -f both --script partitions.sql");
        System.out.println();
        System.out.println("  # Favor dashboard queries and recommend at most two columns");
        System.out.println("  java -jar adapt-partition-advisor.jar query-log.json catalog.yml --profile interactive-first --thresholds.top-n 2");
    }

    static AdvisorConfig parseArgs(String[] args, ConfigurationLoader loader) throws IOException {
        AdvisorConfig config = new AdvisorConfig();
        config.setQueryLogFile(Paths.get(args[0]));
        config.setCatalogFile(Paths.get(args[1]));

        // Set defaults
        config.setOutputFile("partition-recommendations.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setScriptDialect(ScriptDialect.TRINO);
        config.setVerbose(false);

        String profileName = null;
        String thresholdsFile = null;

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--thresholds.") || arg.startsWith("--weights.")) {
                // Applied by ConfigurationLoader
                requireValue(args, i, "Value not specified for " + arg);
                i++;
                continue;
            }

            switch (arg) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                    profileName = requireValue(args, i++, "Profile name not specified");
                    break;

                case "--thresholds":
                    thresholdsFile = requireValue(args, i++, "Thresholds file not specified");
                    break;

                case "--script":
                    config.setScriptFile(requireValue(args, i++, "Script file not specified"));
                    break;

                case "--dialect":
                    String dialect = requireValue(args, i++, "Script dialect not specified");
                    try {
                        config.setScriptDialect(ScriptDialect.valueOf(dialect.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid script dialect. Use: trino or spark");
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);

        config.setThresholds(loadThresholds(loader, profileName, thresholdsFile, args));
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static PartitionThresholds loadThresholds(ConfigurationLoader loader, String profileName,
                                                      String thresholdsFile, String[] args) throws IOException {
        if (thresholdsFile != null) {
            if (profileName != null) {
                log.warn("Both --thresholds and --profile given; using thresholds file {}", thresholdsFile);
            }
            return loader.loadConfigurationFromFile(Paths.get(thresholdsFile), args);
        }
        if (profileName != null) {
            return loader.loadConfigurationWithProfile(profileName, args);
        }
        return loader.loadConfiguration(args);
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(AdvisorConfig config) {
        if (!Files.exists(config.getQueryLogFile())) {
            throw new IllegalArgumentException("Query log file not found: " + config.getQueryLogFile());
        }
        if (!Files.exists(config.getCatalogFile())) {
            throw new IllegalArgumentException("Catalog file not found: " + config.getCatalogFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
        if (config.getScriptFile() != null) {
            Path scriptDir = Paths.get(config.getScriptFile()).getParent();
            if (scriptDir != null && !Files.exists(scriptDir)) {
                throw new IllegalArgumentException("Script directory does not exist: " + scriptDir);
            }
        }
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.adapt");
        logger.setLevel(Level.DEBUG);
    }

    private static void writeScript(AnalysisResult result, List<TableDescriptor> catalog,
                                    AdvisorConfig config) throws IOException {
        Map<String, String> qualifiedNames = catalog.stream()
                .collect(Collectors.toMap(TableDescriptor::getSimpleName, TableDescriptor::getName,
                        (first, second) -> first));
        PartitionScriptGenerator generator = new PartitionScriptGenerator(config.getScriptDialect());
        Files.writeString(Paths.get(config.getScriptFile()),
                generator.generateScript(result.recommendations(), qualifiedNames));
    }

    private static void outputResults(AnalysisResult result, AdvisorConfig config) throws IOException {
        RecommendationReport report = new RecommendationReport(result, config.getThresholds());
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(AnalysisResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nQueries analyzed: " + result.totalQueries());
        System.out.println("Unparseable queries: " + result.parseFailures());
        System.out.println("Tables analyzed: " + result.tables().size());

        System.out.println("\n🎯 Recommended Partition Specs:");
        System.out.println("-".repeat(60));
        for (TableAnalysis table : result.tables()) {
            if (table.recommendation().isEmpty()) {
                System.out.printf("%-25s (no suitable columns)%n", table.table());
            } else {
                System.out.printf("%-25s %s%n", table.table(),
                        String.join(", ", table.recommendation().transformExpressions()));
            }
        }

        if (!result.failedTables().isEmpty()) {
            System.out.println("\n⚠️ Tables that could not be analyzed:");
            result.failedTables().forEach((table, reason) -> System.out.println("  - " + table + ": " + reason));
        }
    }
}
