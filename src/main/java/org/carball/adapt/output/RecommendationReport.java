package org.carball.adapt.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.config.PartitionThresholds;
import org.carball.adapt.model.analysis.AnalysisResult;
import org.carball.adapt.model.analysis.ColumnScore;
import org.carball.adapt.model.analysis.StatisticGap;
import org.carball.adapt.model.analysis.TableAnalysis;
import org.carball.adapt.model.analysis.TableDiagnostics;
import org.carball.adapt.model.recommendation.PartitionField;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class RecommendationReport {

    private final AnalysisResult analysisResult;
    private final PartitionThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public RecommendationReport(AnalysisResult analysisResult, PartitionThresholds thresholds) {
        this.analysisResult = analysisResult;
        this.thresholds = thresholds;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Partition Recommendation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Configuration:** ").append(thresholds.getConfigurationSummary()).append("  \n\n");

        // Overview
        md.append("## Analysis Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Queries Analyzed | ").append(analysisResult.totalQueries()).append(" |\n");
        md.append("| Unparseable Queries | ").append(analysisResult.parseFailures()).append(" |\n");
        md.append("| Tables Analyzed | ").append(analysisResult.tables().size()).append(" |\n");
        md.append("| Tables With Recommendations | ").append(analysisResult.tables().stream()
                .filter(table -> !table.recommendation().isEmpty())
                .count()).append(" |\n");
        md.append("| Failed Tables | ").append(analysisResult.failedTables().size()).append(" |\n\n");

        md.append("## Recommendations\n\n");
        if (analysisResult.tables().isEmpty()) {
            md.append("**No tables were analyzed.**\n\n");
        }

        for (TableAnalysis table : analysisResult.tables()) {
            md.append("### ").append(table.table()).append("\n\n");

            if (table.recommendation().isEmpty()) {
                md.append("No column scored high enough to recommend partitioning.\n\n");
            } else {
                md.append("**Partition spec:** `")
                        .append(String.join(", ", table.recommendation().transformExpressions()))
                        .append("`\n\n");
                md.append("| Rank | Transform | Score | Rationale |\n");
                md.append("|------|-----------|-------|-----------|\n");
                for (PartitionField field : table.recommendation().fields()) {
                    md.append("| ").append(field.rank())
                            .append(" | `").append(field.transform().expression()).append("`")
                            .append(" | ").append(format(field.evidence().score()))
                            .append(" | ").append(field.rationale()).append(" |\n");
                }
                md.append("\n");
            }

            md.append("#### Column Scores\n\n");
            md.append("| Column | Score | Usage | Cardinality | Skew | Resource | Predicate Bonus | Queries | In Predicates |\n");
            md.append("|--------|-------|-------|-------------|------|----------|-----------------|---------|---------------|\n");
            for (ColumnScore score : table.scores()) {
                md.append("| ").append(score.column())
                        .append(" | ").append(format(score.score()))
                        .append(" | ").append(format(score.usageFactor()))
                        .append(" | ").append(format(score.cardinalityFactor()))
                        .append(" | ").append(format(score.skewFactor()))
                        .append(" | ").append(format(score.resourceMultiplier()))
                        .append(" | ").append(format(score.predicateBonus()))
                        .append(" | ").append(score.globalMentions())
                        .append(" | ").append(score.predicateMentions()).append(" |\n");
            }
            md.append("\n");

            TableDiagnostics diagnostics = table.diagnostics();
            md.append("*Queries routed: ").append(diagnostics.queriesRouted())
                    .append(" (").append(diagnostics.interactiveQueries()).append(" interactive, ")
                    .append(diagnostics.batchQueries()).append(" batch), unparseable: ")
                    .append(diagnostics.parseFailures()).append(", unresolved column references: ")
                    .append(diagnostics.unresolvedReferences()).append("*\n\n");
        }

        if (!analysisResult.failedTables().isEmpty()) {
            md.append("## Failed Tables\n\n");
            analysisResult.failedTables().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> md.append("- **").append(entry.getKey()).append("**: ")
                            .append(entry.getValue()).append("\n"));
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Scores are heuristics. Validate recommended specs against representative workloads before applying them.*\n");

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setAnalysisMetadata(new AnalysisMetadata(
                timestamp,
                thresholds.getProfileName(),
                thresholds.getWeights().getDescription(),
                analysisResult.totalQueries(),
                analysisResult.parseFailures(),
                analysisResult.tables().size()
        ));

        report.setTables(analysisResult.tables().stream()
                .map(this::toTableReport)
                .collect(Collectors.toList()));

        if (!analysisResult.failedTables().isEmpty()) {
            report.setFailedTables(analysisResult.failedTables());
        }
        return report;
    }

    private TableReport toTableReport(TableAnalysis analysis) {
        TableReport table = new TableReport();
        table.setTable(analysis.table());
        table.setPartitionSpec(analysis.recommendation().transformExpressions());
        table.setFields(analysis.recommendation().fields().stream()
                .map(field -> {
                    FieldReport report = new FieldReport();
                    report.setRank(field.rank());
                    report.setColumn(field.column());
                    report.setTransform(field.transform().expression());
                    report.setScore(field.evidence().score());
                    report.setRationale(field.rationale());
                    return report;
                })
                .collect(Collectors.toList()));
        table.setScores(analysis.scores().stream()
                .map(score -> {
                    ScoreReport report = new ScoreReport();
                    report.setColumn(score.column());
                    report.setScore(score.score());
                    report.setUsageFactor(score.usageFactor());
                    report.setCardinalityFactor(score.cardinalityFactor());
                    report.setSkewFactor(score.skewFactor());
                    report.setResourceMultiplier(score.resourceMultiplier());
                    report.setPredicateBonus(score.predicateBonus());
                    report.setGlobalMentions(score.globalMentions());
                    report.setPredicateMentions(score.predicateMentions());
                    if (!score.defaultedStatistics().isEmpty()) {
                        report.setDefaultedStatistics(score.defaultedStatistics().stream()
                                .sorted()
                                .map(StatisticGap::name)
                                .collect(Collectors.toList()));
                    }
                    return report;
                })
                .collect(Collectors.toList()));
        table.setDiagnostics(analysis.diagnostics());
        return table;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private AnalysisMetadata analysisMetadata;
        private List<TableReport> tables;
        private Map<String, String> failedTables;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class AnalysisMetadata {
        private LocalDateTime timestamp;
        private String profile;
        private String scoringWeights;
        private int totalQueries;
        private int parseFailures;
        private int tablesAnalyzed;
    }

    @lombok.Data
    private static class TableReport {
        private String table;
        private List<String> partitionSpec;
        private List<FieldReport> fields;
        private List<ScoreReport> scores;
        private TableDiagnostics diagnostics;
    }

    @lombok.Data
    private static class FieldReport {
        private int rank;
        private String column;
        private String transform;
        private double score;
        private String rationale;
    }

    @lombok.Data
    private static class ScoreReport {
        private String column;
        private double score;
        private double usageFactor;
        private double cardinalityFactor;
        private double skewFactor;
        private double resourceMultiplier;
        private double predicateBonus;
        private long globalMentions;
        private long predicateMentions;
        private List<String> defaultedStatistics;
    }
}
