package org.carball.adapt.script;

import org.carball.adapt.config.ScriptDialect;
import org.carball.adapt.model.recommendation.PartitionField;
import org.carball.adapt.model.recommendation.PartitionRecommendation;
import org.carball.adapt.model.recommendation.PartitionTransform;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders partition recommendations as Iceberg partition DDL for Trino or Spark.
 * The script is text only; nothing here talks to an engine.
 */
public class PartitionScriptGenerator {

    private final ScriptDialect dialect;

    public PartitionScriptGenerator(ScriptDialect dialect) {
        this.dialect = dialect;
    }

    public String generateScript(List<PartitionRecommendation> recommendations) {
        return generateScript(recommendations, Map.of());
    }

    /**
     * @param qualifiedNames fully qualified table name per simple table name; tables
     *                       without an entry are written with their simple name
     */
    public String generateScript(List<PartitionRecommendation> recommendations, Map<String, String> qualifiedNames) {
        StringBuilder script = new StringBuilder();
        script.append(String.format(PartitionScriptTemplate.SCRIPT_HEADER,
                dialect, LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));

        for (PartitionRecommendation recommendation : recommendations) {
            script.append("\n");
            String tableName = qualifiedNames.getOrDefault(recommendation.table(), recommendation.table());
            script.append(generateTableStatements(tableName, recommendation));
        }
        return script.toString();
    }

    String generateTableStatements(String tableName, PartitionRecommendation recommendation) {
        if (recommendation.isEmpty()) {
            return String.format(PartitionScriptTemplate.NO_RECOMMENDATION_TEMPLATE, tableName);
        }

        StringBuilder statements = new StringBuilder();
        statements.append(String.format(PartitionScriptTemplate.TABLE_COMMENT_TEMPLATE, tableName));
        for (PartitionField field : recommendation.fields()) {
            statements.append(String.format(Locale.ROOT, PartitionScriptTemplate.FIELD_COMMENT_TEMPLATE,
                    field.rank(), field.transform().expression(), field.evidence().score()));
        }

        switch (dialect) {
            case SPARK:
                for (PartitionField field : recommendation.fields()) {
                    statements.append(String.format(PartitionScriptTemplate.SPARK_ADD_PARTITION_FIELD_TEMPLATE,
                            tableName, sparkExpression(field.transform())));
                }
                break;
            case TRINO:
            default:
                String fields = recommendation.fields().stream()
                        .map(field -> "'" + trinoExpression(field.transform()) + "'")
                        .collect(Collectors.joining(", "));
                statements.append(String.format(PartitionScriptTemplate.TRINO_SET_PARTITIONING_TEMPLATE,
                        tableName, fields));
                break;
        }
        return statements.toString();
    }

    /**
     * Trino's Iceberg connector uses singular time transforms and a bare column for identity.
     */
    static String trinoExpression(PartitionTransform transform) {
        switch (transform.type()) {
            case DAYS:
                return "day(" + transform.column() + ")";
            case MONTHS:
                return "month(" + transform.column() + ")";
            case YEARS:
                return "year(" + transform.column() + ")";
            case BUCKET:
                return "bucket(" + transform.column() + ", " + transform.bucketCount() + ")";
            default:
                return transform.column();
        }
    }

    /**
     * Spark's Iceberg extensions take the bucket count first.
     */
    static String sparkExpression(PartitionTransform transform) {
        switch (transform.type()) {
            case BUCKET:
                return "bucket(" + transform.bucketCount() + ", " + transform.column() + ")";
            case IDENTITY:
                return transform.column();
            default:
                return transform.expression();
        }
    }
}
