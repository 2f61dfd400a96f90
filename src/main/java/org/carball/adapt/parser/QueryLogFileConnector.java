package org.carball.adapt.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.model.query.QueryRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads query history from an exported query log instead of connecting to the engine.
 * <pre>
 * {"export_metadata": {"source": ..., "export_timestamp": ..., "total_queries": ...},
 *  "queries": [{"query_id": ..., "query": ..., "execution_time_ms": ..., "cpu_time_ms": ...,
 *               "peak_memory_bytes": ..., "target_tables": [...]}]}
 * </pre>
 */
@Slf4j
public class QueryLogFileConnector {

    private final JsonNode exportData;

    public QueryLogFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Query log export file not found: " + path);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
    }

    /**
     * Extracts all queries from the export, in file order.
     */
    public List<QueryRecord> getAllQueries() {
        List<QueryRecord> results = new ArrayList<>();
        for (JsonNode queryNode : exportData.get("queries")) {
            results.add(parseQueryFromJson(queryNode));
        }
        log.debug("Loaded {} queries from query log export", results.size());
        return results;
    }

    /**
     * Gets total number of queries, from the metadata when present.
     */
    public int getQueryCount() {
        JsonNode totalQueries = exportData.get("export_metadata").get("total_queries");
        if (totalQueries != null && totalQueries.canConvertToInt()) {
            return totalQueries.asInt();
        }
        return exportData.get("queries").size();
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("source").asText(),
                metadata.get("export_timestamp").asText(),
                getQueryCount()
        );
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in query log export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null || !metadata.isObject()) {
            throw new IllegalStateException("Missing export_metadata section in query log export file");
        }

        JsonNode queries = exportData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in query log export file");
        }

        String[] requiredFields = {"source", "export_timestamp"};
        for (String field : requiredFields) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }
    }

    private QueryRecord parseQueryFromJson(JsonNode queryNode) {
        JsonNode queryId = queryNode.get("query_id");
        JsonNode sqlText = queryNode.has("query") ? queryNode.get("query") : queryNode.get("sql_text");
        if (queryId == null || sqlText == null) {
            throw new IllegalStateException("Query entry is missing query_id or query: " + queryNode);
        }

        List<String> targetTables = new ArrayList<>();
        JsonNode tables = queryNode.get("target_tables");
        if (tables != null && tables.isArray()) {
            tables.forEach(table -> targetTables.add(table.asText()));
        }

        return new QueryRecord(
                queryId.asText(),
                sqlText.asText(),
                queryNode.path("execution_time_ms").asDouble(-1),
                queryNode.path("cpu_time_ms").asDouble(0),
                queryNode.path("peak_memory_bytes").asLong(0),
                targetTables
        );
    }

    /**
     * Metadata about the query log export.
     */
    public record ExportMetadata(String source, String exportTimestamp, int totalQueries) {

        @Override
        public String toString() {
            return String.format("ExportMetadata{source='%s', timestamp='%s', queries=%d}",
                    source, exportTimestamp, totalQueries);
        }
    }
}
