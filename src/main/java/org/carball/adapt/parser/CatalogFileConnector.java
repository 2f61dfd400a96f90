package org.carball.adapt.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.adapt.model.schema.ColumnDescriptor;
import org.carball.adapt.model.schema.TableDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads table and column statistics from an exported catalog in JSON or YAML.
 * <pre>
 * tables:
 *   - name: sales.orders
 *     row_count: 10000000
 *     columns:
 *       - name: order_date
 *         type: date
 *         distinct_count: 730
 *         earliest: 2023-01-01
 *         latest: 2024-12-31
 *         histogram: {PENDING: 100, SHIPPED: 900}
 * </pre>
 */
@Slf4j
public class CatalogFileConnector {

    private final JsonNode catalogData;

    public CatalogFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Catalog file not found: " + path);
        }

        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper objectMapper = fileName.endsWith(".yml") || fileName.endsWith(".yaml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        catalogData = objectMapper.readTree(Files.readString(path));

        validateCatalogFormat();
    }

    public List<TableDescriptor> getTables() {
        List<TableDescriptor> tables = new ArrayList<>();
        for (JsonNode tableNode : catalogData.get("tables")) {
            tables.add(parseTable(tableNode));
        }
        log.debug("Loaded {} tables from catalog", tables.size());
        return tables;
    }

    private void validateCatalogFormat() {
        if (catalogData == null || !catalogData.isObject()) {
            throw new IllegalStateException("Invalid catalog file format");
        }
        JsonNode tables = catalogData.get("tables");
        if (tables == null || !tables.isArray()) {
            throw new IllegalStateException("Missing or invalid tables section in catalog file");
        }
    }

    private TableDescriptor parseTable(JsonNode tableNode) {
        String tableName = requiredText(tableNode, "name", "table");
        Long rowCount = optionalLong(tableNode, "row_count");
        TableDescriptor table = new TableDescriptor(tableName, rowCount);

        JsonNode columns = tableNode.get("columns");
        if (columns == null || !columns.isArray()) {
            log.warn("Table {} has no columns section in the catalog", tableName);
            return table;
        }

        for (JsonNode columnNode : columns) {
            table.addColumn(ColumnDescriptor.builder()
                    .table(table.getSimpleName())
                    .name(requiredText(columnNode, "name", "column of table " + tableName))
                    .dataType(columnNode.hasNonNull("type") ? columnNode.get("type").asText() : null)
                    .distinctCount(optionalLong(columnNode, "distinct_count"))
                    .histogram(parseHistogram(columnNode.get("histogram")))
                    .earliest(optionalDate(columnNode, "earliest"))
                    .latest(optionalDate(columnNode, "latest"))
                    .build());
        }
        return table;
    }

    private Map<String, Long> parseHistogram(JsonNode histogramNode) {
        if (histogramNode == null || !histogramNode.isObject()) {
            return null;
        }
        Map<String, Long> histogram = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = histogramNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            histogram.put(entry.getKey(), entry.getValue().asLong());
        }
        return histogram;
    }

    private static String requiredText(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalStateException("Missing required field '" + field + "' in " + context);
        }
        return value.asText();
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToLong() && !value.isTextual()) {
            throw new IllegalStateException("Field '" + field + "' is not a number: " + value);
        }
        try {
            return value.isTextual() ? Long.parseLong(value.asText().trim()) : value.asLong();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Field '" + field + "' is not a number: " + value, e);
        }
    }

    private static LocalDate optionalDate(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        try {
            // Timestamps keep only their date part
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Field '" + field + "' is not an ISO date: " + text, e);
        }
    }
}
