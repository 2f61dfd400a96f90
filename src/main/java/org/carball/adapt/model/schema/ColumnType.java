package org.carball.adapt.model.schema;

import java.util.Locale;

/**
 * Categorical column types that drive transform selection.
 */
public enum ColumnType {
    TEMPORAL,
    NUMERIC,
    STRING,
    OTHER;

    /**
     * Maps a declared SQL type such as {@code timestamp(6) with time zone} or
     * {@code varchar(255)} to its category.
     */
    public static ColumnType fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return OTHER;
        }
        String type = declaredType.trim().toLowerCase(Locale.ROOT);
        int paren = type.indexOf('(');
        String base = (paren >= 0 ? type.substring(0, paren) : type).trim();

        // time of day has no day/month/year transform
        if (base.equals("date") || base.startsWith("datetime") || base.startsWith("timestamp")) {
            return TEMPORAL;
        }
        switch (base) {
            case "tinyint":
            case "smallint":
            case "int":
            case "integer":
            case "bigint":
            case "long":
            case "decimal":
            case "numeric":
            case "real":
            case "float":
            case "double":
            case "double precision":
                return NUMERIC;
            case "varchar":
            case "char":
            case "string":
            case "text":
            case "uuid":
                return STRING;
            default:
                return OTHER;
        }
    }
}
