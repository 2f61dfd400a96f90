package org.carball.adapt.model.schema;

import java.util.Locale;

public final class TableNames {

    private TableNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Reduces {@code catalog.schema.table} to {@code table}, unquoted and lower case.
     */
    public static String simpleName(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        String name = qualifiedName.trim();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            name = name.substring(dot + 1);
        }
        return normalizeIdentifier(name);
    }

    public static String normalizeIdentifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        String name = identifier.trim();
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                name = name.substring(1, name.length() - 1);
            }
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
