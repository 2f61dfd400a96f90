package org.carball.adapt.script;

public final class PartitionScriptTemplate {

    private PartitionScriptTemplate() {
    }

    public static final String SCRIPT_HEADER = """
        -- Partition spec recommendations
        -- Dialect: %s
        -- Generated: %s
        -- Review before running. Changing a partition spec only affects newly written data.
        """;

    public static final String TABLE_COMMENT_TEMPLATE = """
        -- %s
        """;

    public static final String FIELD_COMMENT_TEMPLATE = """
        --   %d. %s (score %.4f)
        """;

    public static final String TRINO_SET_PARTITIONING_TEMPLATE = """
        ALTER TABLE %s SET PROPERTIES partitioning = ARRAY[%s];
        """;

    public static final String SPARK_ADD_PARTITION_FIELD_TEMPLATE = """
        ALTER TABLE %s ADD PARTITION FIELD %s;
        """;

    public static final String NO_RECOMMENDATION_TEMPLATE = """
        -- %s does not contain suitable columns for partitioning.
        """;
}
