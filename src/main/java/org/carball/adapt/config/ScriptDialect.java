package org.carball.adapt.config;

/**
 * SQL dialect of the generated partition DDL.
 */
public enum ScriptDialect {
    /** {@code ALTER TABLE t SET PROPERTIES partitioning = ARRAY['month(c)']} */
    TRINO,
    /** {@code ALTER TABLE t ADD PARTITION FIELD months(c)} with the Iceberg SQL extensions */
    SPARK
}
