package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

public enum Dialect {
    /**
     * In-process predicate chain over rows held by an embedded store.
     */
    EMBEDDED,
    /**
     * Hive/Impala SQL text.
     */
    IMPALA,
    /**
     * DuckDB SQL with bound parameters.
     */
    DUCKDB,
    /**
     * BigQuery standard SQL text.
     */
    BIGQUERY
}
