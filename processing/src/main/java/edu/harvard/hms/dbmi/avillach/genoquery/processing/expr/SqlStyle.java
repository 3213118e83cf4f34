package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

/**
 * The parts of SQL rendering that differ between engines.
 *
 * @param bitAndFunction render bit tests as {@code BITAND(x, m)} instead of {@code (x & m)}
 * @param parameterized  bind constants as {@code ?} parameters instead of inlining them
 * @param arraySyntax    how membership in an array column is written
 */
public record SqlStyle(boolean bitAndFunction, boolean parameterized, ArraySyntax arraySyntax) {

    public static final SqlStyle IMPALA = new SqlStyle(true, false, ArraySyntax.NESTED_COLLECTION);
    public static final SqlStyle BIGQUERY = new SqlStyle(false, false, ArraySyntax.UNNEST);
    public static final SqlStyle DUCKDB = new SqlStyle(false, true, ArraySyntax.LIST_FUNCTION);

    public enum ArraySyntax {
        /**
         * Impala complex types, {@code EXISTS (SELECT 1 FROM t.arr AS m WHERE m.item IN (...))}.
         */
        NESTED_COLLECTION,
        /**
         * {@code EXISTS (SELECT 1 FROM UNNEST(arr) AS m WHERE m IN (...))}.
         */
        UNNEST,
        /**
         * {@code list_has_any(arr, [...])}.
         */
        LIST_FUNCTION
    }
}
