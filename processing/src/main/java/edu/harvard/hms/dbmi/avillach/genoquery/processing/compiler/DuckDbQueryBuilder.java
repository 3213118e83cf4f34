package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.SqlStyle;

/**
 * DuckDB SQL with bound parameters. Tables without a schema are referenced by bare name.
 */
public class DuckDbQueryBuilder extends SqlQueryBuilder {

    public DuckDbQueryBuilder(QueryContext context) {
        super(context, SqlStyle.DUCKDB);
    }

    @Override
    protected String tableName(String table) {
        String db = context.metadata().getDb();
        return db == null || db.isEmpty() ? table : db + "." + table;
    }

    @Override
    protected String effectGeneJoin() {
        return "CROSS JOIN UNNEST(" + Columns.EFFECT_GENE + ") AS t(" + Columns.EFFECT_GENE_ALIAS + ")";
    }
}
