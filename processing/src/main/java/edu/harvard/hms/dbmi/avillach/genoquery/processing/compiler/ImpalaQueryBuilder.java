package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.SqlStyle;

/**
 * Impala SQL over Parquet tables with nested collection columns.
 */
public class ImpalaQueryBuilder extends SqlQueryBuilder {

    public ImpalaQueryBuilder(QueryContext context) {
        super(context, SqlStyle.IMPALA);
    }

    @Override
    protected String tableName(String table) {
        return context.metadata().getDb() + "." + table;
    }

    @Override
    protected String effectGeneJoin() {
        return "JOIN " + Columns.EFFECT_GENE + " AS " + Columns.EFFECT_GENE_ALIAS;
    }
}
