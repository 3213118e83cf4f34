package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.SqlStyle;

public class BigQueryQueryBuilder extends SqlQueryBuilder {

    public BigQueryQueryBuilder(QueryContext context) {
        super(context, SqlStyle.BIGQUERY);
    }

    @Override
    protected String tableName(String table) {
        return "`" + context.metadata().getNamespace() + "." + context.metadata().getDb() + "." + table + "`";
    }

    @Override
    protected String effectGeneJoin() {
        return "CROSS JOIN UNNEST(" + Columns.EFFECT_GENE + ") AS " + Columns.EFFECT_GENE_ALIAS;
    }
}
