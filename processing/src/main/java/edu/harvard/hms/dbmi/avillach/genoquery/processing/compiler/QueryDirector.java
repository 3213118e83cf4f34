package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;

/**
 * Drives a {@link QueryBuilder} through select, from, join, where, group-by and limit. The order is fixed for every
 * dialect.
 */
public class QueryDirector {

    /**
     * Rows fetched per requested row. Joins can repeat an allele, so the consumer enforces the exact cap after
     * deduplication.
     */
    public static final int LIMIT_FACTOR = 10;

    private final WhereClauseBuilder whereClauseBuilder;

    public QueryDirector(WhereClauseBuilder whereClauseBuilder) {
        this.whereClauseBuilder = whereClauseBuilder;
    }

    public QueryPayload construct(QueryBuilder builder) throws QueryCompileException {
        QueryContext context = builder.getContext();
        boolean effectJoin = context.needsEffectJoin();

        builder.buildSelect();
        builder.buildFrom();
        builder.buildJoin(effectJoin);
        builder.buildWhere(whereClauseBuilder.build(context));
        builder.buildGroupBy(effectJoin && context.shape() == QueryShape.SUMMARY);
        builder.buildLimit(fetchLimit(context.filter().getLimit()));
        return builder.getResult();
    }

    static Integer fetchLimit(Integer requested) {
        if (requested == null) {
            return null;
        }
        return (int) Math.min(Integer.MAX_VALUE, (long) requested * LIMIT_FACTOR);
    }
}
