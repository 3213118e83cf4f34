package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;

import java.util.List;

/**
 * One dialect's way of assembling a query. The {@link QueryDirector} calls every stage exactly once, in the order the
 * methods are declared, and then asks for the result.
 */
public abstract class QueryBuilder {

    protected final QueryContext context;

    protected QueryBuilder(QueryContext context) {
        this.context = context;
    }

    public QueryContext getContext() {
        return context;
    }

    public abstract void buildSelect();

    public abstract void buildFrom();

    /**
     * @param effectJoin whether the effect list must be exploded into rows aliased {@code eg}
     */
    public abstract void buildJoin(boolean effectJoin);

    /**
     * @param conditions conditions to AND together, none means no WHERE clause
     */
    public abstract void buildWhere(List<Expr> conditions);

    /**
     * @param distinct collapse the rows the effect join duplicated
     */
    public abstract void buildGroupBy(boolean distinct);

    /**
     * @param limit row cap, null for none
     */
    public abstract void buildLimit(Integer limit);

    public abstract QueryPayload getResult();
}
