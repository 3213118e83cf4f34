package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;

import java.util.List;

/**
 * Produces an {@link EmbeddedPlan} for the in-memory store instead of query text.
 */
public class EmbeddedQueryBuilder extends QueryBuilder {

    private boolean joinFamily;
    private boolean explodeEffects;
    private List<Expr> predicates = List.of();
    private boolean distinctSummary;
    private Integer limit;

    public EmbeddedQueryBuilder(QueryContext context) {
        super(context);
    }

    @Override
    public void buildSelect() {
        // rows always carry every column of the joined relations
    }

    @Override
    public void buildFrom() {
        joinFamily = context.shape() == QueryShape.FAMILY;
    }

    @Override
    public void buildJoin(boolean effectJoin) {
        explodeEffects = effectJoin;
    }

    @Override
    public void buildWhere(List<Expr> conditions) {
        predicates = conditions;
    }

    @Override
    public void buildGroupBy(boolean distinct) {
        distinctSummary = distinct;
    }

    @Override
    public void buildLimit(Integer limit) {
        this.limit = limit;
    }

    @Override
    public QueryPayload getResult() {
        return new EmbeddedPlan(context.shape(), joinFamily, explodeEffects, predicates, distinctSummary, limit);
    }
}
