package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;

import java.util.List;

/**
 * Execution plan for the embedded store: join, explode the effect list, then apply the predicate chain in order.
 *
 * @param distinctSummary keep one row per summary allele after effect explosion
 * @param limit           maximum rows produced, null for no cap
 */
public record EmbeddedPlan(
        QueryShape shape,
        boolean joinFamily,
        boolean explodeEffects,
        List<Expr> predicates,
        boolean distinctSummary,
        Integer limit
) implements QueryPayload {

    public EmbeddedPlan {
        predicates = List.copyOf(predicates);
    }
}
