package edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Exprs;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a parsed attribute query into a predicate over a bit mask column. Every dialect uses this same translation;
 * only the rendering of the bit test differs.
 */
public final class AttributeTransformer {

    private AttributeTransformer() {
    }

    public static Expr toExpr(AttributeNode node, Expr column) {
        if (node instanceof AttributeNode.Literal) {
            return Exprs.bitTest(column, ((AttributeNode.Literal) node).mask());
        }
        if (node instanceof AttributeNode.And) {
            return Exprs.and(transformAll(((AttributeNode.And) node).children(), column));
        }
        if (node instanceof AttributeNode.Or) {
            return Exprs.or(transformAll(((AttributeNode.Or) node).children(), column));
        }
        return Exprs.not(toExpr(((AttributeNode.Not) node).child(), column));
    }

    private static List<Expr> transformAll(List<AttributeNode> children, Expr column) {
        return children.stream().map(child -> toExpr(child, column)).collect(Collectors.toList());
    }
}
