package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

public interface ExprVisitor<R> {

    R visitColumn(Expr.Column column);

    R visitConstant(Expr.Constant constant);

    R visitBooleanLiteral(Expr.BooleanLiteral literal);

    R visitComparison(Expr.Comparison comparison);

    R visitBitTest(Expr.BitTest bitTest);

    R visitAnd(Expr.And and);

    R visitOr(Expr.Or or);

    R visitNot(Expr.Not not);

    R visitIsNull(Expr.IsNull isNull);

    R visitInList(Expr.InList inList);

    R visitCoalesce(Expr.Coalesce coalesce);

    R visitArrayContainsAny(Expr.ArrayContainsAny arrayContainsAny);
}
