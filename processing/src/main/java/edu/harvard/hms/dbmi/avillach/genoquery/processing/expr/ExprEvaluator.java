package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates an {@link Expr} against one in-memory row using SQL three-valued logic: a comparison involving NULL is
 * unknown ({@code null}), and a row only passes a predicate that evaluates to TRUE.
 */
public class ExprEvaluator implements ExprVisitor<Object> {

    private final Map<String, Object> row;

    public ExprEvaluator(Map<String, Object> row) {
        this.row = row;
    }

    public static boolean test(Expr predicate, Map<String, Object> row) {
        return Boolean.TRUE.equals(predicate.accept(new ExprEvaluator(row)));
    }

    private Object eval(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Object visitColumn(Expr.Column column) {
        return row.get(column.name());
    }

    @Override
    public Object visitConstant(Expr.Constant constant) {
        return constant.value();
    }

    @Override
    public Object visitBooleanLiteral(Expr.BooleanLiteral literal) {
        return literal.value();
    }

    @Override
    public Object visitComparison(Expr.Comparison comparison) {
        Object left = eval(comparison.left());
        Object right = eval(comparison.right());
        if (left == null || right == null) {
            return null;
        }
        return comparison.operator().test(compare(left, right));
    }

    @Override
    public Object visitBitTest(Expr.BitTest bitTest) {
        Object value = eval(bitTest.operand());
        if (value == null) {
            return null;
        }
        return (((Number) value).longValue() & bitTest.mask()) != 0;
    }

    @Override
    public Object visitAnd(Expr.And and) {
        boolean unknown = false;
        for (Expr operand : and.operands()) {
            Object value = eval(operand);
            if (Boolean.FALSE.equals(value)) {
                return false;
            }
            unknown |= value == null;
        }
        return unknown ? null : true;
    }

    @Override
    public Object visitOr(Expr.Or or) {
        boolean unknown = false;
        for (Expr operand : or.operands()) {
            Object value = eval(operand);
            if (Boolean.TRUE.equals(value)) {
                return true;
            }
            unknown |= value == null;
        }
        return unknown ? null : false;
    }

    @Override
    public Object visitNot(Expr.Not not) {
        Object value = eval(not.operand());
        return value == null ? null : !((Boolean) value);
    }

    @Override
    public Object visitIsNull(Expr.IsNull isNull) {
        return (eval(isNull.operand()) == null) != isNull.negated();
    }

    @Override
    public Object visitInList(Expr.InList inList) {
        Object value = eval(inList.operand());
        if (value == null) {
            return null;
        }
        return containsValue(inList.values(), value);
    }

    @Override
    public Object visitCoalesce(Expr.Coalesce coalesce) {
        for (Expr operand : coalesce.operands()) {
            Object value = eval(operand);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public Object visitArrayContainsAny(Expr.ArrayContainsAny arrayContainsAny) {
        Object array = eval(arrayContainsAny.array());
        if (array == null) {
            return null;
        }
        for (Object element : (Collection<?>) array) {
            if (element != null && containsValue(arrayContainsAny.values(), element)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsValue(List<Object> values, Object value) {
        for (Object candidate : values) {
            if (candidate != null && compare(candidate, value) == 0) {
                return true;
            }
        }
        return false;
    }

    private static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        return Objects.equals(left, right) ? 0 : String.valueOf(left).compareTo(String.valueOf(right));
    }
}
