package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Factory methods for {@link Expr} trees. Conjunctions and disjunctions are flattened and drop their identity element,
 * so an empty {@code and} is TRUE and an empty {@code or} is FALSE.
 */
public final class Exprs {

    public static final Expr TRUE = new Expr.BooleanLiteral(true);
    public static final Expr FALSE = new Expr.BooleanLiteral(false);

    private Exprs() {
    }

    public static Expr column(String name) {
        return new Expr.Column(name);
    }

    public static Expr value(Object value) {
        return new Expr.Constant(value);
    }

    public static Expr and(Expr... operands) {
        return and(Arrays.asList(operands));
    }

    public static Expr and(List<Expr> operands) {
        List<Expr> flattened = new ArrayList<>();
        for (Expr operand : operands) {
            if (operand instanceof Expr.And) {
                flattened.addAll(((Expr.And) operand).operands());
            } else if (!TRUE.equals(operand)) {
                flattened.add(operand);
            }
        }
        if (flattened.isEmpty()) {
            return TRUE;
        }
        return flattened.size() == 1 ? flattened.get(0) : new Expr.And(flattened);
    }

    public static Expr or(Expr... operands) {
        return or(Arrays.asList(operands));
    }

    public static Expr or(List<Expr> operands) {
        List<Expr> flattened = new ArrayList<>();
        for (Expr operand : operands) {
            if (operand instanceof Expr.Or) {
                flattened.addAll(((Expr.Or) operand).operands());
            } else if (!FALSE.equals(operand)) {
                flattened.add(operand);
            }
        }
        if (flattened.isEmpty()) {
            return FALSE;
        }
        return flattened.size() == 1 ? flattened.get(0) : new Expr.Or(flattened);
    }

    public static Expr not(Expr operand) {
        return new Expr.Not(operand);
    }

    public static Expr isNull(Expr operand) {
        return new Expr.IsNull(operand, false);
    }

    public static Expr isNotNull(Expr operand) {
        return new Expr.IsNull(operand, true);
    }

    public static Expr compare(Expr left, Expr.Operator operator, Object right) {
        return new Expr.Comparison(left, operator, value(right));
    }

    public static Expr eq(Expr left, Object right) {
        return compare(left, Expr.Operator.EQ, right);
    }

    public static Expr ge(Expr left, Object right) {
        return compare(left, Expr.Operator.GE, right);
    }

    public static Expr le(Expr left, Object right) {
        return compare(left, Expr.Operator.LE, right);
    }

    public static Expr lt(Expr left, Object right) {
        return compare(left, Expr.Operator.LT, right);
    }

    public static Expr gt(Expr left, Object right) {
        return compare(left, Expr.Operator.GT, right);
    }

    /**
     * An empty value list matches nothing.
     */
    public static Expr in(Expr operand, Collection<?> values) {
        if (values.isEmpty()) {
            return FALSE;
        }
        if (values.size() == 1) {
            return eq(operand, values.iterator().next());
        }
        return new Expr.InList(operand, new ArrayList<>(values));
    }

    public static Expr bitTest(Expr operand, int mask) {
        return new Expr.BitTest(operand, mask);
    }

    public static Expr coalesce(Expr... operands) {
        return new Expr.Coalesce(Arrays.asList(operands));
    }

    public static Expr containsAny(Expr array, Collection<?> values) {
        if (values.isEmpty()) {
            return FALSE;
        }
        return new Expr.ArrayContainsAny(array, new ArrayList<>(values));
    }
}
