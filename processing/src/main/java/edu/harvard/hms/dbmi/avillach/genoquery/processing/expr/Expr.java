package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

import java.util.List;

/**
 * Dialect-neutral boolean and scalar expression tree. Compilers build predicates out of these nodes; {@link SqlRenderer}
 * turns them into SQL text for a dialect and {@link ExprEvaluator} evaluates them against in-memory rows.
 */
public sealed interface Expr permits Expr.Column, Expr.Constant, Expr.BooleanLiteral, Expr.Comparison, Expr.BitTest,
        Expr.And, Expr.Or, Expr.Not, Expr.IsNull, Expr.InList, Expr.Coalesce, Expr.ArrayContainsAny {

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Qualified column reference such as {@code sa.position}.
     */
    record Column(String name) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitColumn(this);
        }
    }

    /**
     * A string or numeric value. Parameterized dialects bind these instead of inlining them.
     */
    record Constant(Object value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    record BooleanLiteral(boolean value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBooleanLiteral(this);
        }
    }

    record Comparison(Expr left, Operator operator, Expr right) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * True when any bit of {@code mask} is set in the operand.
     */
    record BitTest(Expr operand, int mask) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBitTest(this);
        }
    }

    record And(List<Expr> operands) implements Expr {
        public And {
            operands = List.copyOf(operands);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(List<Expr> operands) implements Expr {
        public Or {
            operands = List.copyOf(operands);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(Expr operand) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    record IsNull(Expr operand, boolean negated) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIsNull(this);
        }
    }

    record InList(Expr operand, List<Object> values) implements Expr {
        public InList {
            values = List.copyOf(values);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInList(this);
        }
    }

    record Coalesce(List<Expr> operands) implements Expr {
        public Coalesce {
            operands = List.copyOf(operands);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCoalesce(this);
        }
    }

    /**
     * True when the array column holds at least one of the values.
     */
    record ArrayContainsAny(Expr array, List<Object> values) implements Expr {
        public ArrayContainsAny {
            values = List.copyOf(values);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayContainsAny(this);
        }
    }

    enum Operator {
        EQ("="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
            };
        }
    }
}
