package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders {@link Expr} trees as SQL text. One renderer is used per query so that bound parameters accumulate in the
 * order their placeholders appear.
 */
public class SqlRenderer implements ExprVisitor<String> {

    private final SqlStyle style;
    private final List<Object> parameters = new ArrayList<>();

    public SqlRenderer(SqlStyle style) {
        this.style = style;
    }

    public String render(Expr expr) {
        return expr.accept(this);
    }

    public List<Object> parameters() {
        return ImmutableList.copyOf(parameters);
    }

    /**
     * Inline SQL literal, regardless of the parameterization setting.
     */
    public static String literal(Object value) {
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new IllegalArgumentException("Unsupported SQL literal type " + value.getClass().getName());
    }

    private String bind(Object value) {
        if (style.parameterized()) {
            parameters.add(value);
            return "?";
        }
        return literal(value);
    }

    private String bindAll(List<Object> values) {
        return values.stream().map(this::bind).collect(Collectors.joining(", "));
    }

    @Override
    public String visitColumn(Expr.Column column) {
        return column.name();
    }

    @Override
    public String visitConstant(Expr.Constant constant) {
        return bind(constant.value());
    }

    @Override
    public String visitBooleanLiteral(Expr.BooleanLiteral literal) {
        return literal.value() ? "TRUE" : "FALSE";
    }

    @Override
    public String visitComparison(Expr.Comparison comparison) {
        return render(comparison.left()) + " " + comparison.operator().symbol() + " " + render(comparison.right());
    }

    @Override
    public String visitBitTest(Expr.BitTest bitTest) {
        String operand = render(bitTest.operand());
        if (style.bitAndFunction()) {
            return "BITAND(" + operand + ", " + bitTest.mask() + ") != 0";
        }
        return "(" + operand + " & " + bitTest.mask() + ") != 0";
    }

    @Override
    public String visitAnd(Expr.And and) {
        return and.operands().stream().map(this::render).collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String visitOr(Expr.Or or) {
        return or.operands().stream().map(this::render).collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String visitNot(Expr.Not not) {
        if (not.operand() instanceof Expr.And || not.operand() instanceof Expr.Or) {
            return "NOT " + render(not.operand());
        }
        return "NOT (" + render(not.operand()) + ")";
    }

    @Override
    public String visitIsNull(Expr.IsNull isNull) {
        return render(isNull.operand()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String visitInList(Expr.InList inList) {
        return render(inList.operand()) + " IN (" + bindAll(inList.values()) + ")";
    }

    @Override
    public String visitCoalesce(Expr.Coalesce coalesce) {
        return coalesce.operands().stream().map(this::render).collect(Collectors.joining(", ", "COALESCE(", ")"));
    }

    @Override
    public String visitArrayContainsAny(Expr.ArrayContainsAny arrayContainsAny) {
        String array = render(arrayContainsAny.array());
        String values = bindAll(arrayContainsAny.values());
        return switch (style.arraySyntax()) {
            case NESTED_COLLECTION -> "EXISTS (SELECT 1 FROM " + array + " AS m WHERE m.item IN (" + values + "))";
            case UNNEST -> "EXISTS (SELECT 1 FROM UNNEST(" + array + ") AS m WHERE m IN (" + values + "))";
            case LIST_FUNCTION -> "list_has_any(" + array + ", [" + values + "])";
        };
    }
}
