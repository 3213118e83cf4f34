package edu.harvard.hms.dbmi.avillach.genoquery.processing.expr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Exprs.*;
import static org.junit.jupiter.api.Assertions.*;

class SqlRendererTest {

    @Test
    public void literal_stringsAndNumbers() {
        assertEquals("'O''Brien'", SqlRenderer.literal("O'Brien"));
        assertEquals("0.001", SqlRenderer.literal(0.001));
        assertEquals("100", SqlRenderer.literal(100.0));
        assertEquals("7", SqlRenderer.literal(7));
        assertThrows(IllegalArgumentException.class, () -> SqlRenderer.literal(new Object()));
    }

    @Test
    public void render_parameterized_collectsValuesInPlaceholderOrder() {
        SqlRenderer renderer = new SqlRenderer(SqlStyle.DUCKDB);

        String sql = renderer.render(and(
                eq(column("sa.chromosome"), "1"),
                in(column("sa.clinvar"), List.of("benign", "pathogenic")),
                ge(column("sa.position"), 10)));

        assertEquals("(sa.chromosome = ? AND sa.clinvar IN (?, ?) AND sa.position >= ?)", sql);
        assertEquals(List.of("1", "benign", "pathogenic", 10), renderer.parameters());
    }

    @Test
    public void render_booleanIdentities() {
        SqlRenderer renderer = new SqlRenderer(SqlStyle.IMPALA);

        assertEquals("TRUE", renderer.render(and()));
        assertEquals("FALSE", renderer.render(or()));
        assertEquals("FALSE", renderer.render(in(column("x"), List.of())));
        assertEquals("(FALSE AND x = 1)", renderer.render(and(FALSE, eq(column("x"), 1))));
        assertEquals("x = 1", renderer.render(and(TRUE, eq(column("x"), 1))));
    }

    @Test
    public void render_nestedAndOr_flattened() {
        Expr expr = and(eq(column("a"), 1), and(eq(column("b"), 2), eq(column("c"), 3)));

        assertEquals("(a = 1 AND b = 2 AND c = 3)", new SqlRenderer(SqlStyle.BIGQUERY).render(expr));
    }

    @Test
    public void render_nullChecks() {
        SqlRenderer renderer = new SqlRenderer(SqlStyle.IMPALA);

        assertEquals("x IS NULL", renderer.render(isNull(column("x"))));
        assertEquals("NOT (x IS NOT NULL)", renderer.render(not(isNotNull(column("x")))));
    }
}
