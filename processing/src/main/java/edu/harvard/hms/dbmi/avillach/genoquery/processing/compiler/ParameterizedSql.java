package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import java.util.List;

/**
 * SQL with {@code ?} placeholders and the values bound to them, in placeholder order.
 */
public record ParameterizedSql(String sql, List<Object> parameters) implements QueryPayload {

    public ParameterizedSql {
        parameters = List.copyOf(parameters);
    }
}
