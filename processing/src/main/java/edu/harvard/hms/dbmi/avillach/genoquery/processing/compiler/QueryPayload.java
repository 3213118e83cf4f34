package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

/**
 * The executable part of a {@link CompiledQuery}. Which variant a compiler produces depends on its dialect.
 */
public sealed interface QueryPayload permits SqlText, ParameterizedSql, EmbeddedPlan {
}
