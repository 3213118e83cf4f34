package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

public record SqlText(String sql) implements QueryPayload {
}
