package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionSelection;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable result of compiling one filter for one dialect and one scan target.
 */
@Value
@Builder
public class CompiledQuery {

    @NonNull
    Dialect dialect;
    @NonNull
    QueryShape shape;
    @NonNull
    QueryPayload payload;
    @NonNull
    PartitionSelection target;
    /**
     * Row cap the caller asked for. The payload may fetch more to leave room for duplicates.
     */
    Integer requestedLimit;

    public String describe() {
        if (payload instanceof SqlText) {
            return ((SqlText) payload).sql();
        }
        if (payload instanceof ParameterizedSql) {
            ParameterizedSql parameterized = (ParameterizedSql) payload;
            return parameterized.sql() + " " + parameterized.parameters();
        }
        return payload.toString();
    }
}
