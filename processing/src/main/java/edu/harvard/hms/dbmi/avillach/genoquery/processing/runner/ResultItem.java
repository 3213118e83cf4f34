package edu.harvard.hms.dbmi.avillach.genoquery.processing.runner;

import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.BackendExecutionException;

/**
 * Element of the queue shared by runners and the aggregator: a row, or the failure that ended a runner.
 */
public record ResultItem(VariantRow row, BackendExecutionException error) {

    public static ResultItem of(VariantRow row) {
        return new ResultItem(row, null);
    }

    public static ResultItem error(BackendExecutionException error) {
        return new ResultItem(null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
