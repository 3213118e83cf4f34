package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend;

import java.util.Map;

/**
 * Forward only iteration over raw backend rows, keyed by lower case column label.
 */
public interface RowCursor extends AutoCloseable {

    /**
     * @return the next row, or null when the result is exhausted
     */
    Map<String, Object> fetchNext();

    @Override
    void close();
}
