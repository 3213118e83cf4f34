package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.CompiledQuery;

public interface QueryConnection extends AutoCloseable {

    RowCursor execute(CompiledQuery query);

    /**
     * Interrupts the statement currently executing on this connection, if the backend supports it. Safe to call from
     * any thread and must not block.
     */
    void cancel();

    /**
     * Returns the connection to its pool.
     */
    @Override
    void close();
}
