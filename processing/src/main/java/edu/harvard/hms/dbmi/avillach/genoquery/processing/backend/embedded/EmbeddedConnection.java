package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.embedded;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.QueryConnection;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.RowCursor;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.CompiledQuery;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.EmbeddedPlan;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CancellationException;

class EmbeddedConnection implements QueryConnection {

    private final EmbeddedVariantStore store;
    private final Runnable onClose;
    private volatile boolean cancelled;
    private boolean closed;

    EmbeddedConnection(EmbeddedVariantStore store, Runnable onClose) {
        this.store = store;
        this.onClose = onClose;
    }

    @Override
    public RowCursor execute(CompiledQuery query) {
        if (!(query.getPayload() instanceof EmbeddedPlan)) {
            throw new IllegalArgumentException("Embedded store cannot run " + query.getPayload().getClass().getSimpleName());
        }
        Iterator<Map<String, Object>> rows = store.scan((EmbeddedPlan) query.getPayload());
        return new RowCursor() {
            @Override
            public Map<String, Object> fetchNext() {
                if (cancelled) {
                    throw new CancellationException("Embedded query cancelled");
                }
                return rows.hasNext() ? rows.next() : null;
            }

            @Override
            public void close() {
                cancelled = true;
            }
        };
    }

    @Override
    public void cancel() {
        cancelled = true;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.run();
    }
}
