package edu.harvard.hms.dbmi.avillach.genoquery.processing.runner;

import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.BackendExecutionException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.ConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.QueryConnection;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.RowCursor;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.CompiledQuery;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize.VariantDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Executes one compiled query on its own thread and feeds the resulting rows into a queue shared with other runners.
 *
 * <p>Lifecycle flags only move forward: started, then closed and done in either order. {@link #close()} may be called
 * from any thread at any time; the worker notices it between rows, while waiting for a connection and while waiting for
 * queue space.</p>
 */
public class QueryRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

    private static final long CONNECTION_WAIT_MS = 100;

    private final String runnerId;
    private final CompiledQuery query;
    private final ConnectionPool connectionPool;
    private final VariantDeserializer deserializer;
    private final BlockingQueue<ResultItem> queue;
    private final RunnerSettings settings;
    private final ThreadFactory threadFactory;

    private Predicate<VariantRow> postFilter = row -> true;

    private final Object lock = new Object();
    private boolean started;
    private boolean closed;
    private boolean done;
    private QueryConnection connection;
    private volatile boolean abandoned;

    public QueryRunner(String runnerId, CompiledQuery query, ConnectionPool connectionPool, VariantDeserializer deserializer,
                       BlockingQueue<ResultItem> queue, RunnerSettings settings, ThreadFactory threadFactory) {
        this.runnerId = runnerId;
        this.query = query;
        this.connectionPool = connectionPool;
        this.deserializer = deserializer;
        this.queue = queue;
        this.settings = settings;
        this.threadFactory = threadFactory;
    }

    /**
     * Adds a filter applied to deserialized rows before they are enqueued. Only allowed before {@link #start()}.
     */
    public QueryRunner adapt(Predicate<VariantRow> filter) {
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Runner " + runnerId + " already started");
            }
            postFilter = postFilter.and(filter);
        }
        return this;
    }

    public void start() {
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Runner " + runnerId + " already started");
            }
            started = true;
        }
        threadFactory.newThread(this::run).start();
    }

    /**
     * Stops the runner without waiting for the worker. A runner closed before it was started is done immediately.
     */
    @Override
    public void close() {
        QueryConnection inFlight;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (!started) {
                done = true;
            }
            inFlight = connection;
        }
        log.debug("Closing runner " + runnerId);
        if (inFlight != null) {
            inFlight.cancel();
        }
    }

    public boolean started() {
        synchronized (lock) {
            return started;
        }
    }

    public boolean closed() {
        synchronized (lock) {
            return closed;
        }
    }

    public boolean done() {
        synchronized (lock) {
            return done;
        }
    }

    /**
     * @return true when the runner closed itself because nobody consumed its rows
     */
    public boolean abandoned() {
        return abandoned;
    }

    public String getRunnerId() {
        return runnerId;
    }

    public CompiledQuery getQuery() {
        return query;
    }

    private void run() {
        log.info("Runner " + runnerId + " started");
        long rows = 0;
        try {
            if (!closed()) {
                rows = execute();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        } catch (RuntimeException | Error e) {
            if (closed()) {
                log.debug("Runner " + runnerId + " stopped by close: " + e.getMessage());
            } else {
                log.error("Runner " + runnerId + " failed", e);
                reportError(e);
            }
        } finally {
            synchronized (lock) {
                done = true;
            }
            log.info("Runner " + runnerId + " stopped after " + rows + " rows" + (abandoned ? " (abandoned)" : ""));
        }
    }

    private long execute() throws InterruptedException {
        QueryConnection acquired = acquireConnection();
        if (acquired == null) {
            return 0;
        }
        long rows = 0;
        try (acquired; RowCursor cursor = acquired.execute(query)) {
            Map<String, Object> raw;
            while (!closed() && (raw = cursor.fetchNext()) != null) {
                VariantRow row = deserializer.deserialize(raw, query.getShape());
                if (row == null || !postFilter.test(row)) {
                    continue;
                }
                if (!enqueue(ResultItem.of(row))) {
                    break;
                }
                rows++;
            }
        } finally {
            synchronized (lock) {
                connection = null;
            }
        }
        return rows;
    }

    private QueryConnection acquireConnection() throws InterruptedException {
        while (!closed()) {
            QueryConnection acquired = connectionPool.acquire(CONNECTION_WAIT_MS, TimeUnit.MILLISECONDS);
            if (acquired == null) {
                continue;
            }
            synchronized (lock) {
                if (!closed) {
                    connection = acquired;
                    return acquired;
                }
            }
            acquired.close();
        }
        return null;
    }

    /**
     * @return false when the item was not enqueued because the runner was closed
     */
    private boolean enqueue(ResultItem item) throws InterruptedException {
        int attempts = 0;
        while (!queue.offer(item, settings.getOfferTimeoutMs(), TimeUnit.MILLISECONDS)) {
            if (closed()) {
                return false;
            }
            attempts++;
            if (attempts % settings.getWarnEvery() == 0) {
                log.warn("Runner " + runnerId + " could not enqueue a row after " + attempts + " attempts");
            }
            if (attempts >= settings.getMaxOfferAttempts()) {
                log.warn("Runner " + runnerId + " has no consumer after " + attempts + " attempts, closing");
                abandoned = true;
                close();
                return false;
            }
        }
        return true;
    }

    private void reportError(Throwable e) {
        BackendExecutionException error = e instanceof BackendExecutionException
                ? (BackendExecutionException) e
                : new BackendExecutionException(runnerId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        try {
            enqueue(ResultItem.error(error));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            close();
        }
    }
}
