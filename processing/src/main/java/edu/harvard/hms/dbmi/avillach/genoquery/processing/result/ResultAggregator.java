package edu.harvard.hms.dbmi.avillach.genoquery.processing.result;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.QueryRunner;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.ResultItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.*;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Merges the rows of several runners into one iterator. Rows of one runner keep their order; rows of different runners
 * interleave in arrival order.
 *
 * <p>Iteration ends when every runner is done and the queue is drained, when the row limit is reached, or when the
 * aggregator is closed. A runner failure is rethrown from {@link #hasNext()} at the position it occurred and closes all
 * runners.</p>
 */
public class ResultAggregator implements Iterator<VariantRow>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    public static final long DEFAULT_POLL_TIMEOUT_MS = 100;

    private final BlockingQueue<ResultItem> queue;
    private final List<QueryRunner> runners;
    private final Integer limit;
    private final boolean deduplicate;
    private final UnaryOperator<VariantRow> rowView;
    private final long pollTimeoutMs;

    private final Object lock = new Object();
    private boolean started;
    private boolean closed;

    private final Set<String> seen = new HashSet<>();
    private VariantRow next;
    private int returned;

    public ResultAggregator(BlockingQueue<ResultItem> queue, List<QueryRunner> runners) {
        this(queue, runners, null, false, UnaryOperator.identity(), DEFAULT_POLL_TIMEOUT_MS);
    }

    /**
     * @param limit       maximum number of rows returned, null for all
     * @param deduplicate drop rows whose {@link VariantRow#uniqueId()} was already returned
     * @param rowView     applied to every row before deduplication
     */
    public ResultAggregator(BlockingQueue<ResultItem> queue, List<QueryRunner> runners, Integer limit,
                            boolean deduplicate, UnaryOperator<VariantRow> rowView, long pollTimeoutMs) {
        this.queue = queue;
        this.runners = ImmutableList.copyOf(runners);
        this.limit = limit;
        this.deduplicate = deduplicate;
        this.rowView = rowView;
        this.pollTimeoutMs = pollTimeoutMs;
    }

    /**
     * Starts every runner. Starting a closed aggregator starts nothing.
     */
    public ResultAggregator start() {
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Aggregator already started");
            }
            started = true;
            if (closed) {
                return this;
            }
        }
        log.debug("Starting " + runners.size() + " runners");
        runners.forEach(QueryRunner::start);
        return this;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        synchronized (lock) {
            if (!started && !closed) {
                throw new IllegalStateException("Aggregator not started");
            }
        }
        while (!isClosed()) {
            if (limit != null && returned >= limit) {
                close();
                return false;
            }
            ResultItem item = poll();
            if (item == null) {
                if (!allDone()) {
                    continue;
                }
                item = queue.poll();
                if (item == null) {
                    close();
                    return false;
                }
            }
            if (item.isError()) {
                close();
                throw item.error();
            }
            VariantRow row = rowView.apply(item.row());
            if (deduplicate && !seen.add(row.uniqueId())) {
                continue;
            }
            next = row;
            return true;
        }
        return false;
    }

    @Override
    public VariantRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        VariantRow row = next;
        next = null;
        returned++;
        return row;
    }

    /**
     * Closes every runner once. Safe to call from another thread; a consumer blocked in {@link #hasNext()} returns
     * within one poll timeout.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        runners.forEach(QueryRunner::close);
        log.debug("Closed aggregator after " + returned + " rows");
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public boolean allDone() {
        return runners.stream().allMatch(QueryRunner::done);
    }

    public List<QueryRunner> getRunners() {
        return runners;
    }

    /**
     * Sequential stream over the remaining rows. Closing the stream closes the aggregator.
     */
    public Stream<VariantRow> stream() {
        return Streams.stream(this).onClose(this::close);
    }

    private ResultItem poll() {
        try {
            return queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return null;
        }
    }
}
