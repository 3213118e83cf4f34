package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend;

import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.*;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize.VariantDeserializer;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionSelection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend serving canned rows. It can fail after its rows or block until cancelled.
 */
public class StubConnectionPool implements ConnectionPool {

    public static final VariantDeserializer DESERIALIZER = (raw, shape) -> VariantRow.builder()
            .chromosome((String) raw.get("chromosome"))
            .position((Integer) raw.get("position"))
            .reference("A")
            .alternative("T")
            .alleleIndex(1)
            .build();

    private final List<Map<String, Object>> rows;
    private final RuntimeException failure;
    private final boolean blockUntilCancelled;

    public final AtomicInteger acquired = new AtomicInteger();
    public final AtomicInteger released = new AtomicInteger();
    public final AtomicInteger cancelled = new AtomicInteger();
    private final CountDownLatch cancelLatch = new CountDownLatch(1);

    private StubConnectionPool(List<Map<String, Object>> rows, RuntimeException failure, boolean blockUntilCancelled) {
        this.rows = rows;
        this.failure = failure;
        this.blockUntilCancelled = blockUntilCancelled;
    }

    public static StubConnectionPool withRows(String chromosome, int... positions) {
        return new StubConnectionPool(rows(chromosome, positions), null, false);
    }

    public static StubConnectionPool failingAfter(RuntimeException failure, String chromosome, int... positions) {
        return new StubConnectionPool(rows(chromosome, positions), failure, false);
    }

    public static StubConnectionPool blockingAfter(String chromosome, int... positions) {
        return new StubConnectionPool(rows(chromosome, positions), null, true);
    }

    public static CompiledQuery query() {
        return CompiledQuery.builder()
                .dialect(Dialect.IMPALA)
                .shape(QueryShape.SUMMARY)
                .payload(new SqlText("SELECT 1"))
                .target(PartitionSelection.UNCONSTRAINED)
                .build();
    }

    private static List<Map<String, Object>> rows(String chromosome, int... positions) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int position : positions) {
            rows.add(Map.of("chromosome", chromosome, "position", position));
        }
        return rows;
    }

    @Override
    public QueryConnection acquire(long timeout, TimeUnit unit) {
        acquired.incrementAndGet();
        return new QueryConnection() {
            @Override
            public RowCursor execute(CompiledQuery query) {
                return new RowCursor() {
                    private int next;

                    @Override
                    public Map<String, Object> fetchNext() {
                        if (next < rows.size()) {
                            return rows.get(next++);
                        }
                        if (failure != null) {
                            throw failure;
                        }
                        if (blockUntilCancelled) {
                            try {
                                cancelLatch.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            throw new CancellationException("cancelled");
                        }
                        return null;
                    }

                    @Override
                    public void close() {
                    }
                };
            }

            @Override
            public void cancel() {
                cancelled.incrementAndGet();
                cancelLatch.countDown();
            }

            @Override
            public void close() {
                released.incrementAndGet();
            }
        };
    }
}
