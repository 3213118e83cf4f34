package edu.harvard.hms.dbmi.avillach.genoquery.processing.runner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.BackendExecutionException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.StubConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize.VariantDeserializer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class QueryRunnerTest {

    private final ThreadFactory threadFactory = new ThreadFactoryBuilder().setDaemon(true).setNameFormat("query-runner-test-%d").build();
    private final BlockingQueue<ResultItem> queue = new ArrayBlockingQueue<>(100);

    private QueryRunner runner(StubConnectionPool pool, BlockingQueue<ResultItem> queue, RunnerSettings settings) {
        return new QueryRunner("study1-0", StubConnectionPool.query(), pool, StubConnectionPool.DESERIALIZER, queue, settings, threadFactory);
    }

    static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    private List<ResultItem> drain() {
        List<ResultItem> items = new ArrayList<>();
        queue.drainTo(items);
        return items;
    }

    @Test
    public void start_allRowsEnqueued_doneAndConnectionReleased() throws InterruptedException {
        StubConnectionPool pool = StubConnectionPool.withRows("1", 10, 20, 30);
        QueryRunner runner = runner(pool, queue, RunnerSettings.DEFAULTS);

        runner.start();
        await(runner::done);

        List<ResultItem> items = drain();
        assertEquals(List.of(10, 20, 30), items.stream().map(item -> item.row().getPosition()).toList());
        assertEquals(1, pool.acquired.get());
        assertEquals(1, pool.released.get());
        assertTrue(runner.started());
        assertFalse(runner.closed());
        assertFalse(runner.abandoned());
    }

    @Test
    public void start_twice_throwsIllegalState() {
        QueryRunner runner = runner(StubConnectionPool.withRows("1"), queue, RunnerSettings.DEFAULTS);

        runner.start();

        assertThrows(IllegalStateException.class, runner::start);
    }

    @Test
    public void adapt_postFilter_dropsRejectedRows() throws InterruptedException {
        QueryRunner runner = runner(StubConnectionPool.withRows("1", 10, 20, 30), queue, RunnerSettings.DEFAULTS)
                .adapt(row -> row.getPosition() != 20);

        runner.start();
        await(runner::done);

        assertEquals(List.of(10, 30), drain().stream().map(item -> item.row().getPosition()).toList());
        assertThrows(IllegalStateException.class, () -> runner.adapt(row -> true));
    }

    @Test
    public void close_beforeStart_doneWithoutTouchingBackend() throws InterruptedException {
        StubConnectionPool pool = StubConnectionPool.withRows("1", 10);
        QueryRunner runner = runner(pool, queue, RunnerSettings.DEFAULTS);

        runner.close();
        assertTrue(runner.done());
        runner.start();
        Thread.sleep(50);

        assertEquals(0, pool.acquired.get());
        assertTrue(drain().isEmpty());
        assertTrue(runner.closed());
    }

    @Test
    public void close_twice_idempotent() {
        QueryRunner runner = runner(StubConnectionPool.withRows("1"), queue, RunnerSettings.DEFAULTS);

        runner.close();
        runner.close();

        assertTrue(runner.closed());
        assertFalse(runner.started());
    }

    @Test
    public void backendFailure_enqueuesErrorWithRunnerId() throws InterruptedException {
        StubConnectionPool pool = StubConnectionPool.failingAfter(new IllegalStateException("disk on fire"), "1", 10);
        QueryRunner runner = runner(pool, queue, RunnerSettings.DEFAULTS);

        runner.start();
        await(runner::done);

        List<ResultItem> items = drain();
        assertEquals(2, items.size());
        assertEquals(10, items.get(0).row().getPosition());
        BackendExecutionException error = items.get(1).error();
        assertEquals("study1-0", error.getRunnerId());
        assertTrue(error.getMessage().contains("disk on fire"));
        assertEquals(1, pool.released.get());
    }

    @Test
    public void deserializerError_enqueuesErrorItemAndReleasesConnection() throws InterruptedException {
        StubConnectionPool pool = StubConnectionPool.withRows("1", 10, 20, 30);
        VariantDeserializer deserializer = (raw, shape) -> {
            if (Integer.valueOf(20).equals(raw.get("position"))) {
                throw new ExceptionInInitializerError("codec class failed to load");
            }
            return StubConnectionPool.DESERIALIZER.deserialize(raw, shape);
        };
        QueryRunner runner = new QueryRunner("study1-0", StubConnectionPool.query(), pool, deserializer, queue,
                RunnerSettings.DEFAULTS, threadFactory);

        runner.start();
        await(runner::done);

        List<ResultItem> items = drain();
        assertEquals(2, items.size());
        assertEquals(10, items.get(0).row().getPosition());
        BackendExecutionException error = items.get(1).error();
        assertEquals("study1-0", error.getRunnerId());
        assertInstanceOf(ExceptionInInitializerError.class, error.getCause());
        assertEquals(1, pool.released.get());
    }

    @Test
    public void close_whileExecuting_cancelsBackendAndReportsNothing() throws InterruptedException {
        StubConnectionPool pool = StubConnectionPool.blockingAfter("1", 10);
        QueryRunner runner = runner(pool, queue, RunnerSettings.DEFAULTS);

        runner.start();
        await(() -> !queue.isEmpty());
        runner.close();
        await(runner::done);

        assertEquals(1, pool.cancelled.get());
        assertEquals(1, pool.released.get());
        List<ResultItem> items = drain();
        assertEquals(1, items.size());
        assertFalse(items.get(0).isError());
    }

    @Test
    public void enqueue_noConsumer_closesItselfAfterMaxAttempts() throws InterruptedException {
        BlockingQueue<ResultItem> smallQueue = new ArrayBlockingQueue<>(1);
        RunnerSettings settings = RunnerSettings.builder().offerTimeoutMs(1).warnEvery(2).maxOfferAttempts(5).build();
        QueryRunner runner = runner(StubConnectionPool.withRows("1", 10, 20, 30), smallQueue, settings);

        runner.start();
        await(runner::done);

        assertTrue(runner.abandoned());
        assertTrue(runner.closed());
        assertEquals(1, smallQueue.size());
        assertNull(smallQueue.poll(10, TimeUnit.MILLISECONDS).error());
    }
}
