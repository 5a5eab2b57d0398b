package com.trading.opg.engine;

import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size pool of worker threads scoped to one run.
 *
 * Tasks go in through {@link #submit} and come back, in completion order,
 * through {@link #take}. The pool is the only shared mutable resource of a
 * run and is closed on every exit path.
 *
 * @param <T> task result type
 */
final class WorkerPool<T> implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(WorkerPool.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final ExecutorService executor;
    private final CompletionService<T> completion;
    private final int size;

    WorkerPool(int size) {
        this.size = size;
        this.executor = Executors.newFixedThreadPool(size, DaemonThreadFactory.INSTANCE);
        this.completion = new ExecutorCompletionService<>(executor);
    }

    void submit(Callable<T> task) {
        completion.submit(task);
    }

    /**
     * Blocks until some submitted task completes.
     *
     * @throws InterruptedException if the calling thread is interrupted
     */
    T take() throws InterruptedException {
        try {
            return completion.take().get();
        } catch (ExecutionException e) {
            // tasks report their own failures; this only happens on a bug in the task wrapper
            throw new IllegalStateException("Worker task failed unexpectedly", e.getCause());
        }
    }

    int size() {
        return size;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not drain within {}s, interrupting workers", SHUTDOWN_GRACE_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
