package com.tide.qc.diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget wrapper that moves diagnostic work off the scan thread.
 * Events are queued on a bounded single-thread executor; when the queue is full
 * the event is dropped and counted instead of blocking the scan.
 */
public class AsyncDiagnosticDispatcher implements SpikeDiagnosticListener {

    private static final Logger logger = LoggerFactory.getLogger(AsyncDiagnosticDispatcher.class);

    private final SpikeDiagnosticListener delegate;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public AsyncDiagnosticDispatcher(SpikeDiagnosticListener delegate, int queueCapacity) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
        this.executor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "spike-diagnostics");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void onDiagnostic(DiagnosticEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            long count = dropped.incrementAndGet();
            logger.warn("Diagnostic queue full, dropped event for row {} (total dropped={})",
                    event.getIndex(), count);
        }
    }

    private void deliver(DiagnosticEvent event) {
        try {
            delegate.onDiagnostic(event);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            logger.warn("Diagnostic listener failed for row {}: {}", event.getIndex(), e.getMessage(), e);
        }
    }

    /**
     * Drain queued events, then release the worker thread.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Diagnostic dispatcher did not drain in time, {} events pending",
                        executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        delegate.close();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
