package com.flagship.rural_ledger.realtime;

import com.flagship.rural_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs callbacks on a small fixed pool behind a bounded queue. When the
 * queue is full the event is dropped, logged and counted; the feed's
 * receive loop is never blocked.
 */
@Slf4j
public class BoundedChangeDispatcher implements ChangeDispatcher {

    private final ThreadPoolExecutor executor;

    public BoundedChangeDispatcher(int poolSize, int queueCapacity, SyncMetrics metrics) {
        AtomicInteger threadCount = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "realtime-callback-" + threadCount.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity), threadFactory, (task, pool) -> {
                log.warn("Dropping change callback: dispatch queue full ({} queued)", pool.getQueue().size());
                metrics.recordDispatchRejected();
            });
        metrics.registerQueueDepth("realtime.dispatch.queue.size", () -> executor.getQueue().size());
        log.info("Bounded change dispatcher: {} threads, queue capacity {}", poolSize, queueCapacity);
    }

    @Override
    public void dispatch(Runnable callback) {
        executor.execute(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Change callback failed", e);
            }
        });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
