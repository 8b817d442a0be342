package com.flagship.rural_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * Metrics for remote work and the change feed.
 *
 * - sync.operations: submitted operations by name and outcome
 * - sync.operation.latency: queue wait plus execution time
 * - realtime.events: change events received, by table and kind
 * - realtime.dispatch.rejected: callbacks dropped by a full dispatch queue
 */
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeSubscriptions = new AtomicInteger();

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        meterRegistry.gauge("realtime.subscriptions.active", activeSubscriptions);
    }

    public void recordOperation(String operation, boolean success, Duration elapsed) {
        String outcome = success ? "success" : "failure";
        meterRegistry.counter("sync.operations", "operation", operation, "outcome", outcome).increment();
        Timer.builder("sync.operation.latency")
            .tag("operation", operation)
            .register(meterRegistry)
            .record(elapsed);
    }

    public void recordSessionInitialized() {
        meterRegistry.counter("sync.session.initialized").increment();
    }

    public void recordEvent(String table, String kind) {
        meterRegistry.counter("realtime.events", "table", table, "kind", kind).increment();
    }

    public void recordDispatchRejected() {
        Counter.builder("realtime.dispatch.rejected")
            .description("Change callbacks dropped because the dispatch queue was full")
            .register(meterRegistry)
            .increment();
    }

    public void subscriptionOpened() {
        activeSubscriptions.incrementAndGet();
    }

    public void subscriptionsClosed(int count) {
        activeSubscriptions.addAndGet(-count);
    }

    /**
     * Registers a gauge over a queue depth supplier (bounded dispatcher).
     */
    public void registerQueueDepth(String name, IntSupplier depth) {
        Gauge.builder(name, depth, IntSupplier::getAsInt)
            .strongReference(true)
            .register(meterRegistry);
        log.debug("Registered gauge {}", name);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
