package com.flagship.rural_ledger.realtime;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Starts a fresh daemon thread per callback. No ordering between callbacks
 * and no backpressure: a burst of events is a burst of threads.
 */
@Slf4j
public class DetachedChangeDispatcher implements ChangeDispatcher {

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void dispatch(Runnable callback) {
        Thread thread = new Thread(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Change callback failed", e);
            }
        }, "realtime-callback-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
    }
}
