package com.flagship.rural_ledger.realtime;

/**
 * Runs change callbacks off the feed's receive loop.
 */
public interface ChangeDispatcher extends AutoCloseable {

    /**
     * Hands {@code callback} to another thread. Never blocks the caller.
     */
    void dispatch(Runnable callback);

    @Override
    default void close() {
    }
}
