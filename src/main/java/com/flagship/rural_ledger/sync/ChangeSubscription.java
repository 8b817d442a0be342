package com.flagship.rural_ledger.sync;

/**
 * An active change-feed subscription the bridge unsubscribes on shutdown.
 */
public interface ChangeSubscription {

    String topic();

    void unsubscribe() throws Exception;
}
