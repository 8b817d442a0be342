package com.flagship.rural_ledger.sync;

/**
 * Creates the remote session. Called once, on the bridge worker.
 */
@FunctionalInterface
public interface RemoteSessionFactory {

    RemoteSession create() throws Exception;
}
