package com.flagship.rural_ledger.sync;

/**
 * Unit of remote work run on the bridge worker against the shared session.
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    T apply(RemoteSession session) throws Exception;
}
