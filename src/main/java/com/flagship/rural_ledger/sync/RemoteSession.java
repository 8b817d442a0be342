package com.flagship.rural_ledger.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Client of the remote relational backend. One instance per process, owned
 * by {@link SyncBridge} and only ever used from its worker thread.
 */
public interface RemoteSession extends AutoCloseable {

    List<Map<String, Object>> select(RemoteQuery query);

    /**
     * Inserts rows, overwriting any row whose {@code onConflict} column collides.
     *
     * @return the rows as stored remotely
     */
    List<Map<String, Object>> upsert(String table, List<Map<String, Object>> rows, String onConflict);

    /**
     * @return number of rows deleted
     */
    int delete(String table, String column, Object value);

    JsonNode rpc(String function, Map<String, Object> params);

    AuthSession signIn(String email, String password);

    void signOut();

    @Override
    default void close() {
    }
}
