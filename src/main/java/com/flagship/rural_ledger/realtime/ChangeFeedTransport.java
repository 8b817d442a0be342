package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.rural_ledger.sync.ChangeSubscription;

import java.util.function.Consumer;

/**
 * Push channel delivering row-level change payloads for one table.
 *
 * Implementations call {@code onMessage} from their own receive loop, which
 * must not be blocked.
 */
public interface ChangeFeedTransport {

    ChangeSubscription subscribe(String schema, String table, Consumer<JsonNode> onMessage) throws Exception;
}
