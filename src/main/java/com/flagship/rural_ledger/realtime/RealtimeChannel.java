package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.rural_ledger.observability.SyncMetrics;
import com.flagship.rural_ledger.sync.ChangeSubscription;
import com.flagship.rural_ledger.sync.SyncBridge;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Change-feed subscriptions on top of {@link SyncBridge}.
 *
 * At most one underlying subscription exists per table for the life of the
 * process. Every event is handed to the {@link ChangeDispatcher} so callback
 * work never runs on the transport's receive loop.
 */
@Slf4j
public class RealtimeChannel {

    private final SyncBridge bridge;
    private final ChangeFeedTransport transport;
    private final ChangeDispatcher dispatcher;
    private final SyncMetrics metrics;
    private final String schema;
    private final Map<String, ChangeSubscription> subscriptions = new ConcurrentHashMap<>();

    public RealtimeChannel(SyncBridge bridge, ChangeFeedTransport transport, ChangeDispatcher dispatcher,
                           SyncMetrics metrics, String schema) {
        this.bridge = bridge;
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.schema = schema;
    }

    /**
     * Subscribes {@code onChange} to every change of {@code table}.
     *
     * Only the first call per table subscribes; later calls return the
     * existing subscription and their listener is not registered.
     */
    public ChangeSubscription subscribe(String table, ChangeListener onChange) {
        ChangeSubscription existing = subscriptions.get(table);
        if (existing != null) {
            log.debug("Already subscribed to {}, ignoring listener", table);
            return existing;
        }
        return subscriptions.computeIfAbsent(table, t -> {
            ChangeSubscription subscription = bridge.submit("realtime.subscribe",
                session -> transport.subscribe(schema, t, payload -> onMessage(t, payload, onChange)));
            bridge.track(subscription);
            log.info("Subscribed to changes of {}.{} on {}", schema, t, subscription.topic());
            return subscription;
        });
    }

    public boolean isSubscribed(String table) {
        return subscriptions.containsKey(table);
    }

    private void onMessage(String table, JsonNode payload, ChangeListener onChange) {
        ChangeKind kind = ChangeKind.of(payload);
        metrics.recordEvent(table, kind.name());
        log.debug("{} event on {}", kind, table);
        dispatcher.dispatch(() -> onChange.onChange(kind, payload));
    }
}
