package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.rural_ledger.sync.ChangeSubscription;
import com.flagship.rural_ledger.sync.SyncBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Change feed over the backend's Phoenix-protocol realtime websocket.
 *
 * One socket carries every topic. A topic is joined with a
 * {@code postgres_changes} config for all event kinds of one table; the
 * {@code data} object of each change message is passed to the topic's
 * consumer. A heartbeat is sent on the bridge worker while any topic is
 * joined.
 */
@Slf4j
public class PhoenixChangeFeedTransport extends TextWebSocketHandler implements ChangeFeedTransport {

    static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    private static final long CONNECT_TIMEOUT_SECONDS = 10;

    private final WebSocketClient client;
    private final SyncBridge bridge;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String apiKey;
    private final Map<String, Consumer<JsonNode>> consumers = new ConcurrentHashMap<>();
    private final AtomicLong ref = new AtomicLong();
    private volatile WebSocketSession socket;
    private volatile ScheduledFuture<?> heartbeat;

    public PhoenixChangeFeedTransport(WebSocketClient client, SyncBridge bridge, ObjectMapper objectMapper,
                                      String remoteUrl, String apiKey) {
        this.client = client;
        this.bridge = bridge;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.endpoint = websocketEndpoint(remoteUrl, apiKey);
    }

    static URI websocketEndpoint(String remoteUrl, String apiKey) {
        String base = remoteUrl.endsWith("/") ? remoteUrl.substring(0, remoteUrl.length() - 1) : remoteUrl;
        return UriComponentsBuilder.fromUriString(base.replaceFirst("^http", "ws"))
            .path("/realtime/v1/websocket")
            .queryParam("apikey", apiKey)
            .queryParam("vsn", "1.0.0")
            .build().encode().toUri();
    }

    @Override
    public ChangeSubscription subscribe(String schema, String table, Consumer<JsonNode> onMessage) throws Exception {
        String topic = "realtime:" + table;
        WebSocketSession session = connect();
        consumers.put(topic, onMessage);

        ObjectNode change = objectMapper.createObjectNode()
            .put("event", ChangeKind.ALL.getWireName())
            .put("schema", schema)
            .put("table", table);
        ObjectNode config = objectMapper.createObjectNode();
        config.putObject("broadcast").put("self", false);
        config.putObject("presence").put("key", "");
        config.putArray("postgres_changes").add(change);
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("config", config);
        payload.put("access_token", apiKey);

        send(session, topic, "phx_join", payload);
        log.info("Joined realtime topic {}", topic);
        return new PhoenixSubscription(topic);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode frame = objectMapper.readTree(message.getPayload());
        String topic = frame.path("topic").asText();
        String event = frame.path("event").asText();
        switch (event) {
            case "postgres_changes" -> {
                Consumer<JsonNode> consumer = consumers.get(topic);
                if (consumer != null) {
                    consumer.accept(frame.path("payload").path("data"));
                }
            }
            case "phx_reply" -> {
                String status = frame.path("payload").path("status").asText();
                if (!"ok".equals(status)) {
                    log.warn("Realtime reply on {} with status {}: {}", topic, status, frame.path("payload"));
                }
            }
            case "phx_error", "system" -> log.warn("Realtime {} on {}: {}", event, topic, frame.path("payload"));
            default -> log.debug("Ignoring realtime event {} on {}", event, topic);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Realtime socket closed: {}", status);
        stopHeartbeat();
        socket = null;
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Realtime transport error: {}", exception.getMessage());
    }

    private synchronized WebSocketSession connect() throws Exception {
        WebSocketSession current = socket;
        if (current != null && current.isOpen()) {
            return current;
        }
        WebSocketSession opened = client.execute(this, new WebSocketHttpHeaders(), endpoint)
            .get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        socket = new ConcurrentWebSocketSessionDecorator(opened, 5000, 64 * 1024);
        heartbeat = bridge.scheduleAtFixedRate(this::sendHeartbeat, HEARTBEAT_INTERVAL);
        log.info("Realtime socket connected to {}", endpoint.getHost());
        return socket;
    }

    private void sendHeartbeat() {
        WebSocketSession current = socket;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            send(current, "phoenix", "heartbeat", objectMapper.createObjectNode());
        } catch (IOException | RuntimeException e) {
            log.warn("Realtime heartbeat failed: {}", e.getMessage());
        }
    }

    private void send(WebSocketSession session, String topic, String event, JsonNode payload) throws IOException {
        ObjectNode frame = objectMapper.createObjectNode()
            .put("topic", topic)
            .put("event", event)
            .put("ref", String.valueOf(ref.incrementAndGet()));
        frame.set("payload", payload);
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> current = heartbeat;
        if (current != null) {
            current.cancel(false);
            heartbeat = null;
        }
    }

    private synchronized void leave(String topic) throws IOException {
        consumers.remove(topic);
        WebSocketSession current = socket;
        if (current == null || !current.isOpen()) {
            return;
        }
        send(current, topic, "phx_leave", objectMapper.createObjectNode());
        log.info("Left realtime topic {}", topic);
        if (consumers.isEmpty()) {
            stopHeartbeat();
            current.close(CloseStatus.NORMAL);
        }
    }

    private class PhoenixSubscription implements ChangeSubscription {

        private final String topic;

        PhoenixSubscription(String topic) {
            this.topic = topic;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public void unsubscribe() throws IOException {
            leave(topic);
        }
    }
}
