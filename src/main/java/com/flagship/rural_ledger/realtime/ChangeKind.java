package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Kind of a row-level change event. {@link #ALL} is the wildcard used when
 * an event does not say what it is.
 */
public enum ChangeKind {
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    ALL("*");

    private final String wireName;

    ChangeKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ChangeKind fromWireName(String name) {
        if (name == null) {
            return ALL;
        }
        for (ChangeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name.trim())) {
                return kind;
            }
        }
        return ALL;
    }

    /**
     * Reads the kind from a change payload: {@code eventType}, else {@code type}.
     */
    public static ChangeKind of(JsonNode payload) {
        if (payload == null) {
            return ALL;
        }
        JsonNode type = payload.hasNonNull("eventType") ? payload.get("eventType") : payload.get("type");
        return fromWireName(type != null && !type.isNull() ? type.asText() : null);
    }
}
