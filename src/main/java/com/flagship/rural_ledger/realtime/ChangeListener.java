package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Application callback for remote row changes.
 */
@FunctionalInterface
public interface ChangeListener {

    void onChange(ChangeKind kind, JsonNode payload);
}
