package com.flagship.rural_ledger.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

import java.util.List;

/**
 * Response of the identity lookup API, or the error sentinel
 * {@code {"status":"ERROR","message":"RATE_LIMIT_OR_NETWORK"}}.
 */
@Value
public class LookupResult {

    public static final String ERROR_STATUS = "ERROR";
    public static final String RATE_LIMIT_OR_NETWORK = "RATE_LIMIT_OR_NETWORK";

    private static final List<String> NAME_FIELDS =
        List.of("nome", "razao_social", "razaosocial", "razaoSocial", "fantasia", "nome_fantasia");

    JsonNode data;

    public static LookupResult error() {
        ObjectNode node = JsonNodeFactory.instance.objectNode()
            .put("status", ERROR_STATUS)
            .put("message", RATE_LIMIT_OR_NETWORK);
        return new LookupResult(node);
    }

    public boolean isError() {
        return data == null || ERROR_STATUS.equalsIgnoreCase(data.path("status").asText());
    }

    /**
     * First non-blank of the name fields the lookup APIs use, or "".
     */
    public String displayName() {
        if (data == null || !data.isObject()) {
            return "";
        }
        for (String field : NAME_FIELDS) {
            JsonNode value = data.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return "";
    }
}
