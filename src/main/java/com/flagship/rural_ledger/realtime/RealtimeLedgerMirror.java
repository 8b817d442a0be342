package com.flagship.rural_ledger.realtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.rural_ledger.ledger.LedgerEntry;
import com.flagship.rural_ledger.ledger.LedgerStore;
import com.flagship.rural_ledger.ledger.ValidationException;
import com.flagship.rural_ledger.remote.RemoteMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.Map;

/**
 * Applies remote ledger changes to the local store: inserts and updates are
 * written under the remote id, deletes remove the local row. Last write wins.
 */
@RequiredArgsConstructor
@Slf4j
public class RealtimeLedgerMirror implements ChangeListener {

    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {
    };

    private final LedgerStore ledgerStore;
    private final ObjectMapper objectMapper;

    @Override
    public void onChange(ChangeKind kind, JsonNode payload) {
        try {
            switch (kind) {
                case INSERT, UPDATE -> upsert(payload.path("record"));
                case DELETE -> delete(payload.path("old_record"));
                case ALL -> log.debug("Ignoring change without a kind: {}", payload);
            }
        } catch (ValidationException | DataAccessException e) {
            log.error("Could not mirror {} change {}: {}", kind, payload, e.getMessage());
        }
    }

    private void upsert(JsonNode record) {
        if (!record.isObject()) {
            log.warn("Change without a record, ignored");
            return;
        }
        LedgerEntry entry = RemoteMapper.toLedgerEntry(objectMapper.convertValue(record, ROW));
        ledgerStore.mirrorEntry(entry);
        log.debug("Mirrored remote entry {}", entry.getId());
    }

    private void delete(JsonNode oldRecord) {
        JsonNode id = oldRecord.path("id");
        if (!id.canConvertToLong()) {
            log.warn("Delete without an id, ignored");
            return;
        }
        boolean deleted = ledgerStore.deleteEntry(id.asLong());
        log.debug("Remote delete of {} (local row {})", id.asLong(), deleted ? "removed" : "absent");
    }
}
