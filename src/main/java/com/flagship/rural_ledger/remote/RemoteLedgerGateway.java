package com.flagship.rural_ledger.remote;

import com.flagship.rural_ledger.ledger.LedgerEntry;
import com.flagship.rural_ledger.ledger.OrdinalRange;
import com.flagship.rural_ledger.sync.RemoteQuery;
import com.flagship.rural_ledger.sync.SyncBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and writes the remote ledger table through the {@link SyncBridge}.
 */
@RequiredArgsConstructor
@Slf4j
public class RemoteLedgerGateway {

    public static final String LEDGER_TABLE = "ledger_entry";
    public static final String PROPERTY_TABLE = "property";
    public static final String COUNTERPARTY_TABLE = "counterparty";

    private static final String LIST_COLUMNS =
        "id,date,property_id,document_number,counterparty_id,description,kind,credit,debit," +
        "closing_balance,balance_sign,author,ordinal_date,account_id";

    private static final Comparator<Map<String, Object>> NEWEST_FIRST =
        Comparator.<Map<String, Object>>comparingLong(r -> ordinalOrMinus(r.get("ordinal_date"))).reversed()
            .thenComparing(Comparator.<Map<String, Object>>comparingLong(r -> RemoteMapper.asLong(r.get("id"))).reversed());

    private final SyncBridge bridge;

    /**
     * Entries in {@code range}, newest first, with display names resolved.
     *
     * Issues one query for the entries and at most one per reference table
     * for the names, whatever the number of rows.
     */
    public List<LocalTuple> listEntries(OrdinalRange range) {
        List<Map<String, Object>> rows = bridge.submit("ledger.list", session -> session.select(
            RemoteQuery.from(LEDGER_TABLE)
                .select(LIST_COLUMNS)
                .gte("ordinal_date", range.getFrom())
                .lte("ordinal_date", range.getTo())));

        Map<Long, String> propertyNames = names(PROPERTY_TABLE, distinctIds(rows, "property_id"));
        Map<Long, String> counterpartyNames = names(COUNTERPARTY_TABLE, distinctIds(rows, "counterparty_id"));

        List<LocalTuple> tuples = rows.stream()
            .sorted(NEWEST_FIRST)
            .map(row -> RemoteMapper.toLocalTuple(row, propertyNames, counterpartyNames))
            .toList();
        log.debug("Listed {} remote entries between {} and {}", tuples.size(), range.getFrom(), range.getTo());
        return tuples;
    }

    /**
     * Upserts {@code entry} by id. An existing remote row with the same id is
     * overwritten.
     */
    public void upsertEntry(LedgerEntry entry) {
        Map<String, Object> row = RemoteMapper.toRemoteRow(entry);
        bridge.submit("ledger.upsert", session -> session.upsert(LEDGER_TABLE, List.of(row), "id"));
        log.debug("Upserted remote entry {}", entry.getId());
    }

    public boolean deleteEntry(long id) {
        Integer deleted = bridge.submit("ledger.delete", session -> session.delete(LEDGER_TABLE, "id", id));
        return deleted != null && deleted > 0;
    }

    public Optional<OrdinalRange> ordinalBounds() {
        Optional<Integer> min = firstOrdinal(true);
        Optional<Integer> max = firstOrdinal(false);
        if (min.isEmpty() || max.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(OrdinalRange.of(min.get(), max.get()));
    }

    private Optional<Integer> firstOrdinal(boolean ascending) {
        List<Map<String, Object>> rows = bridge.submit("ledger.bounds", session -> session.select(
            RemoteQuery.from(LEDGER_TABLE)
                .select("ordinal_date")
                .order("ordinal_date", ascending)
                .limit(1)));
        return rows.stream()
            .map(r -> RemoteMapper.asLongOrNull(r.get("ordinal_date")))
            .filter(Objects::nonNull)
            .map(Long::intValue)
            .findFirst();
    }

    private Map<Long, String> names(String table, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        List<Map<String, Object>> rows = bridge.submit(table + ".names", session -> session.select(
            RemoteQuery.from(table).select("id,name").in("id", ids)));
        Map<Long, String> names = new HashMap<>();
        for (Map<String, Object> row : rows) {
            Long id = RemoteMapper.asLongOrNull(row.get("id"));
            if (id != null) {
                Object name = row.get("name");
                names.put(id, name != null ? name.toString() : "");
            }
        }
        return names;
    }

    private static Set<Long> distinctIds(List<Map<String, Object>> rows, String column) {
        Set<Long> ids = new TreeSet<>();
        for (Map<String, Object> row : rows) {
            Long id = RemoteMapper.asLongOrNull(row.get(column));
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static long ordinalOrMinus(Object value) {
        Long ordinal = RemoteMapper.asLongOrNull(value);
        return ordinal != null ? ordinal : -1L;
    }
}
