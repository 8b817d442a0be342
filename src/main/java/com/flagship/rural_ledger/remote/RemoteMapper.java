package com.flagship.rural_ledger.remote;

import com.flagship.rural_ledger.ledger.BalanceSign;
import com.flagship.rural_ledger.ledger.EntryKind;
import com.flagship.rural_ledger.ledger.LedgerEntry;
import com.flagship.rural_ledger.ledger.OrdinalDate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between remote ledger rows (column name to value, references by
 * id) and the local shapes.
 */
public final class RemoteMapper {

    private RemoteMapper() {
    }

    /**
     * Flattens a remote row for display. Names are resolved from the two
     * indexes, which the caller builds with one lookup per reference table.
     */
    public static LocalTuple toLocalTuple(Map<String, Object> row,
                                          Map<Long, String> propertyNames,
                                          Map<Long, String> counterpartyNames) {
        BalanceSign sign = BalanceSign.fromCode(asText(row.get("balance_sign")));
        return new LocalTuple(
            asLong(row.get("id")),
            OrdinalDate.toDisplay(asText(row.get("date"))),
            nameOf(propertyNames, row.get("property_id")),
            asText(row.get("document_number")),
            nameOf(counterpartyNames, row.get("counterparty_id")),
            asText(row.get("description")),
            EntryKind.fromCode((int) asLong(row.get("kind"))).getLabel(),
            asAmount(row.get("credit")),
            asAmount(row.get("debit")),
            sign.apply(asAmount(row.get("closing_balance"))),
            textOrEmpty(row.get("author")));
    }

    /**
     * Remote row for an upsert on {@code id}: every column is sent, so a
     * collision overwrites the whole row.
     */
    public static Map<String, Object> toRemoteRow(LedgerEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (entry.getId() != null) {
            row.put("id", entry.getId());
        }
        row.put("date", entry.getDate() != null ? entry.getDate().toString() : null);
        row.put("property_id", entry.getPropertyId());
        row.put("account_id", entry.getAccountId());
        row.put("document_number", entry.getDocumentNumber());
        row.put("document_type", entry.getDocumentType());
        row.put("description", entry.getDescription());
        row.put("counterparty_id", entry.getCounterpartyId());
        row.put("kind", (entry.getKind() != null ? entry.getKind() : EntryKind.ADVANCE).getCode());
        row.put("credit", orZero(entry.getCredit()));
        row.put("debit", orZero(entry.getDebit()));
        row.put("closing_balance", orZero(entry.getClosingBalance()));
        row.put("balance_sign", (entry.getBalanceSign() != null ? entry.getBalanceSign() : BalanceSign.POSITIVE).getCode());
        row.put("author", entry.getAuthor());
        row.put("category", entry.getCategory());
        row.put("ordinal_date", entry.getOrdinalDate());
        row.put("affected_area", entry.getAffectedArea());
        row.put("quantity", entry.getQuantity());
        row.put("unit", entry.getUnit());
        return row;
    }

    /**
     * Reads a remote row (a change-feed record or a select result) into an entry.
     */
    public static LedgerEntry toLedgerEntry(Map<String, Object> row) {
        return LedgerEntry.builder()
            .id(asLongOrNull(row.get("id")))
            .date(OrdinalDate.parseLegacy(asText(row.get("date"))).orElse(null))
            .propertyId(asLongOrNull(row.get("property_id")))
            .accountId(asLongOrNull(row.get("account_id")))
            .documentNumber(asText(row.get("document_number")))
            .documentType(asText(row.get("document_type")))
            .description(asText(row.get("description")))
            .counterpartyId(asLongOrNull(row.get("counterparty_id")))
            .kind(EntryKind.fromCode((int) asLong(row.get("kind"))))
            .credit(asAmount(row.get("credit")))
            .debit(asAmount(row.get("debit")))
            .closingBalance(asAmount(row.get("closing_balance")))
            .balanceSign(BalanceSign.fromCode(asText(row.get("balance_sign"))))
            .author(asText(row.get("author")))
            .category(asText(row.get("category")))
            .affectedArea(asText(row.get("affected_area")))
            .quantity(row.get("quantity") != null ? asAmount(row.get("quantity")) : null)
            .unit(asText(row.get("unit")))
            .build();
    }

    static Long asLongOrNull(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text).longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static long asLong(Object value) {
        Long parsed = asLongOrNull(value);
        return parsed != null ? parsed : 0L;
    }

    static BigDecimal asAmount(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private static String nameOf(Map<Long, String> names, Object id) {
        Long key = asLongOrNull(id);
        if (key == null) {
            return "";
        }
        String name = names.get(key);
        return name != null ? name : "";
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String textOrEmpty(Object value) {
        return value != null ? value.toString() : "";
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
