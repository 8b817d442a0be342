package com.flagship.rural_ledger.ledger;

import com.flagship.rural_ledger.store.EmbeddedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reads and writes ledger entries in the embedded store.
 *
 * This store enforces:
 * 1. The ordinal date key is always written from the entry's date
 * 2. Identifiers come from the AUTOINCREMENT sequence and are never reused
 * 3. Listings are ordered by ordinal date descending, then id descending
 * 4. Closing balances run per account in id order, mirrored entries excepted
 *
 * Single writes auto-commit; {@link #withBulkTransaction(Function)} groups
 * many writes into one exclusive, all-or-nothing transaction.
 */
@Slf4j
public class LedgerStore {

    private static final String ENTRY_COLUMNS =
        "id, date, property_id, account_id, document_number, document_type, description, " +
        "counterparty_id, kind, credit, debit, closing_balance, balance_sign, author, " +
        "category, ordinal_date, affected_area, quantity, unit";

    private static final String INSERT_ENTRY =
        "INSERT INTO ledger_entry (date, property_id, account_id, document_number, document_type, " +
        "description, counterparty_id, kind, credit, debit, closing_balance, balance_sign, author, " +
        "category, ordinal_date, affected_area, quantity, unit) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String MIRROR_ENTRY =
        "INSERT OR REPLACE INTO ledger_entry (" + ENTRY_COLUMNS + ") " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_ENTRY =
        "UPDATE ledger_entry SET date = ?, property_id = ?, account_id = ?, document_number = ?, " +
        "document_type = ?, description = ?, counterparty_id = ?, kind = ?, credit = ?, debit = ?, " +
        "closing_balance = ?, balance_sign = ?, author = ?, category = ?, ordinal_date = ?, " +
        "affected_area = ?, quantity = ?, unit = ? WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public LedgerStore(EmbeddedStore store) {
        this.jdbcTemplate = store.getJdbcTemplate();
        this.transactionTemplate = store.getTransactionTemplate();
    }

    /**
     * Creates an entry and returns it with its assigned id.
     *
     * The closing balance is the account's latest signed balance plus credit
     * minus debit; any balance the caller set is replaced.
     *
     * @throws ValidationException if the date, kind or amounts are invalid or a
     *         referenced property, account or counterparty does not exist
     */
    public LedgerEntry createEntry(LedgerEntry entry) {
        LedgerEntry valid = validate(entry);
        LedgerEntry created = transactionTemplate.execute(status -> {
            LedgerEntry balanced = withRunningBalance(valid, latestSignedBalance(valid.getAccountId(), null));
            jdbcTemplate.update(INSERT_ENTRY, columnValues(balanced).toArray());
            Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
            return balanced.toBuilder().id(id).build();
        });
        log.debug("Created ledger entry {} on {}", created.getId(), created.getDate());
        return created;
    }

    /**
     * Replaces every field of an existing entry. The id is kept.
     *
     * The entry's balance is recomputed from the previous entry of its account,
     * then every later entry of that account is rebalanced in the same
     * transaction. When the entry moved to another account, the later entries
     * of the old account are rebalanced too.
     *
     * @throws IllegalArgumentException if no entry has the given id
     */
    public LedgerEntry updateEntry(LedgerEntry entry) {
        if (entry.getId() == null) {
            throw new ValidationException("Cannot update an entry without id");
        }
        LedgerEntry valid = validate(entry);
        long id = valid.getId();
        LedgerEntry updated = transactionTemplate.execute(status -> {
            List<Long> previousAccount = jdbcTemplate.query(
                "SELECT account_id FROM ledger_entry WHERE id = ?",
                (rs, rowNum) -> nullableLong(rs, "account_id"), id);
            if (previousAccount.isEmpty()) {
                throw new IllegalArgumentException("Ledger entry not found: " + id);
            }
            LedgerEntry balanced = withRunningBalance(valid, latestSignedBalance(valid.getAccountId(), id));
            List<Object> args = columnValues(balanced);
            args.add(id);
            jdbcTemplate.update(UPDATE_ENTRY, args.toArray());

            int rebalanced = rebalanceAfter(valid.getAccountId(), id, balanced.getSignedBalance());
            Long oldAccount = previousAccount.get(0);
            if (oldAccount != null && !oldAccount.equals(valid.getAccountId())) {
                rebalanced += rebalanceAfter(oldAccount, id, latestSignedBalance(oldAccount, id));
            }
            log.debug("Updated ledger entry {}, rebalanced {} later entries", id, rebalanced);
            return balanced;
        });
        return updated;
    }

    /**
     * Deletes an entry. Its id is never handed out again.
     *
     * @return true if an entry was deleted
     */
    public boolean deleteEntry(long id) {
        boolean deleted = jdbcTemplate.update("DELETE FROM ledger_entry WHERE id = ?", id) > 0;
        if (deleted) {
            log.debug("Deleted ledger entry {}", id);
        }
        return deleted;
    }

    /**
     * Writes an entry under the id it already carries, replacing any row with
     * that id. Used to reflect remote changes locally; last write wins.
     */
    public void mirrorEntry(LedgerEntry entry) {
        if (entry.getId() == null || entry.getDate() == null) {
            throw new ValidationException("Mirrored entry needs an id and a date");
        }
        List<Object> args = new ArrayList<>();
        args.add(entry.getId());
        args.addAll(columnValues(entry.toBuilder()
            .documentNumber(normalizeDocumentNumber(entry.getDocumentNumber()))
            .build()));
        jdbcTemplate.update(MIRROR_ENTRY, args.toArray());
        log.debug("Mirrored ledger entry {}", entry.getId());
    }

    public Optional<LedgerEntry> getEntry(long id) {
        List<LedgerEntry> rows = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entry WHERE id = ?", entryRowMapper(), id);
        return rows.stream().findFirst();
    }

    /**
     * Lists entries whose ordinal date falls in {@code range}, newest first
     * (ordinal date descending, then id descending). Runs a fresh query per call.
     */
    public List<LedgerEntry> listEntries(OrdinalRange range, EntryFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + ENTRY_COLUMNS
            + " FROM ledger_entry WHERE ordinal_date BETWEEN ? AND ?");
        List<Object> args = new ArrayList<>(List.of(range.getFrom(), range.getTo()));
        EntryFilter f = filter != null ? filter : EntryFilter.none();
        if (f.getPropertyId() != null) {
            sql.append(" AND property_id = ?");
            args.add(f.getPropertyId());
        }
        if (f.getAccountId() != null) {
            sql.append(" AND account_id = ?");
            args.add(f.getAccountId());
        }
        if (f.getCounterpartyId() != null) {
            sql.append(" AND counterparty_id = ?");
            args.add(f.getCounterpartyId());
        }
        if (f.getKind() != null) {
            sql.append(" AND kind = ?");
            args.add(f.getKind().getCode());
        }
        if (f.getCategory() != null) {
            sql.append(" AND category = ?");
            args.add(f.getCategory());
        }
        if (f.getDescriptionContains() != null && !f.getDescriptionContains().isBlank()) {
            sql.append(" AND description LIKE ?");
            args.add("%" + f.getDescriptionContains().trim() + "%");
        }
        sql.append(" ORDER BY ordinal_date DESC, id DESC");
        return jdbcTemplate.query(sql.toString(), entryRowMapper(), args.toArray());
    }

    /**
     * Signed balance of the account's most recent entry.
     */
    public Optional<AccountBalance> accountBalance(long accountId) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT account_id, entry_id, signed_balance FROM v_account_balance WHERE account_id = ?",
            accountBalanceRowMapper(), accountId);
        return rows.stream().findFirst();
    }

    public List<AccountBalance> accountBalances() {
        return jdbcTemplate.query(
            "SELECT account_id, entry_id, signed_balance FROM v_account_balance ORDER BY account_id",
            accountBalanceRowMapper());
    }

    /**
     * Monthly credit and debit totals per category for the months the range touches.
     */
    public List<CategorySummary> categorySummary(OrdinalRange range) {
        return jdbcTemplate.query(
            "SELECT category, year, month, total_credit, total_debit FROM v_category_summary " +
            "WHERE year * 100 + month BETWEEN ? AND ? ORDER BY year, month, category",
            (rs, rowNum) -> new CategorySummary(
                rs.getString("category"),
                rs.getInt("year"),
                rs.getInt("month"),
                amount(rs, "total_credit"),
                amount(rs, "total_debit")),
            range.getFrom() / 100, range.getTo() / 100);
    }

    /**
     * Earliest and latest ordinal dates in the store, empty when no entry is dated.
     */
    public Optional<OrdinalRange> ordinalBounds() {
        return jdbcTemplate.query(
            "SELECT MIN(ordinal_date) AS lo, MAX(ordinal_date) AS hi FROM ledger_entry WHERE ordinal_date IS NOT NULL",
            rs -> {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int lo = rs.getInt("lo");
                if (rs.wasNull()) {
                    return Optional.empty();
                }
                return Optional.of(OrdinalRange.of(lo, rs.getInt("hi")));
            });
    }

    public PeriodTotals totals(OrdinalRange range) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(credit), 0) AS total_credit, COALESCE(SUM(debit), 0) AS total_debit " +
            "FROM ledger_entry WHERE ordinal_date BETWEEN ? AND ?",
            (rs, rowNum) -> new PeriodTotals("", amount(rs, "total_credit"), amount(rs, "total_debit")),
            range.getFrom(), range.getTo());
    }

    public List<PeriodTotals> monthlyTotals(OrdinalRange range) {
        return jdbcTemplate.query(
            "SELECT substr(CAST(ordinal_date AS TEXT), 1, 6) AS ym, " +
            "       COALESCE(SUM(credit), 0) AS total_credit, COALESCE(SUM(debit), 0) AS total_debit " +
            "FROM ledger_entry WHERE ordinal_date BETWEEN ? AND ? GROUP BY ym ORDER BY ym",
            (rs, rowNum) -> new PeriodTotals(rs.getString("ym"), amount(rs, "total_credit"), amount(rs, "total_debit")),
            range.getFrom(), range.getTo());
    }

    /**
     * Runs {@code work} inside one exclusive write transaction. Every write the
     * work performs through this store (or a {@link ReferenceStore} on the same
     * file) commits together, or none does if anything throws.
     */
    public <T> T withBulkTransaction(Function<LedgerStore, T> work) {
        long start = System.nanoTime();
        T result = transactionTemplate.execute(status -> work.apply(this));
        log.debug("Bulk transaction committed in {} ms", (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    public void runInBulkTransaction(Consumer<LedgerStore> work) {
        withBulkTransaction(store -> {
            work.accept(store);
            return null;
        });
    }

    /**
     * Signed balance of the account's newest entry, or of its newest entry
     * below {@code beforeId}; zero when there is none.
     */
    private BigDecimal latestSignedBalance(long accountId, Long beforeId) {
        String sql = "SELECT closing_balance, balance_sign FROM ledger_entry WHERE account_id = ?"
            + (beforeId != null ? " AND id < ?" : "") + " ORDER BY id DESC LIMIT 1";
        Object[] args = beforeId != null ? new Object[] {accountId, beforeId} : new Object[] {accountId};
        List<BigDecimal> rows = jdbcTemplate.query(sql,
            (rs, rowNum) -> BalanceSign.fromCode(rs.getString("balance_sign")).apply(amount(rs, "closing_balance")),
            args);
        return rows.isEmpty() ? BigDecimal.ZERO : rows.get(0);
    }

    private int rebalanceAfter(long accountId, long afterId, BigDecimal startingBalance) {
        List<LedgerEntry> later = jdbcTemplate.query(
            "SELECT id, credit, debit FROM ledger_entry WHERE account_id = ? AND id > ? ORDER BY id",
            (rs, rowNum) -> LedgerEntry.builder()
                .id(rs.getLong("id"))
                .credit(amount(rs, "credit"))
                .debit(amount(rs, "debit"))
                .build(),
            accountId, afterId);
        BigDecimal running = startingBalance;
        for (LedgerEntry row : later) {
            LedgerEntry balanced = withRunningBalance(row, running);
            jdbcTemplate.update("UPDATE ledger_entry SET closing_balance = ?, balance_sign = ? WHERE id = ?",
                balanced.getClosingBalance(), balanced.getBalanceSign().getCode(), row.getId());
            running = balanced.getSignedBalance();
        }
        return later.size();
    }

    static LedgerEntry withRunningBalance(LedgerEntry entry, BigDecimal previousBalance) {
        BigDecimal balance = previousBalance.add(orZero(entry.getCredit())).subtract(orZero(entry.getDebit()));
        return entry.toBuilder()
            .closingBalance(balance.abs())
            .balanceSign(balance.signum() >= 0 ? BalanceSign.POSITIVE : BalanceSign.NEGATIVE)
            .build();
    }

    private LedgerEntry validate(LedgerEntry entry) {
        if (entry.getDate() == null) {
            throw new ValidationException("Ledger entry date is required");
        }
        if (entry.getKind() == null) {
            throw new ValidationException("Ledger entry kind is required");
        }
        requireNonNegative("credit", entry.getCredit());
        requireNonNegative("debit", entry.getDebit());
        requireNonNegative("closing balance", entry.getClosingBalance());
        requireReference("property", entry.getPropertyId(), true);
        requireReference("bank_account", entry.getAccountId(), true);
        requireReference("counterparty", entry.getCounterpartyId(), false);
        return entry.toBuilder()
            .documentNumber(normalizeDocumentNumber(entry.getDocumentNumber()))
            .credit(orZero(entry.getCredit()))
            .debit(orZero(entry.getDebit()))
            .closingBalance(orZero(entry.getClosingBalance()))
            .balanceSign(entry.getBalanceSign() != null ? entry.getBalanceSign() : BalanceSign.POSITIVE)
            .build();
    }

    private void requireReference(String table, Long id, boolean required) {
        if (id == null) {
            if (required) {
                throw new ValidationException("Ledger entry " + table + " reference is required");
            }
            return;
        }
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        if (count == null || count == 0) {
            throw new ValidationException(table + " not found: " + id);
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new ValidationException("Ledger entry " + field + " must not be negative: " + value);
        }
    }

    /**
     * Keeps only the digits of a document number; null when none remain.
     */
    static String normalizeDocumentNumber(String documentNumber) {
        if (documentNumber == null) {
            return null;
        }
        String digits = documentNumber.replaceAll("\\D+", "");
        return digits.isEmpty() ? null : digits;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Values in the column order of INSERT_ENTRY (everything but id).
     */
    private static List<Object> columnValues(LedgerEntry e) {
        List<Object> values = new ArrayList<>();
        values.add(e.getDate().toString());
        values.add(e.getPropertyId());
        values.add(e.getAccountId());
        values.add(e.getDocumentNumber());
        values.add(e.getDocumentType());
        values.add(e.getDescription());
        values.add(e.getCounterpartyId());
        values.add(e.getKind() != null ? e.getKind().getCode() : EntryKind.ADVANCE.getCode());
        values.add(orZero(e.getCredit()));
        values.add(orZero(e.getDebit()));
        values.add(orZero(e.getClosingBalance()));
        values.add(e.getBalanceSign() != null ? e.getBalanceSign().getCode() : BalanceSign.POSITIVE.getCode());
        values.add(e.getAuthor());
        values.add(e.getCategory());
        values.add(e.getOrdinalDate());
        values.add(e.getAffectedArea());
        values.add(e.getQuantity());
        values.add(e.getUnit());
        return values;
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getLong("id"))
            .date(OrdinalDate.parseLegacy(rs.getString("date")).orElse(null))
            .propertyId(nullableLong(rs, "property_id"))
            .accountId(nullableLong(rs, "account_id"))
            .documentNumber(rs.getString("document_number"))
            .documentType(rs.getString("document_type"))
            .description(rs.getString("description"))
            .counterpartyId(nullableLong(rs, "counterparty_id"))
            .kind(EntryKind.fromCode(rs.getInt("kind")))
            .credit(amount(rs, "credit"))
            .debit(amount(rs, "debit"))
            .closingBalance(amount(rs, "closing_balance"))
            .balanceSign(BalanceSign.fromCode(rs.getString("balance_sign")))
            .author(rs.getString("author"))
            .category(rs.getString("category"))
            .affectedArea(rs.getString("affected_area"))
            .quantity(rs.getBigDecimal("quantity"))
            .unit(rs.getString("unit"))
            .build();
    }

    private RowMapper<AccountBalance> accountBalanceRowMapper() {
        return (rs, rowNum) -> new AccountBalance(
            rs.getLong("account_id"),
            rs.getLong("entry_id"),
            amount(rs, "signed_balance"));
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static BigDecimal amount(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value : BigDecimal.ZERO;
    }
}
