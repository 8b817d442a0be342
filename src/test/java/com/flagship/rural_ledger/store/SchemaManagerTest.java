package com.flagship.rural_ledger.store;

import com.flagship.rural_ledger.ledger.EntryKind;
import com.flagship.rural_ledger.ledger.LedgerEntry;
import com.flagship.rural_ledger.ledger.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema bootstrap and migration of store files.
 *
 * Legacy files are written with plain JDBC in the first-release layout: no
 * AUTOINCREMENT key and none of the later columns.
 */
class SchemaManagerTest {

    private static final String LEGACY_LEDGER_DDL =
        "CREATE TABLE ledger_entry (" +
        "  id INTEGER PRIMARY KEY," +
        "  date TEXT," +
        "  property_id INTEGER," +
        "  account_id INTEGER," +
        "  document_number TEXT," +
        "  document_type TEXT," +
        "  description TEXT," +
        "  counterparty_id INTEGER," +
        "  kind INTEGER NOT NULL DEFAULT 3," +
        "  credit NUMERIC NOT NULL DEFAULT 0," +
        "  debit NUMERIC NOT NULL DEFAULT 0," +
        "  closing_balance NUMERIC NOT NULL DEFAULT 0," +
        "  balance_sign TEXT NOT NULL DEFAULT 'P'," +
        "  author TEXT" +
        ")";

    @TempDir
    Path dir;

    private Path file;
    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        file = dir.resolve("profile").resolve("data").resolve("ledger.db");
        schemaManager = new SchemaManager(5000);
    }

    @Test
    @DisplayName("A new file is created at the current schema version")
    void testCreatesNewStore() {
        EmbeddedStore store = schemaManager.open(file);

        assertEquals(LedgerSchema.CURRENT_VERSION, store.schemaVersion());
        JdbcTemplate jdbc = store.getJdbcTemplate();
        for (String table : List.of("property", "bank_account", "counterparty", "profile_params", "ledger_entry")) {
            assertEquals(1, count(jdbc, "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", table),
                "table " + table);
        }
        for (String view : LedgerSchema.VIEW_NAMES) {
            assertEquals(1, count(jdbc, "SELECT COUNT(*) FROM sqlite_master WHERE type = 'view' AND name = ?", view),
                "view " + view);
        }
        assertTrue(ledgerSql(jdbc).contains("AUTOINCREMENT"));
    }

    @Test
    @DisplayName("Re-opening a current store changes neither schema nor rows")
    void testReopenIsIdempotent() {
        writeLegacyStore();
        EmbeddedStore first = schemaManager.open(file);
        List<Map<String, Object>> schemaBefore = schema(first.getJdbcTemplate());
        List<Map<String, Object>> rowsBefore = rows(first.getJdbcTemplate());
        List<Map<String, Object>> sequenceBefore = sequence(first.getJdbcTemplate());

        EmbeddedStore second = schemaManager.open(file);

        assertEquals(schemaBefore, schema(second.getJdbcTemplate()));
        assertEquals(rowsBefore, rows(second.getJdbcTemplate()));
        assertEquals(sequenceBefore, sequence(second.getJdbcTemplate()));
    }

    @Test
    @DisplayName("Structural migration keeps every id and adds the AUTOINCREMENT key")
    void testStructuralMigrationPreservesIds() {
        writeLegacyStore();

        EmbeddedStore store = schemaManager.open(file);
        JdbcTemplate jdbc = store.getJdbcTemplate();

        assertTrue(ledgerSql(jdbc).contains("AUTOINCREMENT"));
        assertEquals(List.of(3L, 7L, 12L, 15L),
            jdbc.queryForList("SELECT id FROM ledger_entry ORDER BY id", Long.class));
        assertEquals(0, count(jdbc, "SELECT COUNT(*) FROM sqlite_master WHERE name = ?",
            LedgerSchema.STAGED_LEDGER_TABLE));
        assertEquals(15L, jdbc.queryForObject(
            "SELECT seq FROM sqlite_sequence WHERE name = 'ledger_entry'", Long.class));

        LedgerEntry entry = new LedgerStore(store).getEntry(7).orElseThrow();
        assertEquals(0, new BigDecimal("250.50").compareTo(entry.getCredit()));
        assertEquals("Seed purchase", entry.getDescription());
    }

    @Test
    @DisplayName("Ordinal dates are backfilled from both legacy encodings")
    void testOrdinalBackfill() {
        writeLegacyStore();

        JdbcTemplate jdbc = schemaManager.open(file).getJdbcTemplate();

        assertEquals(20240315, ordinal(jdbc, 3));
        assertEquals(20240105, ordinal(jdbc, 7));
        assertEquals(20231231, ordinal(jdbc, 12));
        assertNull(jdbc.queryForObject("SELECT ordinal_date FROM ledger_entry WHERE id = 15", Integer.class),
            "text in no known encoding keeps a null key");
    }

    @Test
    @DisplayName("Additive columns are added to an old file")
    void testAdditiveColumns() {
        writeLegacyStore();

        JdbcTemplate jdbc = schemaManager.open(file).getJdbcTemplate();

        List<String> columns = jdbc.query("PRAGMA table_info(ledger_entry)", (rs, rowNum) -> rs.getString("name"));
        for (LedgerSchema.AdditiveColumn column : LedgerSchema.ADDITIVE_COLUMNS) {
            assertTrue(columns.contains(column.name()), "column " + column.name());
        }
    }

    @Test
    @DisplayName("The sequence counter is raised to MAX(id) but never lowered")
    void testSequenceNeverLowered() {
        EmbeddedStore store = schemaManager.open(file);
        JdbcTemplate jdbc = store.getJdbcTemplate();
        jdbc.update("INSERT INTO property (id, code, name) VALUES (1, 'P1', 'Farm')");
        jdbc.update("INSERT INTO bank_account (id, code) VALUES (1, 'A1')");
        // counter ahead of every id, as left behind by deleted rows
        jdbc.update("INSERT INTO sqlite_sequence (name, seq) VALUES ('ledger_entry', 100)");

        EmbeddedStore reopened = schemaManager.open(file);

        assertEquals(100L, reopened.getJdbcTemplate().queryForObject(
            "SELECT seq FROM sqlite_sequence WHERE name = 'ledger_entry'", Long.class));
        LedgerEntry created = new LedgerStore(reopened).createEntry(LedgerEntry.builder()
            .date(LocalDate.of(2024, 1, 1))
            .propertyId(1L)
            .accountId(1L)
            .kind(EntryKind.REVENUE)
            .credit(BigDecimal.TEN)
            .build());
        assertEquals(101L, created.getId());
    }

    @Test
    @DisplayName("A sequence counter below MAX(id) is raised")
    void testSequenceRaisedToMaxId() {
        writeLegacyStore();
        schemaManager.open(file);
        JdbcTemplate raw = raw();
        raw.update("UPDATE sqlite_sequence SET seq = 2 WHERE name = 'ledger_entry'");

        JdbcTemplate jdbc = schemaManager.open(file).getJdbcTemplate();

        assertEquals(15L, jdbc.queryForObject(
            "SELECT seq FROM sqlite_sequence WHERE name = 'ledger_entry'", Long.class));
    }

    @Test
    @DisplayName("A failed structural migration leaves the original table untouched")
    void testFailedMigrationRollsBack() {
        writeLegacyStore();
        // date is NOT NULL in the current table, so copying this row fails
        raw().update("INSERT INTO ledger_entry (id, date, description) VALUES (20, NULL, 'undated')");

        MigrationException e = assertThrows(MigrationException.class, () -> schemaManager.open(file));
        assertNotNull(e.getMessage());

        JdbcTemplate raw = raw();
        assertFalse(ledgerSql(raw).contains("AUTOINCREMENT"));
        assertEquals(List.of(3L, 7L, 12L, 15L, 20L),
            raw.queryForList("SELECT id FROM ledger_entry ORDER BY id", Long.class));
        assertEquals(0, count(raw, "SELECT COUNT(*) FROM sqlite_master WHERE name = ?",
            LedgerSchema.STAGED_LEDGER_TABLE));
        List<String> columns = raw.query("PRAGMA table_info(ledger_entry)", (rs, rowNum) -> rs.getString("name"));
        assertFalse(columns.contains("ordinal_date"), "additive step rolled back with the rest");
        assertEquals(0, raw.queryForObject("PRAGMA user_version", Integer.class));
    }

    private void writeLegacyStore() {
        file.getParent().toFile().mkdirs();
        JdbcTemplate raw = raw();
        raw.execute(LEGACY_LEDGER_DDL);
        raw.update("INSERT INTO ledger_entry (id, date, description, kind, credit, balance_sign) " +
            "VALUES (3, '15/03/2024', 'Corn sale', 1, 1000, 'P')");
        raw.update("INSERT INTO ledger_entry (id, date, description, kind, credit, balance_sign) " +
            "VALUES (7, '2024-01-05', 'Seed purchase', 2, 250.50, 'N')");
        raw.update("INSERT INTO ledger_entry (id, date, description, kind, debit) " +
            "VALUES (12, '2023/12/31', 'Fuel', 2, 80)");
        raw.update("INSERT INTO ledger_entry (id, date, description) VALUES (15, 'soon', 'Undated note')");
    }

    private JdbcTemplate raw() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
        return new JdbcTemplate(dataSource);
    }

    private static String ledgerSql(JdbcTemplate jdbc) {
        return jdbc.queryForObject(
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = 'ledger_entry'", String.class)
            .toUpperCase();
    }

    private static int ordinal(JdbcTemplate jdbc, long id) {
        return jdbc.queryForObject("SELECT ordinal_date FROM ledger_entry WHERE id = ?", Integer.class, id);
    }

    private static int count(JdbcTemplate jdbc, String sql, Object... args) {
        return jdbc.queryForObject(sql, Integer.class, args);
    }

    private static List<Map<String, Object>> schema(JdbcTemplate jdbc) {
        return jdbc.queryForList("SELECT type, name, sql FROM sqlite_master ORDER BY type, name");
    }

    private static List<Map<String, Object>> rows(JdbcTemplate jdbc) {
        return jdbc.queryForList("SELECT * FROM ledger_entry ORDER BY id");
    }

    private static List<Map<String, Object>> sequence(JdbcTemplate jdbc) {
        return jdbc.queryForList("SELECT name, seq FROM sqlite_sequence ORDER BY name");
    }
}
