package com.flagship.rural_ledger.store;

import java.util.List;

/**
 * DDL of the embedded store at the current schema version.
 */
public final class LedgerSchema {

    public static final int CURRENT_VERSION = 3;

    public static final String LEDGER_TABLE = "ledger_entry";
    public static final String STAGED_LEDGER_TABLE = "ledger_entry_legacy";

    public static final String PROPERTY_DDL =
        "CREATE TABLE IF NOT EXISTS property (" +
        "  id INTEGER PRIMARY KEY AUTOINCREMENT," +
        "  code TEXT NOT NULL UNIQUE," +
        "  name TEXT NOT NULL," +
        "  country TEXT DEFAULT 'BR'," +
        "  currency TEXT DEFAULT 'BRL'," +
        "  land_registry TEXT," +
        "  state_registration TEXT," +
        "  address TEXT," +
        "  city TEXT," +
        "  state TEXT," +
        "  zip_code TEXT," +
        "  exploration_type INTEGER," +
        "  share NUMERIC," +
        "  total_area NUMERIC," +
        "  used_area NUMERIC," +
        "  created_at TEXT DEFAULT CURRENT_TIMESTAMP" +
        ")";

    public static final String BANK_ACCOUNT_DDL =
        "CREATE TABLE IF NOT EXISTS bank_account (" +
        "  id INTEGER PRIMARY KEY AUTOINCREMENT," +
        "  code TEXT NOT NULL UNIQUE," +
        "  country TEXT DEFAULT 'BR'," +
        "  bank_code TEXT," +
        "  bank_name TEXT," +
        "  agency TEXT," +
        "  account_number TEXT," +
        "  opening_balance NUMERIC DEFAULT 0," +
        "  opened_on TEXT" +
        ")";

    public static final String COUNTERPARTY_DDL =
        "CREATE TABLE IF NOT EXISTS counterparty (" +
        "  id INTEGER PRIMARY KEY AUTOINCREMENT," +
        "  tax_id TEXT NOT NULL UNIQUE," +
        "  name TEXT NOT NULL," +
        "  kind INTEGER NOT NULL DEFAULT 1," +
        "  created_at TEXT DEFAULT CURRENT_TIMESTAMP" +
        ")";

    public static final String PROFILE_PARAMS_DDL =
        "CREATE TABLE IF NOT EXISTS profile_params (" +
        "  profile TEXT PRIMARY KEY," +
        "  version TEXT," +
        "  period_start_indicator INTEGER," +
        "  special_situation INTEGER," +
        "  ident TEXT," +
        "  name TEXT," +
        "  street TEXT," +
        "  number TEXT," +
        "  complement TEXT," +
        "  district TEXT," +
        "  state TEXT," +
        "  city_code TEXT," +
        "  zip_code TEXT," +
        "  phone TEXT," +
        "  email TEXT," +
        "  updated_at TEXT DEFAULT CURRENT_TIMESTAMP" +
        ")";

    public static final String LEDGER_DDL =
        "CREATE TABLE IF NOT EXISTS ledger_entry (" +
        "  id INTEGER PRIMARY KEY AUTOINCREMENT," +
        "  date TEXT NOT NULL," +
        "  property_id INTEGER REFERENCES property(id)," +
        "  account_id INTEGER REFERENCES bank_account(id)," +
        "  document_number TEXT," +
        "  document_type TEXT," +
        "  description TEXT," +
        "  counterparty_id INTEGER REFERENCES counterparty(id)," +
        "  kind INTEGER NOT NULL DEFAULT 3," +
        "  credit NUMERIC NOT NULL DEFAULT 0," +
        "  debit NUMERIC NOT NULL DEFAULT 0," +
        "  closing_balance NUMERIC NOT NULL DEFAULT 0," +
        "  balance_sign TEXT NOT NULL DEFAULT 'P'," +
        "  author TEXT," +
        "  category TEXT DEFAULT NULL," +
        "  ordinal_date INTEGER DEFAULT NULL," +
        "  affected_area TEXT DEFAULT NULL," +
        "  quantity NUMERIC DEFAULT NULL," +
        "  unit TEXT DEFAULT NULL" +
        ")";

    public static final List<String> TABLES = List.of(
        PROPERTY_DDL, BANK_ACCOUNT_DDL, COUNTERPARTY_DDL, PROFILE_PARAMS_DDL, LEDGER_DDL);

    /** Tables with an AUTOINCREMENT key whose sequence counter is reconciled on open. */
    public static final List<String> SEQUENCED_TABLES = List.of(
        LEDGER_TABLE, "property", "bank_account", "counterparty");

    /**
     * Columns added to the ledger table after the first release, with the
     * definition used to add them to an older file.
     */
    public static final List<AdditiveColumn> ADDITIVE_COLUMNS = List.of(
        new AdditiveColumn("category", "TEXT DEFAULT NULL"),
        new AdditiveColumn("ordinal_date", "INTEGER DEFAULT NULL"),
        new AdditiveColumn("affected_area", "TEXT DEFAULT NULL"),
        new AdditiveColumn("quantity", "NUMERIC DEFAULT NULL"),
        new AdditiveColumn("unit", "TEXT DEFAULT NULL"));

    public static final List<String> VIEW_NAMES = List.of("v_account_balance", "v_category_summary");

    public static final List<String> VIEWS = List.of(
        "CREATE VIEW IF NOT EXISTS v_account_balance AS " +
        "SELECT e.account_id AS account_id, e.id AS entry_id, " +
        "       CASE WHEN COALESCE(UPPER(e.balance_sign), 'P') = 'P' " +
        "            THEN e.closing_balance ELSE -e.closing_balance END AS signed_balance " +
        "FROM ledger_entry e " +
        "WHERE e.account_id IS NOT NULL " +
        "  AND e.id = (SELECT MAX(x.id) FROM ledger_entry x WHERE x.account_id = e.account_id)",

        "CREATE VIEW IF NOT EXISTS v_category_summary AS " +
        "SELECT COALESCE(category, '') AS category, " +
        "       ordinal_date / 10000 AS year, " +
        "       (ordinal_date / 100) % 100 AS month, " +
        "       SUM(credit) AS total_credit, " +
        "       SUM(debit) AS total_debit " +
        "FROM ledger_entry " +
        "WHERE ordinal_date IS NOT NULL " +
        "GROUP BY COALESCE(category, ''), ordinal_date / 10000, (ordinal_date / 100) % 100");

    public static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_ledger_entry_ordinal ON ledger_entry(ordinal_date, id)",
        "CREATE INDEX IF NOT EXISTS idx_ledger_entry_account ON ledger_entry(account_id, id)",
        "CREATE INDEX IF NOT EXISTS idx_ledger_entry_property ON ledger_entry(property_id)",
        "CREATE INDEX IF NOT EXISTS idx_ledger_entry_counterparty ON ledger_entry(counterparty_id)",
        "CREATE INDEX IF NOT EXISTS idx_ledger_entry_category ON ledger_entry(category, ordinal_date)");

    private LedgerSchema() {
    }

    public record AdditiveColumn(String name, String definition) {
    }
}
