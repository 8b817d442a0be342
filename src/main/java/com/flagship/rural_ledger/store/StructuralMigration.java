package com.flagship.rural_ledger.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rebuilds the ledger table with an AUTOINCREMENT primary key when the file
 * predates that guarantee.
 *
 * Runs as a state machine inside the caller's transaction:
 * <pre>
 * DETECT -> QUIESCE_DEPENDENTS -> STAGE_NEW -> COPY -> SWAP -> RECREATE_DEPENDENTS -> COMMIT
 * </pre>
 * Identifier values are copied as they are. Any exception leaves the
 * transaction to roll back, which restores the original table.
 */
@Slf4j
public class StructuralMigration {

    public enum Stage {
        DETECT,
        QUIESCE_DEPENDENTS,
        STAGE_NEW,
        COPY,
        SWAP,
        RECREATE_DEPENDENTS,
        COMMIT
    }

    private final JdbcTemplate jdbcTemplate;
    private Stage stage = Stage.DETECT;
    private int copiedRows;

    public StructuralMigration(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs the machine to completion.
     *
     * @return true if the table was rebuilt, false if it already had an AUTOINCREMENT key
     * @throws MigrationException naming the stage that failed
     */
    public boolean run() {
        try {
            while (true) {
                switch (stage) {
                    case DETECT -> {
                        if (hasAutoIncrementKey()) {
                            return false;
                        }
                        log.info("Ledger table predates AUTOINCREMENT key, rebuilding");
                        stage = Stage.QUIESCE_DEPENDENTS;
                    }
                    case QUIESCE_DEPENDENTS -> {
                        dropDependentViews();
                        stage = Stage.STAGE_NEW;
                    }
                    case STAGE_NEW -> {
                        jdbcTemplate.execute("ALTER TABLE " + LedgerSchema.LEDGER_TABLE
                            + " RENAME TO " + LedgerSchema.STAGED_LEDGER_TABLE);
                        jdbcTemplate.execute(LedgerSchema.LEDGER_DDL);
                        stage = Stage.COPY;
                    }
                    case COPY -> {
                        copyCommonColumns();
                        stage = Stage.SWAP;
                    }
                    case SWAP -> {
                        jdbcTemplate.execute("DROP TABLE " + LedgerSchema.STAGED_LEDGER_TABLE);
                        stage = Stage.RECREATE_DEPENDENTS;
                    }
                    case RECREATE_DEPENDENTS -> {
                        LedgerSchema.INDEXES.forEach(jdbcTemplate::execute);
                        LedgerSchema.VIEWS.forEach(jdbcTemplate::execute);
                        stage = Stage.COMMIT;
                    }
                    case COMMIT -> {
                        log.info("Ledger table rebuilt, {} rows copied", copiedRows);
                        return true;
                    }
                }
            }
        } catch (MigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MigrationException("Structural migration failed at stage " + stage, e);
        }
    }

    public Stage getStage() {
        return stage;
    }

    private boolean hasAutoIncrementKey() {
        List<String> sql = jdbcTemplate.queryForList(
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?",
            String.class, LedgerSchema.LEDGER_TABLE);
        return !sql.isEmpty() && sql.get(0) != null
            && sql.get(0).toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");
    }

    private void dropDependentViews() {
        List<String> views = jdbcTemplate.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'view' AND sql LIKE '%' || ? || '%'",
            String.class, LedgerSchema.LEDGER_TABLE);
        for (String view : views) {
            jdbcTemplate.execute("DROP VIEW IF EXISTS \"" + view + "\"");
        }
    }

    private void copyCommonColumns() {
        Set<String> legacy = Set.copyOf(columnsOf(LedgerSchema.STAGED_LEDGER_TABLE));
        List<String> common = columnsOf(LedgerSchema.LEDGER_TABLE).stream()
            .filter(legacy::contains)
            .toList();
        if (!common.contains("id")) {
            throw new MigrationException("Legacy ledger table has no id column", null);
        }
        String columns = common.stream().map(c -> "\"" + c + "\"").collect(Collectors.joining(", "));
        copiedRows = jdbcTemplate.update(
            "INSERT INTO " + LedgerSchema.LEDGER_TABLE + " (" + columns + ") "
                + "SELECT " + columns + " FROM " + LedgerSchema.STAGED_LEDGER_TABLE);

        Integer legacyRows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + LedgerSchema.STAGED_LEDGER_TABLE, Integer.class);
        if (legacyRows == null || legacyRows != copiedRows) {
            throw new MigrationException(
                "Copied " + copiedRows + " of " + legacyRows + " ledger rows", null);
        }
    }

    private List<String> columnsOf(String table) {
        return jdbcTemplate.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name"));
    }
}
