package com.flagship.rural_ledger.store;

import com.flagship.rural_ledger.ledger.OrdinalDate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Opens a store file and brings it to the current schema.
 *
 * Each open runs, in one exclusive transaction:
 * <ol>
 *   <li>create-if-absent of every table</li>
 *   <li>additive column migrations (probe, then ALTER), then the views</li>
 *   <li>structural rebuild of the ledger table when it lacks an AUTOINCREMENT key</li>
 *   <li>sequence reconciliation: the counter is raised to MAX(id), never lowered</li>
 *   <li>ordinal date backfill from either legacy date encoding</li>
 *   <li>index creation</li>
 * </ol>
 * Every step is a no-op when already applied, so opening a current file
 * changes nothing. Any failure rolls back the whole open and is fatal.
 */
@Slf4j
public class SchemaManager {

    private final int busyTimeoutMillis;

    public SchemaManager(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    /**
     * Opens (creating if needed) the store file at {@code path}.
     *
     * @throws MigrationException if the file cannot be opened or migrated
     */
    public EmbeddedStore open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new MigrationException("Cannot create directory for store " + path, e);
        }

        // Legacy rows may hold dangling references; enforcement is only on for the runtime store
        DataSource migrationSource = dataSource(path, false);
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(migrationSource));
        try {
            tx.executeWithoutResult(status -> migrate(new JdbcTemplate(migrationSource)));
        } catch (MigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MigrationException("Could not migrate store " + path, e);
        }

        log.info("Opened store {} at schema version {}", path, LedgerSchema.CURRENT_VERSION);
        return new EmbeddedStore(path, dataSource(path, true));
    }

    void migrate(JdbcTemplate jdbc) {
        createTables(jdbc);
        applyAdditiveColumns(jdbc);
        LedgerSchema.VIEWS.forEach(jdbc::execute);
        new StructuralMigration(jdbc).run();
        reconcileSequences(jdbc);
        backfillOrdinalDates(jdbc);
        LedgerSchema.INDEXES.forEach(jdbc::execute);
        stampVersion(jdbc);
    }

    private void createTables(JdbcTemplate jdbc) {
        LedgerSchema.TABLES.forEach(jdbc::execute);
    }

    private void applyAdditiveColumns(JdbcTemplate jdbc) {
        for (LedgerSchema.AdditiveColumn column : LedgerSchema.ADDITIVE_COLUMNS) {
            try {
                jdbc.queryForList("SELECT " + column.name() + " FROM " + LedgerSchema.LEDGER_TABLE + " LIMIT 1");
            } catch (DataAccessException e) {
                if (!isMissingColumn(e)) {
                    throw e;
                }
                jdbc.execute("ALTER TABLE " + LedgerSchema.LEDGER_TABLE
                    + " ADD COLUMN " + column.name() + " " + column.definition());
                log.info("Added column {}.{}", LedgerSchema.LEDGER_TABLE, column.name());
            }
        }
    }

    private static boolean isMissingColumn(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause.getMessage();
        return message != null && message.contains("no such column");
    }

    private void reconcileSequences(JdbcTemplate jdbc) {
        for (String table : LedgerSchema.SEQUENCED_TABLES) {
            if (!hasAutoIncrementKey(jdbc, table)) {
                continue;
            }
            Long maxId = jdbc.queryForObject("SELECT COALESCE(MAX(id), 0) FROM " + table, Long.class);
            if (maxId == null || maxId == 0) {
                continue;
            }
            List<Long> seq = jdbc.queryForList(
                "SELECT seq FROM sqlite_sequence WHERE name = ?", Long.class, table);
            if (seq.isEmpty()) {
                jdbc.update("INSERT INTO sqlite_sequence (name, seq) VALUES (?, ?)", table, maxId);
                log.info("Initialized sequence of {} at {}", table, maxId);
            } else if (seq.get(0) < maxId) {
                jdbc.update("UPDATE sqlite_sequence SET seq = ? WHERE name = ?", maxId, table);
                log.warn("Raised sequence of {} from {} to {}", table, seq.get(0), maxId);
            }
        }
    }

    private static boolean hasAutoIncrementKey(JdbcTemplate jdbc, String table) {
        List<String> sql = jdbc.queryForList(
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?", String.class, table);
        return !sql.isEmpty() && sql.get(0) != null && sql.get(0).toUpperCase().contains("AUTOINCREMENT");
    }

    private void backfillOrdinalDates(JdbcTemplate jdbc) {
        List<Object[]> updates = new ArrayList<>();
        List<Long> unmatched = new ArrayList<>();
        jdbc.query("SELECT id, date FROM " + LedgerSchema.LEDGER_TABLE + " WHERE ordinal_date IS NULL", rs -> {
            long id = rs.getLong("id");
            Optional<Integer> ordinal = OrdinalDate.ordinalOf(rs.getString("date"));
            if (ordinal.isPresent()) {
                updates.add(new Object[] {ordinal.get(), id});
            } else {
                unmatched.add(id);
            }
        });
        if (!updates.isEmpty()) {
            jdbc.batchUpdate("UPDATE " + LedgerSchema.LEDGER_TABLE + " SET ordinal_date = ? WHERE id = ?", updates);
            log.info("Backfilled ordinal date of {} entries", updates.size());
        }
        if (!unmatched.isEmpty()) {
            log.warn("{} entries have a date in no known encoding, ordinal date left unset: {}",
                unmatched.size(), unmatched);
        }
    }

    private void stampVersion(JdbcTemplate jdbc) {
        Integer version = jdbc.queryForObject("PRAGMA user_version", Integer.class);
        if (version == null || version != LedgerSchema.CURRENT_VERSION) {
            jdbc.execute("PRAGMA user_version = " + LedgerSchema.CURRENT_VERSION);
            log.info("Schema version {} -> {}", version, LedgerSchema.CURRENT_VERSION);
        }
    }

    private DataSource dataSource(Path path, boolean enforceForeignKeys) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(enforceForeignKeys);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.EXCLUSIVE);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path.toAbsolutePath());
        return dataSource;
    }
}
