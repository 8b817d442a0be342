package com.flagship.rural_ledger.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Handle on a migrated store file: its data source plus the JDBC and
 * transaction templates every store component shares.
 */
public class EmbeddedStore {

    private final Path path;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public EmbeddedStore(Path path, DataSource dataSource) {
        this.path = path;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public Path getPath() {
        return path;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    public TransactionTemplate getTransactionTemplate() {
        return transactionTemplate;
    }

    public int schemaVersion() {
        Integer version = jdbcTemplate.queryForObject("PRAGMA user_version", Integer.class);
        return version != null ? version : 0;
    }
}
