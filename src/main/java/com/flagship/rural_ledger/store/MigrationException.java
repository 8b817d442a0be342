package com.flagship.rural_ledger.store;

/**
 * The store file could not be brought to the current schema.
 * Fatal: callers must not use a half-migrated store.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
