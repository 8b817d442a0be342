package com.flagship.rural_ledger.observability;

import com.flagship.rural_ledger.store.EmbeddedStore;
import com.flagship.rural_ledger.store.LedgerSchema;
import com.flagship.rural_ledger.sync.SyncBridge;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicators for the embedded store and the sync bridge.
 */
public class HealthIndicators {

    /**
     * Down when the store cannot be read or is not at the current schema version.
     */
    public static class StoreHealthIndicator implements HealthIndicator {

        private final EmbeddedStore store;

        public StoreHealthIndicator(EmbeddedStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                int version = store.schemaVersion();
                Integer entries = store.getJdbcTemplate().queryForObject(
                        "SELECT COUNT(*) FROM " + LedgerSchema.LEDGER_TABLE, Integer.class);
                Health.Builder builder = version == LedgerSchema.CURRENT_VERSION ? Health.up() : Health.down();
                return builder
                        .withDetail("path", store.getPath().toString())
                        .withDetail("schemaVersion", version)
                        .withDetail("entries", entries != null ? entries : 0)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * The remote session is created lazily, so an uninitialized bridge is
     * reported as UNKNOWN rather than down.
     */
    public static class SyncBridgeHealthIndicator implements HealthIndicator {

        private final SyncBridge bridge;

        public SyncBridgeHealthIndicator(SyncBridge bridge) {
            this.bridge = bridge;
        }

        @Override
        public Health health() {
            if (bridge.isShutdown()) {
                return Health.down().withDetail("state", "shut down").build();
            }
            Health.Builder builder = bridge.isInitialized() ? Health.up() : Health.unknown();
            return builder
                    .withDetail("sessionInitialized", bridge.isInitialized())
                    .withDetail("activeSubscriptions", bridge.activeSubscriptions())
                    .build();
        }
    }
}
