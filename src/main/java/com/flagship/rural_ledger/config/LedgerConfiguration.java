package com.flagship.rural_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.rural_ledger.archive.DailyArchiver;
import com.flagship.rural_ledger.auth.LocalCredentialStore;
import com.flagship.rural_ledger.ledger.LedgerStore;
import com.flagship.rural_ledger.ledger.ReferenceStore;
import com.flagship.rural_ledger.lookup.IdentityLookupClient;
import com.flagship.rural_ledger.lookup.LookupCache;
import com.flagship.rural_ledger.observability.HealthIndicators;
import com.flagship.rural_ledger.store.EmbeddedStore;
import com.flagship.rural_ledger.store.SchemaManager;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Local side of the application: the store of the active profile and the
 * file-backed collaborators next to it.
 *
 * Opening the store runs the schema migration; a failure there stops the
 * application context from starting.
 */
@Configuration
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SchemaManager schemaManager(StoreProperties properties) {
        return new SchemaManager(properties.getBusyTimeoutMillis());
    }

    @Bean
    public EmbeddedStore embeddedStore(SchemaManager schemaManager, StoreProperties properties) {
        return schemaManager.open(properties.storePath());
    }

    @Bean
    public LedgerStore ledgerStore(EmbeddedStore store) {
        return new LedgerStore(store);
    }

    @Bean
    public ReferenceStore referenceStore(EmbeddedStore store) {
        return new ReferenceStore(store);
    }

    @Bean("storeHealth")
    public HealthIndicators.StoreHealthIndicator storeHealthIndicator(EmbeddedStore store) {
        return new HealthIndicators.StoreHealthIndicator(store);
    }

    @Bean
    public DailyArchiver dailyArchiver(StoreProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new DailyArchiver(Path.of(properties.getBaseDir()), objectMapper, clock);
    }

    @Bean
    public LocalCredentialStore localCredentialStore(StoreProperties storeProperties,
                                                     CredentialsProperties credentialsProperties,
                                                     ObjectMapper objectMapper) {
        return new LocalCredentialStore(Path.of(storeProperties.getBaseDir()), objectMapper,
            credentialsProperties.getDefaultAdminPassword());
    }

    @Bean
    public LookupCache lookupCache(StoreProperties storeProperties, LookupProperties lookupProperties,
                                   ObjectMapper objectMapper) {
        return new LookupCache(storeProperties.profileDir().resolve(lookupProperties.getCacheFile()), objectMapper);
    }

    @Bean
    public IdentityLookupClient identityLookupClient(RestTemplateBuilder restTemplateBuilder, LookupCache cache,
                                                     LookupProperties properties) {
        return new IdentityLookupClient(
            restTemplateBuilder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build(),
            cache, properties);
    }
}
