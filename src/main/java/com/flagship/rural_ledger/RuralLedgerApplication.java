package com.flagship.rural_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The embedded store is opened per profile by {@code LedgerConfiguration},
 * so the Boot data source is not auto-configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
@EnableScheduling
public class RuralLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuralLedgerApplication.class, args);
    }
}
