package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Location of the embedded store: {@code <base-dir>/<profile>/data/ledger.db}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger.store")
public class StoreProperties {

    public static final String STORE_FILE = "ledger.db";

    @NotBlank
    private String baseDir = "data";

    @NotBlank
    private String profile = "default";

    @PositiveOrZero
    private int busyTimeoutMillis = 5000;

    public Path storePath() {
        return profileDir().resolve("data").resolve(STORE_FILE);
    }

    public Path profileDir() {
        return Path.of(baseDir).resolve(profile);
    }
}
