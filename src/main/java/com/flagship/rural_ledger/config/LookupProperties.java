package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "ledger.lookup")
public class LookupProperties {

    @NotBlank
    private String cnpjUrl = "https://www.receitaws.com.br/v1/cnpj/";

    @NotBlank
    private String cpfUrl = "https://www.receitaws.com.br/v1/cpf/";

    @Min(1)
    private int maxAttempts = 4;

    /** First backoff delay; doubled after every failed attempt. */
    @NotNull
    private Duration baseDelay = Duration.ofSeconds(2);

    /** Minimum time between two requests, whatever their outcome. */
    @NotNull
    private Duration minInterval = Duration.ofSeconds(1);

    @NotNull
    private Duration timeout = Duration.ofSeconds(8);

    /** Cache file name, resolved under the profile directory. */
    @NotBlank
    private String cacheFile = "lookup_cache.json";
}
