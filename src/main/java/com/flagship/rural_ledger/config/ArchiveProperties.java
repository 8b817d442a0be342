package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "ledger.archive")
public class ArchiveProperties {

    private boolean enabled = true;

    private boolean onStartup = true;

    @NotBlank
    private String cron = "0 0 12 * * *";
}
