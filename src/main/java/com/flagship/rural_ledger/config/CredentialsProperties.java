package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "ledger.credentials")
public class CredentialsProperties {

    /** Written to the admin file the first time it is created. */
    @NotBlank
    @ToString.Exclude
    private String defaultAdminPassword = "admin";
}
