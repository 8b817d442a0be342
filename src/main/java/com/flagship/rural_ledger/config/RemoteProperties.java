package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Remote backend credentials and change-feed settings.
 *
 * The url and key come from {@code SUPABASE_URL} and
 * {@code SUPABASE_ANON_KEY} (or {@code SUPABASE_KEY}); the application does
 * not start when either is missing or the url is malformed.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "remote")
public class RemoteProperties {

    @NotBlank(message = "SUPABASE_URL is not set")
    @Pattern(regexp = "^https://[a-zA-Z0-9-]+\\.supabase\\.co/?$",
        message = "SUPABASE_URL must look like https://<project>.supabase.co")
    private String url;

    @NotBlank(message = "SUPABASE_ANON_KEY is not set")
    @ToString.Exclude
    private String key;

    @NotBlank
    private String schema = "public";

    @NotBlank
    private String table = "ledger_entry";

    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(2);
}
