package com.flagship.rural_ledger.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    public enum DispatchMode {
        DETACHED,
        BOUNDED
    }

    @NotNull
    private DispatchMode dispatch = DispatchMode.DETACHED;

    @Min(1)
    private int poolSize = 2;

    @Min(1)
    private int queueCapacity = 256;

    private final Mirror mirror = new Mirror();

    @Data
    public static class Mirror {
        /** Subscribe at startup and apply remote changes to the local store. */
        private boolean enabled = false;
    }
}
