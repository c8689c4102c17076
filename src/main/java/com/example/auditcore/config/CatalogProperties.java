package com.example.auditcore.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry bounds for catalog reads and writes (catalog.*). Snapshot reads retry while the catalog
 * revision keeps moving underneath them; writes retry when another mutation won the revision or
 * another append won the ledger tail. Write retries back off exponentially from {@code backoff}.
 * The dangling role binding sweep only runs when catalog.sweep.enabled=true.
 */
@Component
@ConfigurationProperties(prefix = "catalog")
@Data
public class CatalogProperties {

    private Attempts snapshot = new Attempts();
    private Attempts write = new Attempts();
    private Sweep sweep = new Sweep();

    @Data
    public static class Attempts {
        private int maxAttempts = 5;
        private Duration backoff = Duration.ofMillis(20);
    }

    @Data
    public static class Sweep {
        private boolean enabled = false;
        private String schedule = "0 45 3 * * *";
    }
}
