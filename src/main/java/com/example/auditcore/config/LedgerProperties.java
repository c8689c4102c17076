package com.example.auditcore.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ledger settings bound from application.yml (ledger.*).
 * The append retry loop backs off exponentially starting at {@code append.backoff}.
 */
@Component
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    private String chainId = "main";
    private Append append = new Append();

    @Data
    public static class Append {
        private int maxAttempts = 5;
        private Duration backoff = Duration.ofMillis(20);
    }
}
