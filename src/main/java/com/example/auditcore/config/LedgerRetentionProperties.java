package com.example.auditcore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for ledger retention.
 * These values are bound from application.yml (ledger.retention.*).
 * Stale-event views always use the day windows; the scheduled purge only runs when
 * ledger.retention.enabled=true.
 */
@Component
@ConfigurationProperties(prefix = "ledger.retention")
@Data
public class LedgerRetentionProperties {

    private boolean enabled = false;
    private String schedule = "0 30 3 * * *";
    private int noiseDays = 7;
    private int importantDays = 90;
}
