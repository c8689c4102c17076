package com.example.auditcore.service;

import com.example.auditcore.config.CatalogSeedProperties;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled purge of stale ledger events, acting as the system user.
 * Only registered when ledger.retention.enabled=true.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "ledger.retention.enabled", havingValue = "true")
public class LedgerRetentionJob {

    private final Clock clock;
    private final LedgerPurgeService purgeService;
    private final CatalogSeedProperties seedProperties;

    @Scheduled(cron = "${ledger.retention.schedule:0 30 3 * * *}")
    public void enforceRetentionPolicy() {
        long startTime = clock.millis();
        log.info("Starting ledger retention job at {}", startTime);

        PurgeResult result = purgeService.purgeStale(seedProperties.getActor());

        long duration = clock.millis() - startTime;
        log.info("Completed ledger retention job in {}ms: noise={}, important={}, failed={}",
                duration, result.noisePurged(), result.importantPurged(), result.failed());
    }
}
