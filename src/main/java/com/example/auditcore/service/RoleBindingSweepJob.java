package com.example.auditcore.service;

import com.example.auditcore.config.CatalogSeedProperties;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled removal of role bindings whose role has been deleted, acting as the system user.
 * Only registered when catalog.sweep.enabled=true.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "catalog.sweep.enabled", havingValue = "true")
public class RoleBindingSweepJob {

    private final Clock clock;
    private final GrantService grantService;
    private final CatalogSeedProperties seedProperties;

    @Scheduled(cron = "${catalog.sweep.schedule:0 45 3 * * *}")
    public void removeDanglingBindings() {
        long startTime = clock.millis();
        log.info("Starting role binding sweep at {}", startTime);

        int removed = grantService.pruneDanglingRoleBindings(seedProperties.getActor());

        log.info("Completed role binding sweep in {}ms: removed={}", clock.millis() - startTime, removed);
    }
}
