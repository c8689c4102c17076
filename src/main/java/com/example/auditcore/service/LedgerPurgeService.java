package com.example.auditcore.service;

import static com.example.auditcore.service.AuditGateway.details;

import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Explicit purge of events past their retention window. Each deletion leaves a checkpoint, so the
 * remaining chain still verifies; the purge itself is recorded as one ledger event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPurgeService {

    private final EventLedgerService ledger;
    private final SeverityClassifier classifier;
    private final AuditGateway gateway;
    private final Clock clock;

    public PurgeResult purgeStale(String actorId) {
        CatalogWriter.requireActor(actorId);
        Instant now = clock.instant();
        long noiseCutoff = classifier.cutoff(Severity.NOISE, now).toEpochMilli();
        long importantCutoff = classifier.cutoff(Severity.IMPORTANT, now).toEpochMilli();

        Outcome noise = purge(Severity.NOISE);
        Outcome important = purge(Severity.IMPORTANT);
        PurgeResult result = new PurgeResult(noiseCutoff, importantCutoff,
                noise.purged(), important.purged(), noise.failed() + important.failed());

        gateway.record(OperationKind.LEDGER_PURGED, actorId, ledger.chainId(), details(
                "noise_cutoff", result.noiseCutoff(),
                "important_cutoff", result.importantCutoff(),
                "noise_purged", result.noisePurged(),
                "important_purged", result.importantPurged(),
                "failed", result.failed()));
        return result;
    }

    private Outcome purge(Severity severity) {
        List<LedgerEvent> stale;
        try (Stream<LedgerEvent> events = ledger.findStale(severity)) {
            stale = events.collect(Collectors.toList());
        }
        log.info("Found {} stale {} events to purge", stale.size(), severity.wireName());

        int purged = 0;
        int failed = 0;
        for (LedgerEvent event : stale) {
            if (ledger.purge(event)) {
                purged++;
            } else {
                failed++;
            }
        }
        return new Outcome(purged, failed);
    }

    private record Outcome(int purged, int failed) { }
}
