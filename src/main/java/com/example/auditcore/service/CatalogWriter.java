package com.example.auditcore.service;

import com.example.auditcore.access.CatalogAccess;
import com.example.auditcore.access.LedgerAppend;
import com.example.auditcore.config.CatalogProperties;
import java.time.Duration;
import java.util.Map;
import java.util.function.LongFunction;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Optimistic write loop for catalog mutations. Each attempt reads the current revision, lets the
 * caller validate against it, prepare the ledger event for the change and commit both together,
 * and starts over when a concurrent mutation won the revision or a concurrent append won the
 * ledger tail. Validation runs again on every attempt, so a row created or removed by the winner
 * surfaces as the matching domain error instead of a retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class CatalogWriter {

    private final CatalogAccess catalogAccess;
    private final AuditGateway gateway;
    private final CatalogProperties properties;

    <T> T write(String operation, LongFunction<T> attempt) {
        int maxAttempts = Math.max(1, properties.getWrite().getMaxAttempts());
        for (int i = 1; ; i++) {
            try {
                long revision = catalogAccess.currentRevision();
                T result = attempt.apply(revision);
                log.info("Catalog {} committed on revision {}", operation, revision);
                return result;
            } catch (ConditionalCheckFailedException ex) {
                if (i >= maxAttempts) {
                    log.warn("Catalog {} kept losing to concurrent writers after {} attempts", operation, i);
                    throw AuditCoreException.storageUnavailable(operation, ex);
                }
                log.debug("Catalog {} lost a revision or tail race (attempt {}), retrying", operation, i);
                backoff(operation, i);
            } catch (SdkException ex) {
                throw AuditCoreException.storageUnavailable(operation, ex);
            }
        }
    }

    /**
     * The ledger event recording a catalog change, to be committed with it.
     */
    LedgerAppend audit(OperationKind kind, String actorId, String subjectId, Map<String, ?> details) {
        return gateway.prepare(kind, actorId, subjectId, details);
    }

    /**
     * Runs a catalog read, translating storage failures.
     */
    <T> T read(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable(operation, ex);
        }
    }

    static void requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId must be non-blank");
        }
    }

    private void backoff(String operation, int attempt) {
        Duration base = properties.getWrite().getBackoff();
        if (base == null || base.isZero() || base.isNegative()) {
            return;
        }
        try {
            Thread.sleep(base.toMillis() << Math.min(attempt - 1, 10));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw AuditCoreException.storageUnavailable(operation, ex);
        }
    }
}
