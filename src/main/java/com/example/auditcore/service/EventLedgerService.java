package com.example.auditcore.service;

import com.example.auditcore.access.EventLedgerAccess;
import com.example.auditcore.access.LedgerAppend;
import com.example.auditcore.config.LedgerProperties;
import com.example.auditcore.models.ChainCheckpoint;
import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.AppendEventRequest;
import com.example.auditcore.requests.EventQuery;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Append-only, hash-chained event ledger. Each event links to its predecessor through
 * {@code prev_hash}; the chain tail is swapped with a compare-and-set so concurrent appenders
 * can never fork the chain.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLedgerService {

    private final EventLedgerAccess ledgerAccess;
    private final LedgerProperties properties;
    private final SeverityClassifier classifier;
    private final Clock clock;

    public String chainId() {
        return properties.getChainId();
    }

    /**
     * Links a new event to the current tail. A lost race re-reads the tail and retries with
     * exponential backoff; exhausting the attempts surfaces {@code CONFLICTING_APPEND}.
     */
    public LedgerEvent append(AppendEventRequest request) {
        Objects.requireNonNull(request, "request");
        String chainId = chainId();
        int maxAttempts = Math.max(1, properties.getAppend().getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            LedgerAppend pending = prepare(request);
            try {
                ledgerAccess.append(pending.event(), pending.expectedTail(), pending.newTail());
                LedgerEvent event = pending.event();
                log.debug("Appended {} at seq {} to chain {}", event.getEventName(), event.getSequence(), chainId);
                return event;
            } catch (ConditionalCheckFailedException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up append of {} to chain {} after {} attempts",
                            request.eventName(), chainId, attempt);
                    throw AuditCoreException.conflictingAppend(chainId, attempt);
                }
                backoff(attempt);
            } catch (SdkException ex) {
                throw AuditCoreException.storageUnavailable("append", ex);
            }
        }
    }

    /**
     * Builds the next event of the chain against the tail as it is now, without writing anything.
     * Whoever commits the result must do so conditionally on that tail, so a prepared append that
     * lost a race is rejected rather than forking the chain.
     */
    public LedgerAppend prepare(AppendEventRequest request) {
        Objects.requireNonNull(request, "request");
        String chainId = chainId();
        try {
            ChainTail tail = ledgerAccess.findTail(chainId).orElse(null);
            long now = clock.millis();
            LedgerEvent event = LedgerEvent.builder()
                    .chainId(chainId)
                    .sequence(tail == null ? 1L : tail.getSequence() + 1)
                    .eventId(UUID.randomUUID().toString())
                    .eventName(request.eventName())
                    .occurredAt(request.occurredAt() != null ? request.occurredAt() : now)
                    .payload(request.payload())
                    .severity(request.severity())
                    .recordedAt(now)
                    .prevHash(tail == null ? null : tail.getHash())
                    .actorId(request.actorId())
                    .subjectId(request.subjectId())
                    .build();
            return new LedgerAppend(event, tail, ChainTail.of(event, now));
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("append", ex);
        }
    }

    /**
     * Verifies the whole chain from its first position to the tail.
     */
    public ChainVerification verifyChain() {
        return verifyChain(null, null);
    }

    /**
     * Walks the chain in position order between the two events (inclusive), checking each link
     * and recomputing each hash. Stops at the first break. Purged positions are crossed only
     * through their checkpoints. When {@code toEventId} is absent the walk also checks that the
     * tail pointer matches the last stored event or its checkpoint.
     */
    public ChainVerification verifyChain(String fromEventId, String toEventId) {
        String chainId = chainId();
        try {
            ChainTail tail = ledgerAccess.findTail(chainId).orElse(null);
            long fromSeq = fromEventId == null ? 1L : eventInChain(fromEventId).getSequence();
            long toSeq;
            if (toEventId != null) {
                toSeq = eventInChain(toEventId).getSequence();
            } else {
                toSeq = tail == null ? 0L : tail.getSequence();
            }
            if (fromSeq > toSeq && toEventId != null) {
                throw new IllegalArgumentException("from event must not come after to event");
            }

            long lastSeq = fromSeq - 1;
            String lastHash = null;
            long verified = 0;
            long crossed = 0;

            if (fromSeq > 1) {
                Optional<String> anchor = hashAt(chainId, fromSeq - 1);
                if (anchor.isEmpty()) {
                    return broken(chainId, verified, crossed, new IntegrityViolation(
                            fromEventId, fromSeq, "no event or checkpoint anchors the range start", null, null));
                }
                lastHash = anchor.get();
            }

            try (Stream<LedgerEvent> events = ledgerAccess.findBySequenceRange(chainId, fromSeq, toSeq)) {
                Iterator<LedgerEvent> it = events.iterator();
                while (it.hasNext()) {
                    LedgerEvent event = it.next();
                    String expectedPrev = lastHash;
                    if (event.getSequence() != lastSeq + 1) {
                        Optional<ChainCheckpoint> checkpoint = ledgerAccess.findCheckpoint(chainId, event.getSequence() - 1);
                        if (checkpoint.isEmpty()) {
                            return broken(chainId, verified, crossed, new IntegrityViolation(
                                    event.getEventId(), event.getSequence(), "gap in chain without checkpoint",
                                    String.valueOf(lastSeq + 1), String.valueOf(event.getSequence())));
                        }
                        expectedPrev = checkpoint.get().getHash();
                        crossed += event.getSequence() - lastSeq - 1;
                    }

                    if (!Objects.equals(expectedPrev, event.getPrevHash())) {
                        return broken(chainId, verified, crossed, new IntegrityViolation(
                                event.getEventId(), event.getSequence(), "prev_hash does not link to predecessor",
                                expectedPrev, event.getPrevHash()));
                    }
                    String recomputed = LedgerEvent.computeHash(event.getPrevHash(), event.getPayload());
                    if (!recomputed.equals(event.getHash())) {
                        return broken(chainId, verified, crossed, new IntegrityViolation(
                                event.getEventId(), event.getSequence(), "stored hash does not match payload",
                                recomputed, event.getHash()));
                    }

                    verified++;
                    lastSeq = event.getSequence();
                    lastHash = event.getHash();
                }
            }

            if (toEventId == null && tail != null) {
                if (lastSeq == tail.getSequence()) {
                    if (!tail.getHash().equals(lastHash)) {
                        return broken(chainId, verified, crossed, new IntegrityViolation(
                                tail.getEventId(), tail.getSequence(), "tail hash does not match last event",
                                lastHash, tail.getHash()));
                    }
                } else {
                    Optional<ChainCheckpoint> checkpoint = ledgerAccess.findCheckpoint(chainId, tail.getSequence());
                    if (checkpoint.isEmpty() || !checkpoint.get().getHash().equals(tail.getHash())) {
                        return broken(chainId, verified, crossed, new IntegrityViolation(
                                tail.getEventId(), tail.getSequence(), "tail is not accounted for by an event or checkpoint",
                                tail.getHash(), checkpoint.map(ChainCheckpoint::getHash).orElse(null)));
                    }
                    crossed += tail.getSequence() - lastSeq;
                }
            }

            return ChainVerification.valid(chainId, verified, crossed);
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("verify", ex);
        }
    }

    public ChainVerification verifyChainOrThrow(String fromEventId, String toEventId) {
        ChainVerification result = verifyChain(fromEventId, toEventId);
        if (!result.isValid()) {
            throw AuditCoreException.integrityViolation(result.violation());
        }
        return result;
    }

    /**
     * Lazy, read-only view of the ledger in occurrence order. The caller closes the stream.
     */
    public Stream<LedgerEvent> query(EventQuery query) {
        Objects.requireNonNull(query, "query");
        try {
            Stream<LedgerEvent> events = ledgerAccess.queryByOccurrence(chainId(), query);
            return query.limit() == null ? events : events.limit(query.limit());
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("query", ex);
        }
    }

    public LedgerEvent findEvent(String eventId) {
        Objects.requireNonNull(eventId, "eventId");
        try {
            return ledgerAccess.findByEventId(eventId)
                    .orElseThrow(() -> AuditCoreException.eventNotFound(eventId));
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("findEvent", ex);
        }
    }

    public Optional<ChainTail> tail() {
        try {
            return ledgerAccess.findTail(chainId());
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("tail", ex);
        }
    }

    public List<ChainCheckpoint> checkpoints() {
        try {
            return ledgerAccess.listCheckpoints(chainId());
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("checkpoints", ex);
        }
    }

    /**
     * Events of the given severity that are past their retention window. Read-only.
     */
    public Stream<LedgerEvent> findStale(Severity severity) {
        Objects.requireNonNull(severity, "severity");
        long cutoff = classifier.cutoff(severity, clock.instant()).toEpochMilli();
        try {
            return ledgerAccess.findOlderThan(chainId(), severity, cutoff);
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("findStale", ex);
        }
    }

    /**
     * Deletes one event and leaves a checkpoint carrying its hash, atomically.
     *
     * @return false when the event was already purged or changed underneath us
     */
    public boolean purge(LedgerEvent event) {
        try {
            ledgerAccess.purge(event, ChainCheckpoint.forPurged(event, clock.millis()));
            return true;
        } catch (ConditionalCheckFailedException ex) {
            log.warn("Skipped purge of event {} at seq {}: {}", event.getEventId(), event.getSequence(), ex.getMessage());
            return false;
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("purge", ex);
        }
    }

    private LedgerEvent eventInChain(String eventId) {
        LedgerEvent event = findEvent(eventId);
        if (!chainId().equals(event.getChainId())) {
            throw AuditCoreException.eventNotFound(eventId);
        }
        return event;
    }

    private Optional<String> hashAt(String chainId, long seq) {
        Optional<String> eventHash = ledgerAccess.findBySequence(chainId, seq).map(LedgerEvent::getHash);
        if (eventHash.isPresent()) {
            return eventHash;
        }
        return ledgerAccess.findCheckpoint(chainId, seq).map(ChainCheckpoint::getHash);
    }

    private ChainVerification broken(String chainId, long verified, long crossed, IntegrityViolation violation) {
        log.error("Integrity violation on chain {} at seq {} (event {}): {}",
                chainId, violation.sequence(), violation.eventId(), violation.reason());
        return ChainVerification.broken(chainId, verified, crossed, violation);
    }

    private void backoff(int attempt) {
        Duration base = properties.getAppend().getBackoff();
        if (base == null || base.isZero() || base.isNegative()) {
            return;
        }
        long millis = base.toMillis() << Math.min(attempt - 1, 10);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw AuditCoreException.storageUnavailable("append", ex);
        }
    }
}
