package com.example.auditcore.access;

import com.example.auditcore.models.ChainCheckpoint;
import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.EventQuery;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Storage contract for the hash-chained {@code ledger_events} table, its tail pointer and the
 * checkpoints left behind by purges. Writes are conditional: a lost race surfaces as
 * {@link software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException} and
 * leaves nothing behind.
 *
 * <p>Returned streams are lazy and page through storage; callers must close them.
 */
public interface EventLedgerAccess {

    /**
     * Strongly consistent read of the chain tail; empty for a chain with no events yet.
     */
    Optional<ChainTail> findTail(String chainId);

    /**
     * Atomically stores {@code event} and swings the tail to {@code newTail}.
     *
     * @param expectedTail the tail the event was linked against, or {@code null} for the first
     *                     event of the chain
     */
    void append(LedgerEvent event, ChainTail expectedTail, ChainTail newTail);

    /**
     * Events with {@code fromSeq <= seq <= toSeq} in chain order.
     */
    Stream<LedgerEvent> findBySequenceRange(String chainId, long fromSeq, long toSeq);

    Optional<LedgerEvent> findBySequence(String chainId, long seq);

    Optional<LedgerEvent> findByEventId(String eventId);

    /**
     * Events matching the query, in occurrence order with chain position as tie break.
     */
    Stream<LedgerEvent> queryByOccurrence(String chainId, EventQuery query);

    /**
     * Events of the given severity whose occurrence time is strictly before {@code cutoff}.
     */
    Stream<LedgerEvent> findOlderThan(String chainId, Severity severity, long cutoff);

    /**
     * Deletes the event and writes its checkpoint in one transaction. Fails if the event is gone
     * or no longer carries the same hash, or if a checkpoint already exists at that position.
     */
    void purge(LedgerEvent event, ChainCheckpoint checkpoint);

    Optional<ChainCheckpoint> findCheckpoint(String chainId, long seq);

    List<ChainCheckpoint> listCheckpoints(String chainId);
}
