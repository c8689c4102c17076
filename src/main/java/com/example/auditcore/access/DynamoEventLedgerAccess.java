package com.example.auditcore.access;

import com.example.auditcore.models.ChainCheckpoint;
import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.EventQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoEventLedgerAccess implements EventLedgerAccess {

    public static final String EVENTS_TABLE = LedgerWrites.EVENTS_TABLE;
    public static final String TAILS_TABLE = LedgerWrites.TAILS_TABLE;
    public static final String CHECKPOINTS_TABLE = "ledger_checkpoints";

    private final DynamoDbEnhancedClient enhancedClient;
    private final LedgerWrites ledgerWrites;
    private final DynamoDbTable<LedgerEvent> events;
    private final DynamoDbTable<ChainTail> tails;
    private final DynamoDbTable<ChainCheckpoint> checkpoints;

    public DynamoEventLedgerAccess(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.ledgerWrites = new LedgerWrites(enhancedClient);
        this.events = ledgerWrites.events();
        this.tails = ledgerWrites.tails();
        this.checkpoints = enhancedClient.table(CHECKPOINTS_TABLE, TableSchema.fromBean(ChainCheckpoint.class));
    }

    @Override
    public Optional<ChainTail> findTail(String chainId) {
        return Optional.ofNullable(tails.getItem(r -> r.key(partition(chainId)).consistentRead(true)));
    }

    @Override
    public void append(LedgerEvent event, ChainTail expectedTail, ChainTail newTail) {
        TransactWriteItemsEnhancedRequest.Builder tx = TransactWriteItemsEnhancedRequest.builder();
        ledgerWrites.addTo(tx, new LedgerAppend(event, expectedTail, newTail));
        Transactions.write(enhancedClient, tx.build());
    }

    @Override
    public Stream<LedgerEvent> findBySequenceRange(String chainId, long fromSeq, long toSeq) {
        if (toSeq < fromSeq) {
            return Stream.empty();
        }
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                .queryConditional(QueryConditional.sortBetween(
                        Key.builder().partitionValue(chainId).sortValue(fromSeq).build(),
                        Key.builder().partitionValue(chainId).sortValue(toSeq).build()))
                .scanIndexForward(true)
                .consistentRead(true)
                .build();
        return events.query(request).items().stream();
    }

    @Override
    public Optional<LedgerEvent> findBySequence(String chainId, long seq) {
        return Optional.ofNullable(events.getItem(r -> r.key(Key.builder()
                        .partitionValue(chainId)
                        .sortValue(seq)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public Optional<LedgerEvent> findByEventId(String eventId) {
        DynamoDbIndex<LedgerEvent> index = events.index(LedgerEvent.EVENT_ID_INDEX);
        return index.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(eventId))).limit(1))
                .stream()
                .flatMap(page -> page.items().stream())
                .findFirst();
    }

    @Override
    public Stream<LedgerEvent> queryByOccurrence(String chainId, EventQuery query) {
        if (query.isEmptyWindow()) {
            return Stream.empty();
        }
        QueryEnhancedRequest.Builder request = QueryEnhancedRequest.builder()
                .queryConditional(occurrenceWindow(chainId, query.from(), query.to()))
                .scanIndexForward(true);
        Expression filter = filter(query);
        if (filter != null) {
            request.filterExpression(filter);
        }
        return events.index(LedgerEvent.OCCURRENCE_INDEX)
                .query(request.build())
                .stream()
                .flatMap(page -> page.items().stream());
    }

    @Override
    public Stream<LedgerEvent> findOlderThan(String chainId, Severity severity, long cutoff) {
        EventQuery query = EventQuery.builder().severity(severity).to(cutoff).build();
        return queryByOccurrence(chainId, query);
    }

    @Override
    public void purge(LedgerEvent event, ChainCheckpoint checkpoint) {
        Expression unchanged = Expression.builder()
                .expression("#hash = :hash")
                .putExpressionName("#hash", "hash")
                .putExpressionValue(":hash", string(event.getHash()))
                .build();

        Transactions.write(enhancedClient, TransactWriteItemsEnhancedRequest.builder()
                .addDeleteItem(events, TransactDeleteItemEnhancedRequest.builder()
                        .key(Key.builder()
                                .partitionValue(event.getChainId())
                                .sortValue(event.getSequence())
                                .build())
                        .conditionExpression(unchanged)
                        .build())
                .addPutItem(checkpoints, TransactPutItemEnhancedRequest.builder(ChainCheckpoint.class)
                        .item(checkpoint)
                        .conditionExpression(LedgerWrites.NEW_ROW)
                        .build())
                .build());
    }

    @Override
    public Optional<ChainCheckpoint> findCheckpoint(String chainId, long seq) {
        return Optional.ofNullable(checkpoints.getItem(r -> r.key(Key.builder()
                        .partitionValue(chainId)
                        .sortValue(seq)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public List<ChainCheckpoint> listCheckpoints(String chainId) {
        return checkpoints.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(chainId)))
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    private static QueryConditional occurrenceWindow(String chainId, Long from, Long to) {
        if (from != null && to != null) {
            return QueryConditional.sortBetween(
                    occurrenceKey(chainId, from, 0L),
                    occurrenceKey(chainId, to - 1, Long.MAX_VALUE));
        }
        if (from != null) {
            return QueryConditional.sortGreaterThanOrEqualTo(occurrenceKey(chainId, from, 0L));
        }
        if (to != null) {
            return QueryConditional.sortLessThan(occurrenceKey(chainId, to, 0L));
        }
        return QueryConditional.keyEqualTo(partition(chainId));
    }

    private static Key occurrenceKey(String chainId, long occurredAt, long seq) {
        return Key.builder()
                .partitionValue(chainId)
                .sortValue(LedgerEvent.occurredKey(occurredAt, seq))
                .build();
    }

    private static Expression filter(EventQuery query) {
        List<String> clauses = new ArrayList<>();
        Expression.Builder builder = Expression.builder();
        if (query.eventName() != null) {
            clauses.add("#event_name = :event_name");
            builder.putExpressionName("#event_name", "event_name")
                    .putExpressionValue(":event_name", string(query.eventName()));
        }
        if (query.severity() != null) {
            clauses.add("#severity = :severity");
            builder.putExpressionName("#severity", "severity")
                    .putExpressionValue(":severity", string(query.severity().name()));
        }
        if (query.actorId() != null) {
            clauses.add("#actor_id = :actor_id");
            builder.putExpressionName("#actor_id", "actor_id")
                    .putExpressionValue(":actor_id", string(query.actorId()));
        }
        if (query.subjectId() != null) {
            clauses.add("#subject_id = :subject_id");
            builder.putExpressionName("#subject_id", "subject_id")
                    .putExpressionValue(":subject_id", string(query.subjectId()));
        }
        if (clauses.isEmpty()) {
            return null;
        }
        return builder.expression(String.join(" AND ", clauses)).build();
    }

    private static Key partition(String value) {
        return Key.builder().partitionValue(value).build();
    }

    private static AttributeValue string(String value) {
        return AttributeValue.builder().s(value).build();
    }
}
