package com.example.auditcore.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.auditcore.models.CanonicalJson;
import com.example.auditcore.models.ChainCheckpoint;
import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import com.example.auditcore.requests.EventQuery;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoEventLedgerAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbEnhancedClient enhancedClient;
    private EventLedgerAccess access;

    @BeforeAll
    void init() {
        enhancedClient = LocalStackTables.client(LOCALSTACK);
        LocalStackTables.createLedgerTables(enhancedClient);
        access = new DynamoEventLedgerAccess(enhancedClient);
    }

    @BeforeEach
    void cleanup() {
        LocalStackTables.truncate(enhancedClient.table(DynamoEventLedgerAccess.EVENTS_TABLE,
                TableSchema.fromBean(LedgerEvent.class)));
        LocalStackTables.truncate(enhancedClient.table(DynamoEventLedgerAccess.TAILS_TABLE,
                TableSchema.fromBean(ChainTail.class)));
        LocalStackTables.truncate(enhancedClient.table(DynamoEventLedgerAccess.CHECKPOINTS_TABLE,
                TableSchema.fromBean(ChainCheckpoint.class)));
    }

    private static LedgerEvent event(long seq, String prevHash, long occurredAt, Severity severity, String actor) {
        return LedgerEvent.builder()
                .chainId("main")
                .sequence(seq)
                .eventId("evt-" + seq)
                .eventName(severity == Severity.NOISE ? "resource.viewed" : "role.created")
                .occurredAt(occurredAt)
                .payload(CanonicalJson.parse("{\"seq\":" + seq + "}"))
                .severity(severity)
                .recordedAt(CLOCK.millis())
                .prevHash(prevHash)
                .actorId(actor)
                .build();
    }

    private LedgerEvent appendNext(ChainTail tail, long occurredAt, Severity severity, String actor) {
        long seq = tail == null ? 1L : tail.getSequence() + 1;
        LedgerEvent e = event(seq, tail == null ? null : tail.getHash(), occurredAt, severity, actor);
        access.append(e, tail, ChainTail.of(e, CLOCK.millis()));
        return e;
    }

    @Test
    @DisplayName("append stores the event and swaps the tail")
    void appendAndRead() {
        LedgerEvent first = appendNext(null, 1000L, Severity.IMPORTANT, "admin-1");
        ChainTail tail = access.findTail("main").orElseThrow();
        LedgerEvent second = appendNext(tail, 2000L, Severity.NOISE, "u1");

        ChainTail newTail = access.findTail("main").orElseThrow();
        assertEquals(2L, newTail.getSequence());
        assertEquals(second.getHash(), newTail.getHash());

        LedgerEvent stored = access.findBySequence("main", 1L).orElseThrow();
        assertEquals(first.getHash(), stored.getHash());
        assertEquals(first.getPayload(), stored.getPayload());
        assertEquals(Severity.IMPORTANT, stored.getSeverity());
        assertEquals(LedgerEvent.computeHash(stored), stored.getHash());

        assertEquals(second.getSequence(), access.findByEventId("evt-2").orElseThrow().getSequence());
    }

    @Test
    @DisplayName("append against a stale tail is rejected and writes nothing")
    void staleTailRejected() {
        appendNext(null, 1000L, Severity.IMPORTANT, "admin-1");
        ChainTail tail = access.findTail("main").orElseThrow();
        appendNext(tail, 2000L, Severity.IMPORTANT, "admin-1");

        assertThrows(ConditionalCheckFailedException.class, () -> appendNext(tail, 3000L, Severity.IMPORTANT, "x"));
        assertThrows(ConditionalCheckFailedException.class, () -> appendNext(null, 3000L, Severity.IMPORTANT, "x"));

        assertEquals(2L, access.findTail("main").orElseThrow().getSequence());
        try (Stream<LedgerEvent> all = access.findBySequenceRange("main", 1L, 10L)) {
            assertEquals(2, all.count());
        }
    }

    @Test
    @DisplayName("occurrence queries apply window and filters in time order")
    void queryByOccurrence() {
        ChainTail tail = null;
        tail = ChainTail.of(appendNext(tail, 3000L, Severity.NOISE, "u1"), 0L);
        tail = ChainTail.of(appendNext(tail, 1000L, Severity.IMPORTANT, "admin-1"), 0L);
        tail = ChainTail.of(appendNext(tail, 2000L, Severity.NOISE, "u2"), 0L);
        appendNext(tail, 4000L, Severity.NOISE, "u1");

        try (Stream<LedgerEvent> events = access.queryByOccurrence("main", EventQuery.all())) {
            assertEquals(List.of(1000L, 2000L, 3000L, 4000L),
                    events.map(LedgerEvent::getOccurredAt).collect(Collectors.toList()));
        }
        try (Stream<LedgerEvent> events = access.queryByOccurrence("main",
                EventQuery.builder().severity(Severity.NOISE).actorId("u1").build())) {
            assertEquals(List.of(3000L, 4000L), events.map(LedgerEvent::getOccurredAt).collect(Collectors.toList()));
        }
        try (Stream<LedgerEvent> events = access.queryByOccurrence("main",
                EventQuery.builder().from(2000L).to(4000L).build())) {
            assertEquals(List.of(2000L, 3000L), events.map(LedgerEvent::getOccurredAt).collect(Collectors.toList()));
        }
        try (Stream<LedgerEvent> events = access.findOlderThan("main", Severity.NOISE, 3000L)) {
            assertEquals(List.of(2000L), events.map(LedgerEvent::getOccurredAt).collect(Collectors.toList()));
        }
    }

    @Test
    @DisplayName("purge deletes the event and writes its checkpoint atomically")
    void purge() {
        LedgerEvent first = appendNext(null, 1000L, Severity.NOISE, "u1");
        appendNext(access.findTail("main").orElseThrow(), 2000L, Severity.NOISE, "u1");

        access.purge(first, ChainCheckpoint.forPurged(first, CLOCK.millis()));

        assertTrue(access.findBySequence("main", 1L).isEmpty());
        ChainCheckpoint checkpoint = access.findCheckpoint("main", 1L).orElseThrow();
        assertEquals(first.getHash(), checkpoint.getHash());
        assertEquals(List.of(1L), access.listCheckpoints("main").stream()
                .map(ChainCheckpoint::getSequence).collect(Collectors.toList()));

        assertThrows(ConditionalCheckFailedException.class,
                () -> access.purge(first, ChainCheckpoint.forPurged(first, CLOCK.millis())));
    }
}
