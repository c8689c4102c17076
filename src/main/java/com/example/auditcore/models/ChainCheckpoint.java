package com.example.auditcore.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Last-known-good hash of a purged event. Written in the same transaction that deletes the event;
 * the event at {@code sequence + 1} must link to {@link #getHash()}.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ChainCheckpoint {

    @NonNull private String chainId;
    @NonNull private Long sequence;
    @NonNull private String eventId;
    @NonNull private String hash;
    @NonNull private Severity severity;
    @NonNull private Long occurredAt;
    @NonNull private Long purgedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_id")
    public String getChainId() { return chainId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("seq")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("event_id")
    public String getEventId() { return eventId; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbAttribute("severity")
    public Severity getSeverity() { return severity; }

    @DynamoDbAttribute("occurred_at")
    public Long getOccurredAt() { return occurredAt; }

    @DynamoDbAttribute("purged_at")
    public Long getPurgedAt() { return purgedAt; }

    public static ChainCheckpoint forPurged(LedgerEvent event, long purgedAt) {
        return ChainCheckpoint.builder()
                .chainId(event.getChainId())
                .sequence(event.getSequence())
                .eventId(event.getEventId())
                .hash(event.getHash())
                .severity(event.getSeverity())
                .occurredAt(event.getOccurredAt())
                .purgedAt(purgedAt)
                .build();
    }
}
