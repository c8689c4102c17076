package com.example.auditcore.models;

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

/**
 * Pointer to the most recently appended event of a chain. Appends swap it conditionally on the
 * previous {@code seq}/{@code hash} pair, so two writers can never both link to the same tail.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ChainTail {

    @NonNull private String chainId;
    @NonNull private Long sequence;
    @NonNull private String hash;
    @NonNull private String eventId;
    @NonNull private Long updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_id")
    public String getChainId() { return chainId; }

    @DynamoDbAttribute("seq")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbAttribute("event_id")
    public String getEventId() { return eventId; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    public static ChainTail of(LedgerEvent event, long now) {
        return ChainTail.builder()
                .chainId(event.getChainId())
                .sequence(event.getSequence())
                .hash(event.getHash())
                .eventId(event.getEventId())
                .updatedAt(now)
                .build();
    }
}
