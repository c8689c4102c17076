package com.example.auditcore.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class LedgerEvent {

    public static final String OCCURRENCE_INDEX = "events_by_occurrence";
    public static final String EVENT_ID_INDEX = "events_by_id";

    // required; the builder rejects nulls
    @NonNull private String chainId;     // PK
    @NonNull private Long sequence;      // SK, 1-based position in the chain
    @NonNull private String eventId;
    @NonNull private String eventName;
    @NonNull private Long occurredAt;
    @NonNull private JsonNode payload;
    @NonNull private Severity severity;
    @NonNull private Long recordedAt;

    // null only for the first event of a chain
    private String prevHash;

    // optional
    private String actorId;
    private String subjectId;

    // filled by the builder
    private String hash;
    private String occurredKey;

    @DynamoDbPartitionKey
    @DynamoDbSecondaryPartitionKey(indexNames = OCCURRENCE_INDEX)
    @DynamoDbAttribute("chain_id")
    public String getChainId() { return chainId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("seq")
    public Long getSequence() { return sequence; }

    @DynamoDbSecondaryPartitionKey(indexNames = EVENT_ID_INDEX)
    @DynamoDbAttribute("event_id")
    public String getEventId() { return eventId; }

    @DynamoDbAttribute("event_name")
    public String getEventName() { return eventName; }

    @DynamoDbAttribute("occurred_at")
    public Long getOccurredAt() { return occurredAt; }

    @DynamoDbConvertedBy(JsonNodeAttributeConverter.class)
    @DynamoDbAttribute("payload")
    public JsonNode getPayload() { return payload; }

    @DynamoDbAttribute("severity")
    public Severity getSeverity() { return severity; }

    @DynamoDbAttribute("recorded_at")
    public Long getRecordedAt() { return recordedAt; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("actor_id")
    public String getActorId() { return actorId; }

    @DynamoDbAttribute("subject_id")
    public String getSubjectId() { return subjectId; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbSecondarySortKey(indexNames = OCCURRENCE_INDEX)
    @DynamoDbAttribute("occurred_key")
    public String getOccurredKey() { return occurredKey; }

    /**
     * Sort key of the occurrence index: occurrence time first, chain position as tie break.
     */
    public static String occurredKey(long occurredAt, long sequence) {
        return String.format("%013d#%019d", occurredAt, sequence);
    }

    // hash chain helpers
    public static String computeHash(LedgerEvent e) {
        return computeHash(e.prevHash, e.payload);
    }

    /**
     * {@code hex(SHA-256(prevHash ++ canonical(payload)))}, with an absent predecessor contributing
     * no bytes.
     */
    public static String computeHash(String prevHash, JsonNode payload) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            if (prevHash != null) {
                md.update(prevHash.getBytes(StandardCharsets.UTF_8));
            }
            md.update(CanonicalJson.write(payload).getBytes(StandardCharsets.UTF_8));
            return bytesToHex(md.digest());
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    public static class LedgerEventBuilder {
        public LedgerEvent build() {
            LedgerEvent e = new LedgerEvent(
                    chainId, sequence, eventId, eventName, occurredAt, payload, severity, recordedAt,
                    prevHash, actorId, subjectId, null, null
            );
            e.hash = computeHash(e);
            e.occurredKey = LedgerEvent.occurredKey(e.occurredAt, e.sequence);
            return e;
        }
    }
}
