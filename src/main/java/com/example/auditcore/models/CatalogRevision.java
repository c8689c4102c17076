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
 * Monotonic counter bumped by every catalog mutation in the same transaction.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CatalogRevision {

    public static final String KEY = "revision";

    @NonNull private String metaKey;
    @NonNull private Long revision;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("meta_key")
    public String getMetaKey() { return metaKey; }

    @DynamoDbAttribute("revision")
    public Long getRevision() { return revision; }

    public static CatalogRevision of(long revision) {
        return CatalogRevision.builder().metaKey(KEY).revision(revision).build();
    }
}
