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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * (user, role) membership. The reverse index lets role deletion find every member to cascade.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class RoleBinding {

    public static final String BY_ROLE_INDEX = "user_roles_by_role";

    @NonNull private String userId;
    @NonNull private String roleId;
    @NonNull private Long boundAt;
    @NonNull private String boundBy;

    @DynamoDbPartitionKey
    @DynamoDbSecondarySortKey(indexNames = BY_ROLE_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbSortKey
    @DynamoDbSecondaryPartitionKey(indexNames = BY_ROLE_INDEX)
    @DynamoDbAttribute("role_id")
    public String getRoleId() { return roleId; }

    @DynamoDbAttribute("bound_at")
    public Long getBoundAt() { return boundAt; }

    @DynamoDbAttribute("bound_by")
    public String getBoundBy() { return boundBy; }
}
