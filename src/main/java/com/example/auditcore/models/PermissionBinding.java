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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class PermissionBinding {

    @NonNull private String roleId;
    @NonNull private String permissionId;
    @NonNull private Long boundAt;
    @NonNull private String boundBy;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("role_id")
    public String getRoleId() { return roleId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("permission_id")
    public String getPermissionId() { return permissionId; }

    @DynamoDbAttribute("bound_at")
    public Long getBoundAt() { return boundAt; }

    @DynamoDbAttribute("bound_by")
    public String getBoundBy() { return boundBy; }
}
