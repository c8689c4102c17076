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
 * Uniqueness guard for role and permission names, written alongside the owning row.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class NameClaim {

    @NonNull private String nameKey;
    @NonNull private String ownerId;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("name_key")
    public String getNameKey() { return nameKey; }

    @DynamoDbAttribute("owner_id")
    public String getOwnerId() { return ownerId; }

    public static NameClaim forRole(Role role) {
        return NameClaim.builder().nameKey(roleKey(role.getName())).ownerId(role.getRoleId()).build();
    }

    public static NameClaim forPermission(Permission permission) {
        return NameClaim.builder()
                .nameKey(permissionKey(permission.getName()))
                .ownerId(permission.getPermissionId())
                .build();
    }

    public static String roleKey(String name) {
        return "role#" + name;
    }

    public static String permissionKey(String name) {
        return "permission#" + name;
    }
}
