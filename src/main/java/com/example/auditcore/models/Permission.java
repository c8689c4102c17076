package com.example.auditcore.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.regex.Pattern;
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
 * Named capability following the {@code resource.action} convention. Names are never edited in
 * place; a rename is a new permission plus migrated bindings.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Permission {

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    @NonNull private String permissionId;
    @NonNull private String name;
    @NonNull private Long createdAt;

    private String description;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("permission_id")
    public String getPermissionId() { return permissionId; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("description")
    public String getDescription() { return description; }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }
}
