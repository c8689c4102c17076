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

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Role {

    public static final String SUPER_ADMIN = "super_admin";

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*");

    @NonNull private String roleId;
    @NonNull private String name;
    @NonNull private Long createdAt;
    @NonNull private Long updatedAt;

    private String description;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("role_id")
    public String getRoleId() { return roleId; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @DynamoDbAttribute("description")
    public String getDescription() { return description; }

    public boolean isReserved() {
        return SUPER_ADMIN.equals(name);
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }
}
