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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Permission held by a user outside of role membership. The sort key is derived from the
 * permission and the canonical scope, which makes (user, permission, scope) unique.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DirectGrant {

    @NonNull private String userId;
    @NonNull private String grantId;
    @NonNull private String permissionId;
    @NonNull private Scope scope;
    @NonNull private Long grantedAt;
    @NonNull private String grantedBy;

    // filled by the builder
    private String grantKey;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("grant_key")
    public String getGrantKey() { return grantKey; }

    @DynamoDbAttribute("grant_id")
    public String getGrantId() { return grantId; }

    @DynamoDbAttribute("permission_id")
    public String getPermissionId() { return permissionId; }

    @DynamoDbConvertedBy(ScopeAttributeConverter.class)
    @DynamoDbAttribute("scope")
    public Scope getScope() { return scope; }

    @DynamoDbAttribute("granted_at")
    public Long getGrantedAt() { return grantedAt; }

    @DynamoDbAttribute("granted_by")
    public String getGrantedBy() { return grantedBy; }

    public static String grantKey(String permissionId, Scope scope) {
        return permissionId + "#" + scope.toCanonicalJson();
    }

    public static class DirectGrantBuilder {
        public DirectGrant build() {
            DirectGrant g = new DirectGrant(userId, grantId, permissionId, scope, grantedAt, grantedBy, null);
            g.grantKey = DirectGrant.grantKey(g.permissionId, g.scope);
            return g;
        }
    }
}
