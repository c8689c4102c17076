package com.example.auditcore.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record DirectGrantResponse(
        @JsonProperty("grant_id") String grantId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("permission_id") String permissionId,
        @JsonProperty("scope") Map<String, String> scope,
        @JsonProperty("granted_at") Long grantedAt,
        @JsonProperty("granted_by") String grantedBy
) { }
