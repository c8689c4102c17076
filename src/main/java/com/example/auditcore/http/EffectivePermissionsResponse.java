package com.example.auditcore.http;

import com.example.auditcore.service.GrantSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record EffectivePermissionsResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("roles") List<String> roles,
        @JsonProperty("permissions") List<Entry> permissions
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            @JsonProperty("permission") String permission,
            @JsonProperty("source") GrantSource source,
            @JsonProperty("role_name") String roleName,
            @JsonProperty("scope") Map<String, String> scope
    ) { }
}
