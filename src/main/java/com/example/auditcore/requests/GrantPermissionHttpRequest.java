package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * Direct grant or revoke of a permission by name. The scope is passed through untouched so the
 * service can reject malformed shapes with a precise error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GrantPermissionHttpRequest(
        @JsonProperty("permission") @NotBlank String permission,
        @JsonProperty("scope") JsonNode scope
) {}
