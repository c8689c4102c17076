package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial role update; omitted fields keep their current value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateRoleHttpRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
) {}
