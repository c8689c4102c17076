package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateRoleHttpRequest(
        @JsonProperty("name") @NotBlank String name,
        @JsonProperty("description") String description
) {}
