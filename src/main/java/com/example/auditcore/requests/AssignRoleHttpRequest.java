package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AssignRoleHttpRequest(
        @JsonProperty("role_id") @NotBlank String roleId
) {}
