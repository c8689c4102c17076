package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AssignPermissionHttpRequest(
        @JsonProperty("permission_id") @NotBlank String permissionId
) {}
