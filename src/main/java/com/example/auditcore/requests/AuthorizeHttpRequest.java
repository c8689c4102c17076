package com.example.auditcore.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizeHttpRequest(
        @JsonProperty("permission") @NotBlank String permission,
        @JsonProperty("scope") JsonNode scope
) {}
