package com.example.auditcore.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verdict only; the reason for a denial is never exposed.
 */
public record AuthorizeResponse(
        @JsonProperty("allowed") boolean allowed
) { }
