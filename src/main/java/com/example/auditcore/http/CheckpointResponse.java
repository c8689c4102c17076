package com.example.auditcore.http;

import com.example.auditcore.models.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CheckpointResponse(
        @JsonProperty("seq") Long sequence,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("hash") String hash,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("occurred_at") Long occurredAt,
        @JsonProperty("purged_at") Long purgedAt
) { }
