package com.example.auditcore.http;

import com.example.auditcore.models.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerEventResponse(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("seq") Long sequence,
        @JsonProperty("event_name") String eventName,
        @JsonProperty("occurred_at") Long occurredAt,
        @JsonProperty("recorded_at") Long recordedAt,
        @JsonProperty("actor_id") String actorId,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash
) { }
