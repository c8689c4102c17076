package com.example.auditcore.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationResponse(
        @JsonProperty("chain_id") String chainId,
        @JsonProperty("valid") boolean valid,
        @JsonProperty("events_verified") long eventsVerified,
        @JsonProperty("checkpoints_crossed") long checkpointsCrossed,
        @JsonProperty("violation") Violation violation
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Violation(
            @JsonProperty("event_id") String eventId,
            @JsonProperty("seq") long sequence,
            @JsonProperty("reason") String reason,
            @JsonProperty("expected") String expected,
            @JsonProperty("actual") String actual
    ) { }
}
