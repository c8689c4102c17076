package com.example.auditcore.requests;

import com.example.auditcore.models.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ledger append command. {@code occurredAt} is normally left empty and stamped from the clock;
 * replay tooling passes the original occurrence time explicitly.
 */
public record AppendEventRequest(
        String eventName,
        String actorId,
        String subjectId,
        JsonNode payload,
        Severity severity,
        Long occurredAt
) {

    private static final Pattern EVENT_NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    public AppendEventRequest(String eventName, String actorId, String subjectId, JsonNode payload, Severity severity) {
        this(eventName, actorId, subjectId, payload, severity, null);
    }

    public AppendEventRequest {
        Objects.requireNonNull(eventName, "eventName");
        if (!EVENT_NAME.matcher(eventName).matches()) {
            throw new IllegalArgumentException("eventName must be namespaced lowercase segments: " + eventName);
        }

        Objects.requireNonNull(payload, "payload");
        if (payload.isNull() || payload.isMissingNode()) {
            throw new IllegalArgumentException("payload must be a JSON value");
        }

        Objects.requireNonNull(severity, "severity");

        if (occurredAt != null && occurredAt < 0) {
            throw new IllegalArgumentException("occurredAt must be >= 0");
        }

        actorId = blankToNull(actorId);
        subjectId = blankToNull(subjectId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
