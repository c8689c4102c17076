package com.example.auditcore.requests;

import com.example.auditcore.models.Severity;
import lombok.Builder;

/**
 * Read-only ledger filter. Every field is optional; {@code from} is inclusive and {@code to}
 * exclusive, both in epoch millis of occurrence time.
 */
@Builder(toBuilder = true)
public record EventQuery(
        String eventName,
        Severity severity,
        String actorId,
        String subjectId,
        Long from,
        Long to,
        Integer limit
) {

    public EventQuery {
        if (from != null && from < 0) {
            throw new IllegalArgumentException("from must be >= 0");
        }
        if (to != null && to < 0) {
            throw new IllegalArgumentException("to must be >= 0");
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static EventQuery all() {
        return EventQuery.builder().build();
    }

    /**
     * True when the time window cannot contain any event.
     */
    public boolean isEmptyWindow() {
        return from != null && to != null && to <= from;
    }
}
