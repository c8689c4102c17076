package com.example.auditcore.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Severity tier of a ledger event. Drives the retention window: noise is trimmed aggressively,
 * important events are kept for the long window.
 */
public enum Severity {
    NOISE,
    IMPORTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromString(String v) {
        if (v != null) {
            for (Severity s : values()) {
                if (s.name().equalsIgnoreCase(v.trim())) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown Severity: " + v);
    }
}
