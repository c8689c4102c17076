package com.example.auditcore.service;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Where an effective permission comes from.
 */
public enum GrantSource {
    ROLE,
    DIRECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
