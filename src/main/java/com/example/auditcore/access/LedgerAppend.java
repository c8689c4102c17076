package com.example.auditcore.access;

import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import java.util.Objects;

/**
 * A prepared, not yet written ledger event together with the tail swap that links it. Committing
 * it succeeds only while the chain tail still equals {@code expectedTail} ({@code null} for an
 * empty chain).
 */
public record LedgerAppend(LedgerEvent event, ChainTail expectedTail, ChainTail newTail) {

    public LedgerAppend {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(newTail, "newTail");
    }
}
