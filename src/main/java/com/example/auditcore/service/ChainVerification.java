package com.example.auditcore.service;

import java.util.Optional;

/**
 * Outcome of a chain walk. {@code eventsVerified} counts events whose links and hashes were
 * checked before the walk finished or stopped.
 */
public record ChainVerification(
        String chainId,
        long eventsVerified,
        long checkpointsCrossed,
        IntegrityViolation violation
) {

    public static ChainVerification valid(String chainId, long eventsVerified, long checkpointsCrossed) {
        return new ChainVerification(chainId, eventsVerified, checkpointsCrossed, null);
    }

    public static ChainVerification broken(String chainId, long eventsVerified, long checkpointsCrossed,
                                           IntegrityViolation violation) {
        return new ChainVerification(chainId, eventsVerified, checkpointsCrossed, violation);
    }

    public boolean isValid() {
        return violation == null;
    }

    public Optional<IntegrityViolation> firstViolation() {
        return Optional.ofNullable(violation);
    }
}
