package com.example.auditcore.service;

import com.example.auditcore.config.AuditSeverityProperties;
import com.example.auditcore.config.LedgerRetentionProperties;
import com.example.auditcore.models.LedgerEvent;
import com.example.auditcore.models.Severity;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Maps operations to severities and severities to retention windows.
 */
@Service
@RequiredArgsConstructor
public class SeverityClassifier {

    private final AuditSeverityProperties severityProperties;
    private final LedgerRetentionProperties retentionProperties;

    public Severity classify(OperationKind kind) {
        Severity override = severityProperties.getOverrides().get(kind.eventName());
        return override != null ? override : kind.defaultSeverity();
    }

    public Duration retention(Severity severity) {
        return switch (severity) {
            case NOISE -> Duration.ofDays(retentionProperties.getNoiseDays());
            case IMPORTANT -> Duration.ofDays(retentionProperties.getImportantDays());
        };
    }

    /**
     * Events of {@code severity} that occurred strictly before the returned instant are stale.
     */
    public Instant cutoff(Severity severity, Instant now) {
        return now.minus(retention(severity));
    }

    public boolean isStale(LedgerEvent event, Instant now) {
        return event.getOccurredAt() < cutoff(event.getSeverity(), now).toEpochMilli();
    }
}
