package com.example.auditcore.config;

import com.example.auditcore.models.Severity;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-event-name severity overrides (audit.severity.overrides.&lt;event-name&gt;).
 */
@Component
@ConfigurationProperties(prefix = "audit.severity")
@Data
public class AuditSeverityProperties {

    private Map<String, Severity> overrides = new HashMap<>();
}
