package com.example.auditcore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "authz")
@Data
public class AuthorizationProperties {

    /**
     * off: every request passes and nothing is evaluated.
     * advisory: decisions are evaluated and recorded, denials are only logged.
     * strict: denials are rejected.
     */
    public enum Mode {
        OFF,
        ADVISORY,
        STRICT
    }

    private Mode mode = Mode.STRICT;
}
