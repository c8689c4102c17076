package com.example.auditcore.service;

import static com.example.auditcore.service.AuditGateway.details;

import com.example.auditcore.config.AuthorizationProperties;
import com.example.auditcore.config.AuthorizationProperties.Mode;
import com.example.auditcore.models.Scope;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies the configured enforcement mode to resolver decisions and records them. Super-admin
 * bypasses and denials are recorded as important events; ordinary grants as noise. A call without
 * an actor is recorded as a denial by {@code anonymous}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationEnforcer {

    static final String ANONYMOUS = "anonymous";

    private final ScopedGrantResolver resolver;
    private final AuditGateway gateway;
    private final AuthorizationProperties properties;

    public void require(String actorId, String permissionName) {
        require(actorId, permissionName, Scope.empty());
    }

    /**
     * @throws AuditCoreException with {@code FORBIDDEN} in strict mode when the actor is not
     *                            allowed; the message never says which check failed
     */
    public void require(String actorId, String permissionName, Scope scope) {
        Mode mode = properties.getMode();
        if (mode == Mode.OFF) {
            return;
        }
        Scope requested = scope == null ? Scope.empty() : scope;
        if (actorId == null || actorId.isBlank()) {
            gateway.record(OperationKind.AUTHZ_DENIED, ANONYMOUS, ANONYMOUS, details(
                    "permission", permissionName,
                    "scope", requested.asMap(),
                    "mode", mode.name().toLowerCase(Locale.ROOT),
                    "reason", "missing actor"));
            deny(mode, ANONYMOUS, permissionName, "missing actor");
            return;
        }

        AuthorizationDecision decision = resolver.decide(actorId, permissionName, scope);
        if (decision instanceof AuthorizationDecision.Bypassed) {
            gateway.record(OperationKind.AUTHZ_BYPASSED, actorId, actorId, details(
                    "permission", permissionName,
                    "scope", requested.asMap()));
        } else if (decision instanceof AuthorizationDecision.GrantedBy granted) {
            gateway.record(OperationKind.AUTHZ_CHECKED, actorId, actorId, details(
                    "permission", permissionName,
                    "scope", requested.asMap(),
                    "source", granted.source().wireName(),
                    "role_name", granted.roleName()));
        } else {
            gateway.record(OperationKind.AUTHZ_DENIED, actorId, actorId, details(
                    "permission", permissionName,
                    "scope", requested.asMap(),
                    "mode", mode.name().toLowerCase(Locale.ROOT)));
            deny(mode, actorId, permissionName, "not granted");
        }
    }

    private void deny(Mode mode, String actorId, String permissionName, String reason) {
        if (mode == Mode.STRICT) {
            log.info("Denied {} to {}: {}", permissionName, actorId, reason);
            throw AuditCoreException.forbidden();
        }
        log.warn("Advisory mode: {} would be denied {} ({})", actorId, permissionName, reason);
    }
}
