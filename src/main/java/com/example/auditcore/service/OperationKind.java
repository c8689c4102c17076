package com.example.auditcore.service;

import com.example.auditcore.models.Severity;

/**
 * Every operation the gateway knows how to record, with its ledger event name and default
 * severity. Names follow {@code resource.action}.
 */
public enum OperationKind {
    ROLE_CREATED("role.created", Severity.IMPORTANT),
    ROLE_UPDATED("role.updated", Severity.IMPORTANT),
    ROLE_DELETED("role.deleted", Severity.IMPORTANT),
    PERMISSION_CREATED("permission.created", Severity.IMPORTANT),
    ROLE_PERMISSION_GRANTED("role.permission_granted", Severity.IMPORTANT),
    ROLE_PERMISSION_REVOKED("role.permission_revoked", Severity.IMPORTANT),
    USER_ROLE_ASSIGNED("user.role_assigned", Severity.IMPORTANT),
    USER_ROLE_REVOKED("user.role_revoked", Severity.IMPORTANT),
    USER_PERMISSION_GRANTED("user.permission_granted", Severity.IMPORTANT),
    USER_PERMISSION_REVOKED("user.permission_revoked", Severity.IMPORTANT),
    AUTHZ_BYPASSED("authz.bypassed", Severity.IMPORTANT),
    AUTHZ_DENIED("authz.denied", Severity.IMPORTANT),
    USER_REGISTERED("user.registered", Severity.IMPORTANT),
    USER_LOGIN("user.login", Severity.IMPORTANT),
    USER_LOGIN_FAILED("user.login_failed", Severity.IMPORTANT),
    LEDGER_PURGED("ledger.purged", Severity.IMPORTANT),
    RESOURCE_VIEWED("resource.viewed", Severity.NOISE),
    AUTHZ_CHECKED("authz.checked", Severity.NOISE);

    private final String eventName;
    private final Severity defaultSeverity;

    OperationKind(String eventName, Severity defaultSeverity) {
        this.eventName = eventName;
        this.defaultSeverity = defaultSeverity;
    }

    public String eventName() {
        return eventName;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public static OperationKind fromEventName(String eventName) {
        for (OperationKind kind : values()) {
            if (kind.eventName.equals(eventName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + eventName);
    }
}
