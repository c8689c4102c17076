package com.example.auditcore.service;

import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;

public class AuditCoreException extends RuntimeException {

    public enum Code {
        INTEGRITY_VIOLATION,
        CONFLICTING_APPEND,
        STORAGE_UNAVAILABLE,
        EVENT_NOT_FOUND,
        ROLE_NOT_FOUND,
        PERMISSION_NOT_FOUND,
        USER_NOT_FOUND,
        ROLE_BINDING_NOT_FOUND,
        PERMISSION_BINDING_NOT_FOUND,
        GRANT_NOT_FOUND,
        INVALID_SCOPE,
        ROLE_ALREADY_EXISTS,
        PERMISSION_ALREADY_EXISTS,
        ROLE_BINDING_ALREADY_EXISTS,
        PERMISSION_BINDING_ALREADY_EXISTS,
        GRANT_ALREADY_EXISTS,
        RESERVED_ROLE,
        FORBIDDEN
    }

    private static final Set<Code> TRANSIENT = EnumSet.of(Code.CONFLICTING_APPEND, Code.STORAGE_UNAVAILABLE);

    @Getter
    private final Code code;

    private AuditCoreException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    private AuditCoreException(Code code, String message) {
        this(code, message, null);
    }

    /**
     * Transient failures may succeed when retried by the caller; everything else will not.
     */
    public boolean isTransient() {
        return TRANSIENT.contains(code);
    }

    public static AuditCoreException integrityViolation(IntegrityViolation violation) {
        return new AuditCoreException(Code.INTEGRITY_VIOLATION,
                "Ledger integrity violation at seq " + violation.sequence() + ": " + violation.reason());
    }

    public static AuditCoreException conflictingAppend(String chainId, int attempts) {
        return new AuditCoreException(Code.CONFLICTING_APPEND,
                "Could not append to chain " + chainId + " after " + attempts + " attempts");
    }

    public static AuditCoreException storageUnavailable(String operation, Throwable cause) {
        return new AuditCoreException(Code.STORAGE_UNAVAILABLE,
                "Storage unavailable during " + operation, cause);
    }

    public static AuditCoreException eventNotFound(String eventId) {
        return new AuditCoreException(Code.EVENT_NOT_FOUND,
                "Event " + eventId + " does not exist");
    }

    public static AuditCoreException roleNotFound(String roleId) {
        return new AuditCoreException(Code.ROLE_NOT_FOUND,
                "Role " + roleId + " does not exist");
    }

    public static AuditCoreException permissionNotFound(String permission) {
        return new AuditCoreException(Code.PERMISSION_NOT_FOUND,
                "Permission " + permission + " does not exist");
    }

    public static AuditCoreException userNotFound(String userId) {
        return new AuditCoreException(Code.USER_NOT_FOUND,
                "User " + userId + " does not exist");
    }

    public static AuditCoreException roleBindingNotFound(String userId, String roleId) {
        return new AuditCoreException(Code.ROLE_BINDING_NOT_FOUND,
                "User " + userId + " does not hold role " + roleId);
    }

    public static AuditCoreException permissionBindingNotFound(String roleId, String permissionId) {
        return new AuditCoreException(Code.PERMISSION_BINDING_NOT_FOUND,
                "Role " + roleId + " is not bound to permission " + permissionId);
    }

    public static AuditCoreException grantNotFound(String userId, String permission) {
        return new AuditCoreException(Code.GRANT_NOT_FOUND,
                "User " + userId + " has no grant of " + permission + " with that scope");
    }

    public static AuditCoreException invalidScope(String reason) {
        return new AuditCoreException(Code.INVALID_SCOPE, "Invalid scope: " + reason);
    }

    public static AuditCoreException roleAlreadyExists(String name) {
        return new AuditCoreException(Code.ROLE_ALREADY_EXISTS,
                "Role " + name + " already exists");
    }

    public static AuditCoreException permissionAlreadyExists(String name) {
        return new AuditCoreException(Code.PERMISSION_ALREADY_EXISTS,
                "Permission " + name + " already exists");
    }

    public static AuditCoreException roleBindingAlreadyExists(String userId, String roleId) {
        return new AuditCoreException(Code.ROLE_BINDING_ALREADY_EXISTS,
                "User " + userId + " already holds role " + roleId);
    }

    public static AuditCoreException permissionBindingAlreadyExists(String roleId, String permissionId) {
        return new AuditCoreException(Code.PERMISSION_BINDING_ALREADY_EXISTS,
                "Role " + roleId + " is already bound to permission " + permissionId);
    }

    public static AuditCoreException grantAlreadyExists(String userId, String permission) {
        return new AuditCoreException(Code.GRANT_ALREADY_EXISTS,
                "User " + userId + " already holds " + permission + " with that scope");
    }

    public static AuditCoreException reservedRole(String name) {
        return new AuditCoreException(Code.RESERVED_ROLE,
                "Role " + name + " is reserved and cannot be renamed or deleted");
    }

    public static AuditCoreException forbidden() {
        return new AuditCoreException(Code.FORBIDDEN, "Forbidden");
    }
}
