package com.example.auditcore.service;

import com.example.auditcore.models.Scope;

/**
 * Outcome of a single authorization check. Callers outside this package should only rely on
 * {@link #allowed()}; the variants exist for auditing.
 */
public sealed interface AuthorizationDecision {

    boolean allowed();

    /**
     * The user holds the reserved super-admin role; no permission was consulted.
     */
    record Bypassed() implements AuthorizationDecision {
        @Override
        public boolean allowed() {
            return true;
        }
    }

    /**
     * @param roleName set for {@link GrantSource#ROLE}
     * @param scope    the matching grant's scope, set for {@link GrantSource#DIRECT}
     */
    record GrantedBy(GrantSource source, String roleName, Scope scope) implements AuthorizationDecision {

        public static GrantedBy role(String roleName) {
            return new GrantedBy(GrantSource.ROLE, roleName, null);
        }

        public static GrantedBy direct(Scope scope) {
            return new GrantedBy(GrantSource.DIRECT, null, scope);
        }

        @Override
        public boolean allowed() {
            return true;
        }
    }

    record Denied() implements AuthorizationDecision {
        @Override
        public boolean allowed() {
            return false;
        }
    }
}
