package com.example.auditcore.http;

/**
 * Permission names guarding the admin endpoints.
 */
final class AdminPermissions {

    static final String ROLE_VIEW = "role.view";
    static final String ROLE_MANAGE = "role.manage";
    static final String PERMISSION_VIEW = "permission.view";
    static final String PERMISSION_MANAGE = "permission.manage";
    static final String USER_VIEW = "user.view";
    static final String USER_MANAGE = "user.manage";
    static final String LEDGER_VIEW = "ledger.view";
    static final String LEDGER_PURGE = "ledger.purge";

    static final String ACTOR_HEADER = "X-Actor-Id";

    private AdminPermissions() {
    }
}
