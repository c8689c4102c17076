package com.example.auditcore.service;

import static com.example.auditcore.service.CoreFixture.ADMIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.auditcore.models.CanonicalJson;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import com.example.auditcore.models.Scope;
import com.example.auditcore.service.EffectivePermissions.EffectivePermission;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScopedGrantResolverTest {

    private CoreFixture fx;
    private ScopedGrantResolver resolver;
    private Role viewer;
    private Role superAdmin;

    @BeforeEach
    void setUp() {
        fx = new CoreFixture();
        fx.userAccess.add("alice", "bob", "carol", "root");
        resolver = fx.resolver;

        Permission taskView = fx.catalog.createPermission(ADMIN, "task.view", null);
        fx.catalog.createPermission(ADMIN, "task.delete", null);
        viewer = fx.catalog.createRole(ADMIN, "viewer", null);
        superAdmin = fx.catalog.createRole(ADMIN, Role.SUPER_ADMIN, null);
        fx.catalog.bindPermission(ADMIN, viewer.getRoleId(), taskView.getPermissionId());
    }

    @Test
    @DisplayName("super_admin bypasses every check")
    void superAdminBypass() {
        fx.grants.bindRole(ADMIN, "root", superAdmin.getRoleId());

        AuthorizationDecision decision = resolver.decide("root", "anything.at_all", Scope.empty());

        assertInstanceOf(AuthorizationDecision.Bypassed.class, decision);
        assertTrue(decision.allowed());
    }

    @Test
    @DisplayName("role-derived permissions are global")
    void rolePermission() {
        fx.grants.bindRole(ADMIN, "alice", viewer.getRoleId());

        AuthorizationDecision decision = resolver.decide("alice", "task.view", Scope.of("project_id", "P9"));

        AuthorizationDecision.GrantedBy granted = assertInstanceOf(AuthorizationDecision.GrantedBy.class, decision);
        assertEquals(GrantSource.ROLE, granted.source());
        assertEquals("viewer", granted.roleName());
        assertFalse(resolver.isAuthorized("alice", "task.delete", Scope.empty()));
    }

    @Test
    @DisplayName("a direct grant matches only requests carrying its scope")
    void scopedDirectGrant() {
        fx.grants.grantPermission(ADMIN, "bob", "task.delete", CanonicalJson.parse("{\"project_id\":\"P1\"}"));

        assertTrue(resolver.isAuthorized("bob", "task.delete", Scope.of("project_id", "P1")));
        assertTrue(resolver.isAuthorized("bob", "task.delete",
                Scope.of(Map.of("project_id", "P1", "team_id", "T3"))));
        assertFalse(resolver.isAuthorized("bob", "task.delete", Scope.of("project_id", "P2")));
        assertFalse(resolver.isAuthorized("bob", "task.delete", Scope.empty()));
        assertFalse(resolver.isAuthorized("bob", "task.view", Scope.of("project_id", "P1")));
    }

    @Test
    @DisplayName("an unrestricted direct grant matches any scope")
    void unrestrictedDirectGrant() {
        fx.grants.grantPermission(ADMIN, "bob", "task.delete", null);

        AuthorizationDecision decision = resolver.decide("bob", "task.delete", Scope.of("project_id", "P7"));

        AuthorizationDecision.GrantedBy granted = assertInstanceOf(AuthorizationDecision.GrantedBy.class, decision);
        assertEquals(GrantSource.DIRECT, granted.source());
        assertTrue(granted.scope().isEmpty());
    }

    @Test
    @DisplayName("revoking one scope keeps the others")
    void revokeOneScope() {
        fx.grants.grantPermission(ADMIN, "bob", "task.delete", CanonicalJson.parse("{\"project_id\":\"P1\"}"));
        fx.grants.grantPermission(ADMIN, "bob", "task.delete", CanonicalJson.parse("{\"project_id\":\"P2\"}"));

        fx.grants.revokePermission(ADMIN, "bob", "task.delete", CanonicalJson.parse("{\"project_id\":\"P1\"}"));

        assertFalse(resolver.isAuthorized("bob", "task.delete", Scope.of("project_id", "P1")));
        assertTrue(resolver.isAuthorized("bob", "task.delete", Scope.of("project_id", "P2")));
    }

    @Test
    @DisplayName("unknown users and permissions are simply denied")
    void unknownsDenied() {
        assertInstanceOf(AuthorizationDecision.Denied.class, resolver.decide("ghost", "task.view", Scope.empty()));
        assertFalse(resolver.isAuthorized("alice", "no.such", Scope.empty()));
    }

    @Test
    @DisplayName("removing a role takes its permissions away immediately")
    void roleRemoval() {
        fx.grants.bindRole(ADMIN, "alice", viewer.getRoleId());
        assertTrue(resolver.isAuthorized("alice", "task.view", null));

        fx.catalog.deleteRole(ADMIN, viewer.getRoleId());

        assertFalse(resolver.isAuthorized("alice", "task.view", null));
    }

    @Test
    @DisplayName("effective permissions list role entries first, then direct grants")
    void effectivePermissions() {
        fx.grants.bindRole(ADMIN, "carol", viewer.getRoleId());
        fx.grants.grantPermission(ADMIN, "carol", "task.delete", CanonicalJson.parse("{\"project_id\":\"P2\"}"));
        fx.grants.grantPermission(ADMIN, "carol", "task.delete", CanonicalJson.parse("{\"project_id\":\"P1\"}"));

        EffectivePermissions effective = resolver.effectivePermissions("carol");

        assertEquals(List.of("viewer"), effective.roles());
        List<EffectivePermission> entries = effective.permissions();
        assertEquals(3, entries.size());
        assertEquals(new EffectivePermission("task.view", GrantSource.ROLE, "viewer", null), entries.get(0));
        assertEquals(GrantSource.DIRECT, entries.get(1).source());
        assertNull(entries.get(1).roleName());
        assertEquals(List.of(Scope.of("project_id", "P1"), Scope.of("project_id", "P2")),
                entries.subList(1, 3).stream().map(EffectivePermission::scope).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("effective permissions of an unknown user fail with USER_NOT_FOUND")
    void effectiveUnknownUser() {
        AuditCoreException ex = assertThrows(AuditCoreException.class, () -> resolver.effectivePermissions("ghost"));
        assertEquals(AuditCoreException.Code.USER_NOT_FOUND, ex.getCode());
    }

    @Test
    @DisplayName("a mutation landing mid-read forces a fresh snapshot")
    void snapshotRetry() {
        fx.grants.bindRole(ADMIN, "alice", viewer.getRoleId());
        fx.catalogAccess.beforeNextRoleBindingsRead(() -> fx.grants.unbindRole(ADMIN, "alice", viewer.getRoleId()));

        assertFalse(resolver.isAuthorized("alice", "task.view", Scope.empty()));
    }

    @Test
    @DisplayName("a catalog that never settles surfaces STORAGE_UNAVAILABLE")
    void snapshotExhausted() {
        fx.catalogProperties.getSnapshot().setMaxAttempts(1);
        fx.catalogAccess.beforeNextRoleBindingsRead(fx.catalogAccess::bumpRevision);

        AuditCoreException ex = assertThrows(AuditCoreException.class,
                () -> resolver.decide("alice", "task.view", Scope.empty()));
        assertEquals(AuditCoreException.Code.STORAGE_UNAVAILABLE, ex.getCode());
    }

    @Test
    @DisplayName("a membership whose role vanished grants nothing")
    void danglingBinding() {
        fx.catalogAccess.insertWithoutAudit(RoleBinding.builder()
                .userId("alice").roleId("deleted-role").boundAt(0L).boundBy(ADMIN).build());

        assertFalse(resolver.isAuthorized("alice", "task.view", Scope.empty()));
        assertTrue(resolver.effectivePermissions("alice").roles().isEmpty());
    }
}
