package com.example.auditcore.service;

import static com.example.auditcore.service.AuditGateway.details;

import com.example.auditcore.access.CatalogAccess;
import com.example.auditcore.access.UserAccess;
import com.example.auditcore.models.DirectGrant;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import com.example.auditcore.models.Scope;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Binds users to roles and grants them permissions directly, optionally narrowed by a scope.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrantService {

    private final CatalogAccess catalogAccess;
    private final UserAccess userAccess;
    private final CatalogWriter writer;
    private final Clock clock;

    public RoleBinding bindRole(String actorId, String userId, String roleId) {
        CatalogWriter.requireActor(actorId);
        requireUser(userId);

        return writer.write("bindRole", revision -> {
            Role role = catalogAccess.findRole(roleId)
                    .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            if (catalogAccess.findRoleBinding(userId, roleId).isPresent()) {
                throw AuditCoreException.roleBindingAlreadyExists(userId, roleId);
            }
            RoleBinding binding = RoleBinding.builder()
                    .userId(userId)
                    .roleId(roleId)
                    .boundAt(clock.millis())
                    .boundBy(actorId)
                    .build();
            catalogAccess.putRoleBinding(binding, revision,
                    writer.audit(OperationKind.USER_ROLE_ASSIGNED, actorId, userId, details(
                            "user_id", userId,
                            "role_id", roleId,
                            "role_name", role.getName())));
            return binding;
        });
    }

    /**
     * Removes the binding. The role itself need not exist any more, so bindings left behind by a
     * role deletion can be removed the same way.
     */
    public void unbindRole(String actorId, String userId, String roleId) {
        CatalogWriter.requireActor(actorId);
        requireUser(userId);

        writer.write("unbindRole", revision -> {
            RoleBinding binding = catalogAccess.findRoleBinding(userId, roleId)
                    .orElseThrow(() -> AuditCoreException.roleBindingNotFound(userId, roleId));
            String roleName = catalogAccess.findRole(roleId).map(Role::getName).orElse(null);
            catalogAccess.deleteRoleBinding(binding, revision,
                    writer.audit(OperationKind.USER_ROLE_REVOKED, actorId, userId, details(
                            "user_id", userId,
                            "role_id", roleId,
                            "role_name", roleName)));
            return binding;
        });
    }

    /**
     * Deletes role bindings whose role no longer exists. Role deletion finds members through an
     * eventually consistent index, so a binding committed just before the delete can be missed.
     * Each removal is recorded as a {@code user.role_revoked} event with reason {@code role_deleted}.
     *
     * @return number of bindings removed
     */
    public int pruneDanglingRoleBindings(String actorId) {
        CatalogWriter.requireActor(actorId);
        List<RoleBinding> candidates = writer.read("listRoleBindings", catalogAccess::listRoleBindings);
        int removed = 0;
        for (RoleBinding candidate : candidates) {
            boolean deleted = writer.write("pruneRoleBinding", revision -> {
                if (catalogAccess.findRole(candidate.getRoleId()).isPresent()) {
                    return false;
                }
                Optional<RoleBinding> binding = catalogAccess.findRoleBinding(candidate.getUserId(), candidate.getRoleId());
                if (binding.isEmpty()) {
                    return false;
                }
                catalogAccess.deleteRoleBinding(binding.get(), revision,
                        writer.audit(OperationKind.USER_ROLE_REVOKED, actorId, candidate.getUserId(), details(
                                "user_id", candidate.getUserId(),
                                "role_id", candidate.getRoleId(),
                                "reason", "role_deleted")));
                return true;
            });
            if (deleted) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} role bindings pointing at deleted roles", removed);
        }
        return removed;
    }

    /**
     * Grants {@code permissionName} to the user under {@code scopeJson}; a missing or empty scope
     * makes the grant unrestricted. The same permission may be held under several scopes.
     */
    public DirectGrant grantPermission(String actorId, String userId, String permissionName, JsonNode scopeJson) {
        CatalogWriter.requireActor(actorId);
        Scope scope = parseScope(scopeJson);
        requireUser(userId);

        return writer.write("grantPermission", revision -> {
            Permission permission = catalogAccess.findPermissionByName(permissionName)
                    .orElseThrow(() -> AuditCoreException.permissionNotFound(permissionName));
            String grantKey = DirectGrant.grantKey(permission.getPermissionId(), scope);
            if (catalogAccess.findDirectGrant(userId, grantKey).isPresent()) {
                throw AuditCoreException.grantAlreadyExists(userId, permissionName);
            }
            DirectGrant grant = DirectGrant.builder()
                    .userId(userId)
                    .grantId(UUID.randomUUID().toString())
                    .permissionId(permission.getPermissionId())
                    .scope(scope)
                    .grantedAt(clock.millis())
                    .grantedBy(actorId)
                    .build();
            catalogAccess.putDirectGrant(grant, revision,
                    writer.audit(OperationKind.USER_PERMISSION_GRANTED, actorId, userId, details(
                            "user_id", userId,
                            "grant_id", grant.getGrantId(),
                            "permission_id", grant.getPermissionId(),
                            "permission_name", permissionName,
                            "scope", scope.asMap())));
            return grant;
        });
    }

    /**
     * Removes exactly the (permission, scope) grant; grants of the same permission under other
     * scopes are untouched.
     */
    public void revokePermission(String actorId, String userId, String permissionName, JsonNode scopeJson) {
        CatalogWriter.requireActor(actorId);
        Scope scope = parseScope(scopeJson);
        requireUser(userId);

        writer.write("revokePermission", revision -> {
            Permission permission = catalogAccess.findPermissionByName(permissionName)
                    .orElseThrow(() -> AuditCoreException.permissionNotFound(permissionName));
            DirectGrant grant = catalogAccess.findDirectGrant(userId, DirectGrant.grantKey(permission.getPermissionId(), scope))
                    .orElseThrow(() -> AuditCoreException.grantNotFound(userId, permissionName));
            catalogAccess.deleteDirectGrant(grant, revision,
                    writer.audit(OperationKind.USER_PERMISSION_REVOKED, actorId, userId, details(
                            "user_id", userId,
                            "grant_id", grant.getGrantId(),
                            "permission_id", grant.getPermissionId(),
                            "permission_name", permissionName,
                            "scope", scope.asMap())));
            return grant;
        });
    }

    public List<Role> userRoles(String userId) {
        requireUser(userId);
        return writer.read("userRoles", () -> catalogAccess.findRoleBindings(userId).stream()
                .map(b -> catalogAccess.findRole(b.getRoleId()))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(Role::getName))
                .collect(Collectors.toList()));
    }

    public List<DirectGrant> directGrants(String userId) {
        requireUser(userId);
        return writer.read("directGrants", () -> catalogAccess.findDirectGrants(userId));
    }

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be non-blank");
        }
        writer.read("findUser", () -> userAccess.findByUserId(userId))
                .orElseThrow(() -> AuditCoreException.userNotFound(userId));
    }

    private static Scope parseScope(JsonNode scopeJson) {
        try {
            return Scope.parse(scopeJson);
        } catch (IllegalArgumentException ex) {
            throw AuditCoreException.invalidScope(ex.getMessage());
        }
    }
}
