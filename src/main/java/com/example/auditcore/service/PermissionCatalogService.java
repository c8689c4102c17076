package com.example.auditcore.service;

import static com.example.auditcore.service.AuditGateway.details;

import com.example.auditcore.access.CatalogAccess;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.PermissionBinding;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Roles, permissions and the bindings between them. Every mutation is validated against the
 * catalog revision and committed in one transaction with the ledger event naming the acting user.
 */
@Service
@RequiredArgsConstructor
public class PermissionCatalogService {

    // DynamoDB transactions are capped at 100 items; the role row, its name claim, the revision
    // bump, the ledger event and the chain tail take five of them.
    static final int MAX_CASCADE = 95;

    private final CatalogAccess catalogAccess;
    private final CatalogWriter writer;
    private final Clock clock;

    public Role createRole(String actorId, String name, String description) {
        CatalogWriter.requireActor(actorId);
        if (!Role.isValidName(name)) {
            throw new IllegalArgumentException("role name must match [a-z][a-z0-9_]*");
        }

        return writer.write("createRole", revision -> {
            if (catalogAccess.findRoleByName(name).isPresent()) {
                throw AuditCoreException.roleAlreadyExists(name);
            }
            long now = clock.millis();
            Role role = Role.builder()
                    .roleId(UUID.randomUUID().toString())
                    .name(name)
                    .description(description)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            catalogAccess.createRole(role, revision, writer.audit(OperationKind.ROLE_CREATED, actorId,
                    role.getRoleId(), details(
                            "role_id", role.getRoleId(),
                            "name", role.getName(),
                            "description", role.getDescription())));
            return role;
        });
    }

    /**
     * Renames and/or re-describes a role. Absent fields are left unchanged.
     */
    public Role updateRole(String actorId, String roleId, String name, String description) {
        CatalogWriter.requireActor(actorId);
        if (name != null && !Role.isValidName(name)) {
            throw new IllegalArgumentException("role name must match [a-z][a-z0-9_]*");
        }

        return writer.write("updateRole", revision -> {
            Role role = catalogAccess.findRole(roleId)
                    .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            boolean rename = name != null && !name.equals(role.getName());
            if (rename) {
                if (role.isReserved()) {
                    throw AuditCoreException.reservedRole(role.getName());
                }
                if (catalogAccess.findRoleByName(name).isPresent()) {
                    throw AuditCoreException.roleAlreadyExists(name);
                }
            }
            Role next = role.toBuilder()
                    .name(rename ? name : role.getName())
                    .description(description != null ? description : role.getDescription())
                    .updatedAt(clock.millis())
                    .build();
            catalogAccess.updateRole(role, next, revision, writer.audit(OperationKind.ROLE_UPDATED, actorId,
                    roleId, details(
                            "role_id", roleId,
                            "before", details("name", role.getName(), "description", role.getDescription()),
                            "after", details("name", next.getName(), "description", next.getDescription()))));
            return next;
        });
    }

    /**
     * Deletes a role together with every user membership and permission binding it has.
     */
    public void deleteRole(String actorId, String roleId) {
        CatalogWriter.requireActor(actorId);

        writer.write("deleteRole", revision -> {
            Role role = catalogAccess.findRole(roleId)
                    .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            if (role.isReserved()) {
                throw AuditCoreException.reservedRole(role.getName());
            }
            List<RoleBinding> members = catalogAccess.findRoleMembers(roleId);
            List<PermissionBinding> bindings = catalogAccess.findPermissionBindings(roleId);
            if (members.size() + bindings.size() > MAX_CASCADE) {
                throw new IllegalArgumentException("role " + role.getName()
                        + " has too many bindings to delete in one step; unbind some first");
            }
            Map<String, Object> removed = details(
                    "role_id", roleId,
                    "name", role.getName(),
                    "revoked_user_ids", members.stream().map(RoleBinding::getUserId).sorted().collect(Collectors.toList()),
                    "revoked_permission_ids", bindings.stream().map(PermissionBinding::getPermissionId).sorted()
                            .collect(Collectors.toList()));
            catalogAccess.deleteRole(role, members, bindings, revision,
                    writer.audit(OperationKind.ROLE_DELETED, actorId, roleId, removed));
            return role;
        });
    }

    public Permission createPermission(String actorId, String name, String description) {
        CatalogWriter.requireActor(actorId);
        if (!Permission.isValidName(name)) {
            throw new IllegalArgumentException("permission name must follow resource.action");
        }

        return writer.write("createPermission", revision -> {
            if (catalogAccess.findPermissionByName(name).isPresent()) {
                throw AuditCoreException.permissionAlreadyExists(name);
            }
            Permission permission = Permission.builder()
                    .permissionId(UUID.randomUUID().toString())
                    .name(name)
                    .description(description)
                    .createdAt(clock.millis())
                    .build();
            catalogAccess.createPermission(permission, revision, writer.audit(OperationKind.PERMISSION_CREATED,
                    actorId, permission.getPermissionId(), details(
                            "permission_id", permission.getPermissionId(),
                            "name", permission.getName(),
                            "description", permission.getDescription())));
            return permission;
        });
    }

    public PermissionBinding bindPermission(String actorId, String roleId, String permissionId) {
        CatalogWriter.requireActor(actorId);

        return writer.write("bindPermission", revision -> {
            Role role = catalogAccess.findRole(roleId)
                    .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            Permission permission = catalogAccess.findPermission(permissionId)
                    .orElseThrow(() -> AuditCoreException.permissionNotFound(permissionId));
            if (catalogAccess.findPermissionBinding(roleId, permissionId).isPresent()) {
                throw AuditCoreException.permissionBindingAlreadyExists(roleId, permissionId);
            }
            PermissionBinding binding = PermissionBinding.builder()
                    .roleId(roleId)
                    .permissionId(permissionId)
                    .boundAt(clock.millis())
                    .boundBy(actorId)
                    .build();
            catalogAccess.putPermissionBinding(binding, revision, writer.audit(OperationKind.ROLE_PERMISSION_GRANTED,
                    actorId, roleId, details(
                            "role_id", roleId,
                            "role_name", role.getName(),
                            "permission_id", permissionId,
                            "permission_name", permission.getName())));
            return binding;
        });
    }

    public void unbindPermission(String actorId, String roleId, String permissionId) {
        CatalogWriter.requireActor(actorId);

        writer.write("unbindPermission", revision -> {
            Role role = catalogAccess.findRole(roleId)
                    .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            PermissionBinding binding = catalogAccess.findPermissionBinding(roleId, permissionId)
                    .orElseThrow(() -> AuditCoreException.permissionBindingNotFound(roleId, permissionId));
            String permissionName = catalogAccess.findPermission(permissionId).map(Permission::getName).orElse(null);
            catalogAccess.deletePermissionBinding(binding, revision, writer.audit(OperationKind.ROLE_PERMISSION_REVOKED,
                    actorId, roleId, details(
                            "role_id", roleId,
                            "role_name", role.getName(),
                            "permission_id", permissionId,
                            "permission_name", permissionName)));
            return binding;
        });
    }

    public List<Role> listRoles() {
        return writer.read("listRoles", () -> catalogAccess.listRoles().stream()
                .sorted(Comparator.comparing(Role::getName))
                .collect(Collectors.toList()));
    }

    public Role getRole(String roleId) {
        return writer.read("getRole", () -> catalogAccess.findRole(roleId))
                .orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
    }

    public Optional<Role> findRoleByName(String name) {
        return writer.read("findRoleByName", () -> catalogAccess.findRoleByName(name));
    }

    public List<Permission> listPermissions() {
        return writer.read("listPermissions", () -> catalogAccess.listPermissions().stream()
                .sorted(Comparator.comparing(Permission::getName))
                .collect(Collectors.toList()));
    }

    public Permission getPermission(String permissionId) {
        return writer.read("getPermission", () -> catalogAccess.findPermission(permissionId))
                .orElseThrow(() -> AuditCoreException.permissionNotFound(permissionId));
    }

    public Optional<Permission> findPermissionByName(String name) {
        return writer.read("findPermissionByName", () -> catalogAccess.findPermissionByName(name));
    }

    /**
     * Permissions bound to the role, sorted by name.
     */
    public List<Permission> rolePermissions(String roleId) {
        return writer.read("rolePermissions", () -> {
            catalogAccess.findRole(roleId).orElseThrow(() -> AuditCoreException.roleNotFound(roleId));
            return catalogAccess.findPermissionBindings(roleId).stream()
                    .map(b -> catalogAccess.findPermission(b.getPermissionId()))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(Permission::getName))
                    .collect(Collectors.toList());
        });
    }

}
