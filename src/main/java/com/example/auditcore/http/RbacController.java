package com.example.auditcore.http;

import static com.example.auditcore.http.AdminPermissions.ACTOR_HEADER;

import com.example.auditcore.models.DirectGrant;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.PermissionBinding;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.Scope;
import com.example.auditcore.requests.AssignPermissionHttpRequest;
import com.example.auditcore.requests.AssignRoleHttpRequest;
import com.example.auditcore.requests.AuthorizeHttpRequest;
import com.example.auditcore.requests.CreatePermissionHttpRequest;
import com.example.auditcore.requests.CreateRoleHttpRequest;
import com.example.auditcore.requests.GrantPermissionHttpRequest;
import com.example.auditcore.requests.UpdateRoleHttpRequest;
import com.example.auditcore.service.AuditCoreException;
import com.example.auditcore.service.AuthorizationEnforcer;
import com.example.auditcore.service.EffectivePermissions;
import com.example.auditcore.service.GrantService;
import com.example.auditcore.service.PermissionCatalogService;
import com.example.auditcore.service.ScopedGrantResolver;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin surface for the permission catalog and user grants. The acting user comes from the
 * {@code X-Actor-Id} header set by the authentication layer in front of this service; mutations
 * reject requests without it.
 */
@RestController
public class RbacController {

    private final PermissionCatalogService catalog;
    private final GrantService grants;
    private final ScopedGrantResolver resolver;
    private final AuthorizationEnforcer enforcer;

    public RbacController(PermissionCatalogService catalog,
                          GrantService grants,
                          ScopedGrantResolver resolver,
                          AuthorizationEnforcer enforcer) {
        this.catalog = catalog;
        this.grants = grants;
        this.resolver = resolver;
        this.enforcer = enforcer;
    }

    // roles

    @GetMapping("/rbac/roles")
    public ResponseEntity<List<RoleResponse>> listRoles(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        enforcer.require(actorId, AdminPermissions.ROLE_VIEW);
        return ResponseEntity.ok(catalog.listRoles().stream()
                .map(RbacController::toRoleResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rbac/roles")
    public ResponseEntity<RoleResponse> createRole(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @Valid @RequestBody CreateRoleHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.ROLE_MANAGE);
        Role role = catalog.createRole(actorId, request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(toRoleResponse(role));
    }

    @GetMapping("/rbac/roles/{roleId}")
    public ResponseEntity<RoleResponse> getRole(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String roleId) {
        enforcer.require(actorId, AdminPermissions.ROLE_VIEW);
        return ResponseEntity.ok(toRoleResponse(catalog.getRole(roleId)));
    }

    @PatchMapping("/rbac/roles/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String roleId,
            @RequestBody UpdateRoleHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.ROLE_MANAGE);
        Role role = catalog.updateRole(actorId, roleId, request.name(), request.description());
        return ResponseEntity.ok(toRoleResponse(role));
    }

    @DeleteMapping("/rbac/roles/{roleId}")
    public ResponseEntity<Void> deleteRole(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String roleId) {
        enforcer.require(actorId, AdminPermissions.ROLE_MANAGE);
        catalog.deleteRole(actorId, roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/rbac/roles/{roleId}/permissions")
    public ResponseEntity<List<PermissionResponse>> rolePermissions(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String roleId) {
        enforcer.require(actorId, AdminPermissions.ROLE_VIEW);
        return ResponseEntity.ok(catalog.rolePermissions(roleId).stream()
                .map(RbacController::toPermissionResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rbac/roles/{roleId}/permissions")
    public ResponseEntity<PermissionResponse> bindPermission(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String roleId,
            @Valid @RequestBody AssignPermissionHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.ROLE_MANAGE);
        PermissionBinding binding = catalog.bindPermission(actorId, roleId, request.permissionId());
        Permission permission = catalog.getPermission(binding.getPermissionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(toPermissionResponse(permission));
    }

    @DeleteMapping("/rbac/roles/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> unbindPermission(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String roleId,
            @PathVariable String permissionId) {
        enforcer.require(actorId, AdminPermissions.ROLE_MANAGE);
        catalog.unbindPermission(actorId, roleId, permissionId);
        return ResponseEntity.noContent().build();
    }

    // permissions

    @GetMapping("/rbac/permissions")
    public ResponseEntity<List<PermissionResponse>> listPermissions(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        enforcer.require(actorId, AdminPermissions.PERMISSION_VIEW);
        return ResponseEntity.ok(catalog.listPermissions().stream()
                .map(RbacController::toPermissionResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rbac/permissions")
    public ResponseEntity<PermissionResponse> createPermission(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @Valid @RequestBody CreatePermissionHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.PERMISSION_MANAGE);
        Permission permission = catalog.createPermission(actorId, request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(toPermissionResponse(permission));
    }

    // users

    @GetMapping("/rbac/users/{userId}/roles")
    public ResponseEntity<List<RoleResponse>> userRoles(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String userId) {
        enforcer.require(actorId, AdminPermissions.USER_VIEW);
        return ResponseEntity.ok(grants.userRoles(userId).stream()
                .map(RbacController::toRoleResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rbac/users/{userId}/roles")
    public ResponseEntity<RoleResponse> bindRole(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String userId,
            @Valid @RequestBody AssignRoleHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.USER_MANAGE);
        grants.bindRole(actorId, userId, request.roleId());
        return ResponseEntity.status(HttpStatus.CREATED).body(toRoleResponse(catalog.getRole(request.roleId())));
    }

    @DeleteMapping("/rbac/users/{userId}/roles/{roleId}")
    public ResponseEntity<Void> unbindRole(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String userId,
            @PathVariable String roleId) {
        enforcer.require(actorId, AdminPermissions.USER_MANAGE);
        grants.unbindRole(actorId, userId, roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/rbac/users/{userId}/permissions")
    public ResponseEntity<List<DirectGrantResponse>> directGrants(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String userId) {
        enforcer.require(actorId, AdminPermissions.USER_VIEW);
        return ResponseEntity.ok(grants.directGrants(userId).stream()
                .map(RbacController::toGrantResponse)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rbac/users/{userId}/permissions")
    public ResponseEntity<DirectGrantResponse> grantPermission(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String userId,
            @Valid @RequestBody GrantPermissionHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.USER_MANAGE);
        DirectGrant grant = grants.grantPermission(actorId, userId, request.permission(), request.scope());
        return ResponseEntity.status(HttpStatus.CREATED).body(toGrantResponse(grant));
    }

    @PostMapping("/rbac/users/{userId}/permissions/revoke")
    public ResponseEntity<Void> revokePermission(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @PathVariable String userId,
            @Valid @RequestBody GrantPermissionHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.USER_MANAGE);
        grants.revokePermission(actorId, userId, request.permission(), request.scope());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/rbac/users/{userId}/effective-permissions")
    public ResponseEntity<EffectivePermissionsResponse> effectivePermissions(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String userId) {
        enforcer.require(actorId, AdminPermissions.USER_VIEW);
        EffectivePermissions effective = resolver.effectivePermissions(userId);
        return ResponseEntity.ok(new EffectivePermissionsResponse(
                effective.userId(),
                effective.roles(),
                effective.permissions().stream()
                        .map(p -> new EffectivePermissionsResponse.Entry(
                                p.name(),
                                p.source(),
                                p.roleName(),
                                p.scope() == null ? null : p.scope().asMap()))
                        .collect(Collectors.toList())));
    }

    @PostMapping("/rbac/users/{userId}/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String userId,
            @Valid @RequestBody AuthorizeHttpRequest request) {
        enforcer.require(actorId, AdminPermissions.USER_VIEW);
        Scope scope;
        try {
            scope = Scope.parse(request.scope());
        } catch (IllegalArgumentException ex) {
            throw AuditCoreException.invalidScope(ex.getMessage());
        }
        return ResponseEntity.ok(new AuthorizeResponse(resolver.isAuthorized(userId, request.permission(), scope)));
    }

    private static RoleResponse toRoleResponse(Role role) {
        return new RoleResponse(
                role.getRoleId(),
                role.getName(),
                role.getDescription(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }

    private static PermissionResponse toPermissionResponse(Permission permission) {
        return new PermissionResponse(
                permission.getPermissionId(),
                permission.getName(),
                permission.getDescription(),
                permission.getCreatedAt()
        );
    }

    private static DirectGrantResponse toGrantResponse(DirectGrant grant) {
        return new DirectGrantResponse(
                grant.getGrantId(),
                grant.getUserId(),
                grant.getPermissionId(),
                grant.getScope().asMap(),
                grant.getGrantedAt(),
                grant.getGrantedBy()
        );
    }
}
