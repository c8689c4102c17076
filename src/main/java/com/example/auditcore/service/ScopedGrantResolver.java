package com.example.auditcore.service;

import com.example.auditcore.access.CatalogAccess;
import com.example.auditcore.access.UserAccess;
import com.example.auditcore.config.CatalogProperties;
import com.example.auditcore.models.DirectGrant;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.PermissionBinding;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import com.example.auditcore.models.Scope;
import com.example.auditcore.service.EffectivePermissions.EffectivePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Answers "may user U perform P on scope S?". Checks run in a fixed order: the super-admin
 * bypass, then role-derived permissions (global), then direct grants whose scope is satisfied by
 * the requested scope. Reads never observe a catalog mutation half-applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScopedGrantResolver {

    private final CatalogAccess catalogAccess;
    private final UserAccess userAccess;
    private final CatalogProperties properties;

    public AuthorizationDecision decide(String userId, String permissionName, Scope requested) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(permissionName, "permissionName");
        Scope scope = requested == null ? Scope.empty() : requested;

        UserSnapshot snapshot = snapshot(userId);
        AuthorizationDecision decision = evaluate(snapshot, permissionName, scope);
        log.debug("Decision for user {} on {} {}: {}", userId, permissionName, scope, decision);
        return decision;
    }

    public boolean isAuthorized(String userId, String permissionName, Scope requested) {
        return decide(userId, permissionName, requested).allowed();
    }

    /**
     * Every permission the user holds and where it comes from. Role-derived entries come first,
     * each group sorted by permission name.
     */
    public EffectivePermissions effectivePermissions(String userId) {
        Objects.requireNonNull(userId, "userId");
        try {
            userAccess.findByUserId(userId).orElseThrow(() -> AuditCoreException.userNotFound(userId));
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("effectivePermissions", ex);
        }

        UserSnapshot snapshot = snapshot(userId);
        List<EffectivePermission> entries = new ArrayList<>();
        snapshot.roles().stream()
                .sorted(Comparator.comparing(RoleView::name))
                .forEach(role -> role.permissionNames().stream()
                        .sorted()
                        .forEach(p -> entries.add(new EffectivePermission(p, GrantSource.ROLE, role.name(), null))));
        snapshot.grants().stream()
                .sorted(Comparator.comparing(GrantView::permissionName)
                        .thenComparing(g -> g.scope().toCanonicalJson()))
                .forEach(g -> entries.add(new EffectivePermission(g.permissionName(), GrantSource.DIRECT, null, g.scope())));

        List<String> roleNames = snapshot.roles().stream()
                .map(RoleView::name)
                .sorted()
                .collect(Collectors.toList());
        return new EffectivePermissions(userId, roleNames, entries);
    }

    private AuthorizationDecision evaluate(UserSnapshot snapshot, String permissionName, Scope requested) {
        for (RoleView role : snapshot.roles()) {
            if (Role.SUPER_ADMIN.equals(role.name())) {
                return new AuthorizationDecision.Bypassed();
            }
        }
        Optional<RoleView> viaRole = snapshot.roles().stream()
                .filter(r -> r.permissionNames().contains(permissionName))
                .min(Comparator.comparing(RoleView::name));
        if (viaRole.isPresent()) {
            return AuthorizationDecision.GrantedBy.role(viaRole.get().name());
        }
        for (GrantView grant : snapshot.grants()) {
            if (grant.permissionName().equals(permissionName) && grant.scope().isSatisfiedBy(requested)) {
                return AuthorizationDecision.GrantedBy.direct(grant.scope());
            }
        }
        return new AuthorizationDecision.Denied();
    }

    /**
     * Loads the user's roles, their permissions and the user's direct grants, and accepts the
     * result only if the catalog revision did not move while loading.
     */
    private UserSnapshot snapshot(String userId) {
        int maxAttempts = Math.max(1, properties.getSnapshot().getMaxAttempts());
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                long before = catalogAccess.currentRevision();
                UserSnapshot snapshot = load(userId);
                long after = catalogAccess.currentRevision();
                if (before == after) {
                    return snapshot;
                }
                log.debug("Catalog moved from revision {} to {} while loading user {} (attempt {})",
                        before, after, userId, attempt);
            }
        } catch (SdkException ex) {
            throw AuditCoreException.storageUnavailable("catalog snapshot", ex);
        }
        log.warn("Could not take a stable catalog snapshot for user {} after {} attempts", userId, maxAttempts);
        throw AuditCoreException.storageUnavailable("catalog snapshot", null);
    }

    private UserSnapshot load(String userId) {
        Map<String, Optional<Permission>> permissions = new HashMap<>();

        List<RoleView> roles = new ArrayList<>();
        for (RoleBinding binding : catalogAccess.findRoleBindings(userId)) {
            // a binding can briefly outlive a role deleted concurrently; it grants nothing
            Optional<Role> role = catalogAccess.findRole(binding.getRoleId());
            if (role.isEmpty()) {
                continue;
            }
            List<String> names = new ArrayList<>();
            for (PermissionBinding pb : catalogAccess.findPermissionBindings(binding.getRoleId())) {
                permissions.computeIfAbsent(pb.getPermissionId(), catalogAccess::findPermission)
                        .ifPresent(p -> names.add(p.getName()));
            }
            roles.add(new RoleView(role.get().getName(), names));
        }

        List<GrantView> grants = new ArrayList<>();
        for (DirectGrant grant : catalogAccess.findDirectGrants(userId)) {
            permissions.computeIfAbsent(grant.getPermissionId(), catalogAccess::findPermission)
                    .ifPresent(p -> grants.add(new GrantView(p.getName(), grant.getScope())));
        }
        return new UserSnapshot(roles, grants);
    }

    private record RoleView(String name, List<String> permissionNames) { }

    private record GrantView(String permissionName, Scope scope) { }

    private record UserSnapshot(List<RoleView> roles, List<GrantView> grants) { }
}
