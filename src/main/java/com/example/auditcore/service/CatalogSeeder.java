package com.example.auditcore.service;

import com.example.auditcore.config.CatalogSeedProperties;
import com.example.auditcore.config.CatalogSeedProperties.SeedPermission;
import com.example.auditcore.config.CatalogSeedProperties.SeedRole;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.Role;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the default roles, permissions and role bindings at startup. Goes through the catalog
 * service, so every seeded row is recorded in the ledger like any other change. Rows that already
 * exist, including ones created by another instance seeding at the same time, are left alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "catalog.seed.enabled", havingValue = "true")
public class CatalogSeeder implements ApplicationRunner {

    private final PermissionCatalogService catalog;
    private final CatalogSeedProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    public void seed() {
        String actor = properties.getActor();
        int created = 0;

        for (SeedPermission seed : properties.getPermissions()) {
            if (catalog.findPermissionByName(seed.getName()).isEmpty()) {
                created += ignoreExisting(() -> catalog.createPermission(actor, seed.getName(), seed.getDescription()),
                        AuditCoreException.Code.PERMISSION_ALREADY_EXISTS);
            }
        }

        for (SeedRole seed : properties.getRoles()) {
            if (catalog.findRoleByName(seed.getName()).isEmpty()) {
                created += ignoreExisting(() -> catalog.createRole(actor, seed.getName(), seed.getDescription()),
                        AuditCoreException.Code.ROLE_ALREADY_EXISTS);
            }
            Role role = catalog.findRoleByName(seed.getName())
                    .orElseThrow(() -> AuditCoreException.roleNotFound(seed.getName()));
            Set<String> bound = catalog.rolePermissions(role.getRoleId()).stream()
                    .map(Permission::getName)
                    .collect(Collectors.toSet());
            for (String permissionName : seed.getPermissions()) {
                if (bound.contains(permissionName)) {
                    continue;
                }
                Permission permission = catalog.findPermissionByName(permissionName)
                        .orElseThrow(() -> new IllegalStateException(
                                "Seed role " + seed.getName() + " references unknown permission " + permissionName));
                created += ignoreExisting(() -> catalog.bindPermission(actor, role.getRoleId(), permission.getPermissionId()),
                        AuditCoreException.Code.PERMISSION_BINDING_ALREADY_EXISTS);
            }
        }

        log.info("Catalog seed complete: {} rows created ({} permissions, {} roles configured)",
                created, properties.getPermissions().size(), properties.getRoles().size());
    }

    private int ignoreExisting(Runnable mutation, AuditCoreException.Code existing) {
        try {
            mutation.run();
            return 1;
        } catch (AuditCoreException ex) {
            if (ex.getCode() != existing) {
                throw ex;
            }
            log.debug("Seed row already present: {}", ex.getMessage());
            return 0;
        }
    }
}
