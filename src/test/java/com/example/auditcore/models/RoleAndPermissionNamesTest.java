package com.example.auditcore.models;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoleAndPermissionNamesTest {

    @Test
    @DisplayName("role names are lowercase identifiers")
    void roleNames() {
        assertTrue(Role.isValidName("admin"));
        assertTrue(Role.isValidName("super_admin"));
        assertFalse(Role.isValidName("Admin"));
        assertFalse(Role.isValidName("1admin"));
        assertFalse(Role.isValidName(null));
    }

    @Test
    @DisplayName("permission names follow resource.action")
    void permissionNames() {
        assertTrue(Permission.isValidName("task.view"));
        assertTrue(Permission.isValidName("role.permission_grant"));
        assertFalse(Permission.isValidName("task"));
        assertFalse(Permission.isValidName("task.View"));
        assertFalse(Permission.isValidName(".view"));
        assertFalse(Permission.isValidName(null));
    }

    @Test
    @DisplayName("only super_admin is reserved")
    void reserved() {
        assertTrue(Role.builder().roleId("r").name(Role.SUPER_ADMIN).createdAt(1L).updatedAt(1L).build().isReserved());
        assertFalse(Role.builder().roleId("r").name("admin").createdAt(1L).updatedAt(1L).build().isReserved());
    }
}
