package com.example.auditcore.access;

import com.example.auditcore.models.DirectGrant;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.PermissionBinding;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import java.util.List;
import java.util.Optional;

/**
 * Storage contract for roles, permissions and the bindings between them and users.
 *
 * <p>Every mutation takes the catalog revision the caller validated against and the ledger event
 * describing it, and commits the change, a bump of that revision and the event append in one
 * transaction. If the revision or the chain tail moved, or a row-level condition (duplicate row,
 * missing row) does not hold, nothing is written and the call fails with
 * {@link software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException}.
 */
public interface CatalogAccess {

    /**
     * Strongly consistent read of the catalog revision, {@code 0} before the first mutation.
     */
    long currentRevision();

    Optional<Role> findRole(String roleId);

    Optional<Role> findRoleByName(String name);

    List<Role> listRoles();

    Optional<Permission> findPermission(String permissionId);

    Optional<Permission> findPermissionByName(String name);

    List<Permission> listPermissions();

    List<PermissionBinding> findPermissionBindings(String roleId);

    Optional<PermissionBinding> findPermissionBinding(String roleId, String permissionId);

    List<RoleBinding> findRoleBindings(String userId);

    /**
     * Members of a role, read through the reverse index.
     */
    List<RoleBinding> findRoleMembers(String roleId);

    Optional<RoleBinding> findRoleBinding(String userId, String roleId);

    /**
     * Every role binding in the catalog.
     */
    List<RoleBinding> listRoleBindings();

    List<DirectGrant> findDirectGrants(String userId);

    Optional<DirectGrant> findDirectGrant(String userId, String grantKey);

    void createRole(Role role, long expectedRevision, LedgerAppend audit);

    void updateRole(Role previous, Role updated, long expectedRevision, LedgerAppend audit);

    /**
     * Removes the role, its name claim and the given bindings in one transaction.
     */
    void deleteRole(Role role,
                    List<RoleBinding> members,
                    List<PermissionBinding> bindings,
                    long expectedRevision,
                    LedgerAppend audit);

    void createPermission(Permission permission, long expectedRevision, LedgerAppend audit);

    void putPermissionBinding(PermissionBinding binding, long expectedRevision, LedgerAppend audit);

    void deletePermissionBinding(PermissionBinding binding, long expectedRevision, LedgerAppend audit);

    void putRoleBinding(RoleBinding binding, long expectedRevision, LedgerAppend audit);

    void deleteRoleBinding(RoleBinding binding, long expectedRevision, LedgerAppend audit);

    void putDirectGrant(DirectGrant grant, long expectedRevision, LedgerAppend audit);

    void deleteDirectGrant(DirectGrant grant, long expectedRevision, LedgerAppend audit);
}
