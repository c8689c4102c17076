package com.example.auditcore.access;

import com.example.auditcore.models.CatalogRevision;
import com.example.auditcore.models.DirectGrant;
import com.example.auditcore.models.NameClaim;
import com.example.auditcore.models.Permission;
import com.example.auditcore.models.PermissionBinding;
import com.example.auditcore.models.Role;
import com.example.auditcore.models.RoleBinding;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoCatalogAccess implements CatalogAccess {

    public static final String ROLES_TABLE = "roles";
    public static final String PERMISSIONS_TABLE = "permissions";
    public static final String USER_ROLES_TABLE = "user_roles";
    public static final String ROLE_PERMISSIONS_TABLE = "role_permissions";
    public static final String USER_PERMISSIONS_TABLE = "user_permissions";
    public static final String NAMES_TABLE = "catalog_names";
    public static final String META_TABLE = "catalog_meta";

    private final DynamoDbEnhancedClient enhancedClient;
    private final LedgerWrites ledgerWrites;
    private final DynamoDbTable<Role> roles;
    private final DynamoDbTable<Permission> permissions;
    private final DynamoDbTable<RoleBinding> userRoles;
    private final DynamoDbTable<PermissionBinding> rolePermissions;
    private final DynamoDbTable<DirectGrant> userPermissions;
    private final DynamoDbTable<NameClaim> names;
    private final DynamoDbTable<CatalogRevision> meta;

    public DynamoCatalogAccess(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.ledgerWrites = new LedgerWrites(enhancedClient);
        this.roles = enhancedClient.table(ROLES_TABLE, TableSchema.fromBean(Role.class));
        this.permissions = enhancedClient.table(PERMISSIONS_TABLE, TableSchema.fromBean(Permission.class));
        this.userRoles = enhancedClient.table(USER_ROLES_TABLE, TableSchema.fromBean(RoleBinding.class));
        this.rolePermissions = enhancedClient.table(ROLE_PERMISSIONS_TABLE, TableSchema.fromBean(PermissionBinding.class));
        this.userPermissions = enhancedClient.table(USER_PERMISSIONS_TABLE, TableSchema.fromBean(DirectGrant.class));
        this.names = enhancedClient.table(NAMES_TABLE, TableSchema.fromBean(NameClaim.class));
        this.meta = enhancedClient.table(META_TABLE, TableSchema.fromBean(CatalogRevision.class));
    }

    @Override
    public long currentRevision() {
        CatalogRevision revision = meta.getItem(r -> r.key(partition(CatalogRevision.KEY)).consistentRead(true));
        return revision == null ? 0L : revision.getRevision();
    }

    @Override
    public Optional<Role> findRole(String roleId) {
        return Optional.ofNullable(roles.getItem(r -> r.key(partition(roleId)).consistentRead(true)));
    }

    @Override
    public Optional<Role> findRoleByName(String name) {
        return claim(NameClaim.roleKey(name)).flatMap(c -> findRole(c.getOwnerId()));
    }

    @Override
    public List<Role> listRoles() {
        return roles.scan(r -> r.consistentRead(true)).items().stream().collect(Collectors.toList());
    }

    @Override
    public Optional<Permission> findPermission(String permissionId) {
        return Optional.ofNullable(permissions.getItem(r -> r.key(partition(permissionId)).consistentRead(true)));
    }

    @Override
    public Optional<Permission> findPermissionByName(String name) {
        return claim(NameClaim.permissionKey(name)).flatMap(c -> findPermission(c.getOwnerId()));
    }

    @Override
    public List<Permission> listPermissions() {
        return permissions.scan(r -> r.consistentRead(true)).items().stream().collect(Collectors.toList());
    }

    @Override
    public List<PermissionBinding> findPermissionBindings(String roleId) {
        return rolePermissions.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(roleId)))
                        .consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public Optional<PermissionBinding> findPermissionBinding(String roleId, String permissionId) {
        return Optional.ofNullable(rolePermissions.getItem(r -> r.key(key(roleId, permissionId)).consistentRead(true)));
    }

    @Override
    public List<RoleBinding> findRoleBindings(String userId) {
        return userRoles.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(userId)))
                        .consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public List<RoleBinding> findRoleMembers(String roleId) {
        return userRoles.index(RoleBinding.BY_ROLE_INDEX)
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(roleId))))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<RoleBinding> findRoleBinding(String userId, String roleId) {
        return Optional.ofNullable(userRoles.getItem(r -> r.key(key(userId, roleId)).consistentRead(true)));
    }

    @Override
    public List<RoleBinding> listRoleBindings() {
        return userRoles.scan(r -> r.consistentRead(true)).items().stream().collect(Collectors.toList());
    }

    @Override
    public List<DirectGrant> findDirectGrants(String userId) {
        return userPermissions.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(userId)))
                        .consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public Optional<DirectGrant> findDirectGrant(String userId, String grantKey) {
        return Optional.ofNullable(userPermissions.getItem(r -> r.key(key(userId, grantKey)).consistentRead(true)));
    }

    @Override
    public void createRole(Role role, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx
                .addPutItem(roles, putNew(Role.class, role, "role_id"))
                .addPutItem(names, putNew(NameClaim.class, NameClaim.forRole(role), "name_key")));
    }

    @Override
    public void updateRole(Role previous, Role updated, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> {
            tx.addPutItem(roles, TransactPutItemEnhancedRequest.builder(Role.class)
                    .item(updated)
                    .conditionExpression(exists("role_id"))
                    .build());
            if (!previous.getName().equals(updated.getName())) {
                tx.addDeleteItem(names, deleteExisting(partition(NameClaim.roleKey(previous.getName())), "name_key"));
                tx.addPutItem(names, putNew(NameClaim.class, NameClaim.forRole(updated), "name_key"));
            }
        });
    }

    @Override
    public void deleteRole(Role role,
                           List<RoleBinding> members,
                           List<PermissionBinding> bindings,
                           long expectedRevision,
                           LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> {
            tx.addDeleteItem(roles, deleteExisting(partition(role.getRoleId()), "role_id"));
            tx.addDeleteItem(names, deleteExisting(partition(NameClaim.roleKey(role.getName())), "name_key"));
            for (RoleBinding member : members) {
                tx.addDeleteItem(userRoles, deleteExisting(key(member.getUserId(), member.getRoleId()), "user_id"));
            }
            for (PermissionBinding binding : bindings) {
                tx.addDeleteItem(rolePermissions,
                        deleteExisting(key(binding.getRoleId(), binding.getPermissionId()), "role_id"));
            }
        });
    }

    @Override
    public void createPermission(Permission permission, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx
                .addPutItem(permissions, putNew(Permission.class, permission, "permission_id"))
                .addPutItem(names, putNew(NameClaim.class, NameClaim.forPermission(permission), "name_key")));
    }

    @Override
    public void putPermissionBinding(PermissionBinding binding, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addPutItem(rolePermissions,
                putNew(PermissionBinding.class, binding, "role_id")));
    }

    @Override
    public void deletePermissionBinding(PermissionBinding binding, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addDeleteItem(rolePermissions,
                deleteExisting(key(binding.getRoleId(), binding.getPermissionId()), "role_id")));
    }

    @Override
    public void putRoleBinding(RoleBinding binding, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addPutItem(userRoles,
                putNew(RoleBinding.class, binding, "user_id")));
    }

    @Override
    public void deleteRoleBinding(RoleBinding binding, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addDeleteItem(userRoles,
                deleteExisting(key(binding.getUserId(), binding.getRoleId()), "user_id")));
    }

    @Override
    public void putDirectGrant(DirectGrant grant, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addPutItem(userPermissions,
                putNew(DirectGrant.class, grant, "user_id")));
    }

    @Override
    public void deleteDirectGrant(DirectGrant grant, long expectedRevision, LedgerAppend audit) {
        commit(expectedRevision, audit, tx -> tx.addDeleteItem(userPermissions,
                deleteExisting(key(grant.getUserId(), grant.getGrantKey()), "user_id")));
    }

    /**
     * Adds the revision bump, conditioned on {@code expectedRevision}, and the ledger append to the
     * caller's writes and commits them together.
     */
    private void commit(long expectedRevision,
                        LedgerAppend audit,
                        Consumer<TransactWriteItemsEnhancedRequest.Builder> writes) {
        Objects.requireNonNull(audit, "audit");
        TransactWriteItemsEnhancedRequest.Builder tx = TransactWriteItemsEnhancedRequest.builder();
        writes.accept(tx);
        ledgerWrites.addTo(tx, audit);

        Expression.Builder condition = Expression.builder()
                .putExpressionName("#rev", "revision")
                .putExpressionValue(":rev", AttributeValue.builder().n(String.valueOf(expectedRevision)).build());
        if (expectedRevision == 0L) {
            condition.expression("attribute_not_exists(meta_key) OR #rev = :rev");
        } else {
            condition.expression("#rev = :rev");
        }
        tx.addPutItem(meta, TransactPutItemEnhancedRequest.builder(CatalogRevision.class)
                .item(CatalogRevision.of(expectedRevision + 1))
                .conditionExpression(condition.build())
                .build());

        Transactions.write(enhancedClient, tx.build());
    }

    private Optional<NameClaim> claim(String nameKey) {
        return Optional.ofNullable(names.getItem(r -> r.key(partition(nameKey)).consistentRead(true)));
    }

    private static <T> TransactPutItemEnhancedRequest<T> putNew(Class<T> type, T item, String partitionAttribute) {
        return TransactPutItemEnhancedRequest.builder(type)
                .item(item)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(" + partitionAttribute + ")")
                        .build())
                .build();
    }

    private static TransactDeleteItemEnhancedRequest deleteExisting(Key key, String partitionAttribute) {
        return TransactDeleteItemEnhancedRequest.builder()
                .key(key)
                .conditionExpression(exists(partitionAttribute))
                .build();
    }

    private static Expression exists(String attribute) {
        return Expression.builder().expression("attribute_exists(" + attribute + ")").build();
    }

    private static Key partition(String value) {
        return Key.builder().partitionValue(value).build();
    }

    private static Key key(String partitionValue, String sortValue) {
        return Key.builder().partitionValue(partitionValue).sortValue(sortValue).build();
    }
}
