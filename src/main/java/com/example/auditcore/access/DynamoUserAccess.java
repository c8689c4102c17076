package com.example.auditcore.access;

import com.example.auditcore.models.UserAccount;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoUserAccess implements UserAccess {

    public static final String USERS_TABLE = "users";

    private final DynamoDbTable<UserAccount> table;

    public DynamoUserAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(USERS_TABLE, TableSchema.fromBean(UserAccount.class));
    }

    @Override
    public Optional<UserAccount> findByUserId(String userId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(userId)
                        .build())
                .consistentRead(true)));
    }
}
