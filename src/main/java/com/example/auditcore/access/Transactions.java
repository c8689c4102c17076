package com.example.auditcore.access;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * Runs enhanced-client transactions and reports a failed condition the same way a single
 * conditional put does, so callers only ever catch {@link ConditionalCheckFailedException}.
 * A transaction cancelled because another transaction held one of its items is reported the
 * same way: both mean a concurrent writer won.
 */
final class Transactions {

    private Transactions() {
    }

    static void write(DynamoDbEnhancedClient client, TransactWriteItemsEnhancedRequest request) {
        try {
            client.transactWriteItems(request);
        } catch (TransactionCanceledException ex) {
            if (ex.hasCancellationReasons() && ex.cancellationReasons().stream()
                    .map(CancellationReason::code)
                    .anyMatch(code -> "ConditionalCheckFailed".equals(code) || "TransactionConflict".equals(code))) {
                throw ConditionalCheckFailedException.builder()
                        .message("Transaction condition failed: " + ex.getMessage())
                        .cause(ex)
                        .build();
            }
            throw ex;
        }
    }
}
