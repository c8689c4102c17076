package com.example.auditcore.access;

import com.example.auditcore.models.ChainTail;
import com.example.auditcore.models.LedgerEvent;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The two transaction items of a ledger append: the new event row and the conditional tail swap.
 * Shared by every adapter that has to commit an event together with its own rows.
 */
final class LedgerWrites {

    static final String EVENTS_TABLE = "ledger_events";
    static final String TAILS_TABLE = "ledger_tails";

    static final Expression NEW_ROW = Expression.builder()
            .expression("attribute_not_exists(chain_id)")
            .build();

    private final DynamoDbTable<LedgerEvent> events;
    private final DynamoDbTable<ChainTail> tails;

    LedgerWrites(DynamoDbEnhancedClient enhancedClient) {
        this.events = enhancedClient.table(EVENTS_TABLE, TableSchema.fromBean(LedgerEvent.class));
        this.tails = enhancedClient.table(TAILS_TABLE, TableSchema.fromBean(ChainTail.class));
    }

    DynamoDbTable<LedgerEvent> events() {
        return events;
    }

    DynamoDbTable<ChainTail> tails() {
        return tails;
    }

    void addTo(TransactWriteItemsEnhancedRequest.Builder tx, LedgerAppend append) {
        ChainTail expectedTail = append.expectedTail();
        Expression tailCondition = expectedTail == null
                ? NEW_ROW
                : Expression.builder()
                        .expression("#seq = :seq AND #hash = :hash")
                        .putExpressionName("#seq", "seq")
                        .putExpressionName("#hash", "hash")
                        .putExpressionValue(":seq", AttributeValue.builder().n(String.valueOf(expectedTail.getSequence())).build())
                        .putExpressionValue(":hash", AttributeValue.builder().s(expectedTail.getHash()).build())
                        .build();

        tx.addPutItem(events, TransactPutItemEnhancedRequest.builder(LedgerEvent.class)
                        .item(append.event())
                        .conditionExpression(NEW_ROW)
                        .build())
                .addPutItem(tails, TransactPutItemEnhancedRequest.builder(ChainTail.class)
                        .item(append.newTail())
                        .conditionExpression(tailCondition)
                        .build());
    }
}
