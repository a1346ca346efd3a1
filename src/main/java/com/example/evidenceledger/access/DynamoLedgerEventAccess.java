package com.example.evidenceledger.access;

import com.example.evidenceledger.models.LedgerEvent;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoLedgerEventAccess implements LedgerEventAccess {

    public static final String TABLE = "ledger_events";

    private final DynamoDbTable<LedgerEvent> table;

    public DynamoLedgerEventAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(LedgerEvent.class));
    }

    @Override
    public void put(LedgerEvent event) {
        // A sequence slot is written once; a collision means two writers extended the same chain.
        table.putItem(r -> r.item(event)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(evidence_id)")
                        .build()));
    }

    @Override
    public Optional<LedgerEvent> findLatest(long evidenceId) {
        // Query the partition in reverse sequence order so the first item is the most recent.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(evidenceId)))
                        .limit(1)
                        .scanIndexForward(false)
                        .consistentRead(true))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<LedgerEvent> findAllByEvidenceId(long evidenceId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(evidenceId)))
                        .scanIndexForward(true))
                .items()
                .stream()
                .toList();
    }

    private Key buildKey(long evidenceId) {
        return Key.builder().partitionValue(evidenceId).build();
    }
}
