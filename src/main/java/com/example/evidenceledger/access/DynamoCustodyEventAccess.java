package com.example.evidenceledger.access;

import com.example.evidenceledger.models.CustodyEvent;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoCustodyEventAccess implements CustodyEventAccess {

    private final DynamoDbTable<CustodyEvent> table;

    public DynamoCustodyEventAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(DynamoEvidenceAccess.CUSTODY_EVENTS_TABLE,
                TableSchema.fromBean(CustodyEvent.class));
    }

    @Override
    public Optional<CustodyEvent> find(long evidenceId, long eventIndex) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(evidenceId)
                        .sortValue(eventIndex)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public List<CustodyEvent> findAllByEvidenceId(long evidenceId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(Key.builder()
                                .partitionValue(evidenceId)
                                .build()))
                        .scanIndexForward(true)
                        .consistentRead(true))
                .items()
                .stream()
                .toList();
    }
}
