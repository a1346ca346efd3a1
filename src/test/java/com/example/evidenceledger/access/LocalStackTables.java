package com.example.evidenceledger.access;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the ledger tables in a LocalStack DynamoDB if they are missing.
 */
final class LocalStackTables {

    private LocalStackTables() {
    }

    static void ensureAll(DynamoDbClient dynamo) {
        ensure(dynamo, DynamoEvidenceAccess.EVIDENCE_TABLE, "evidence_id", ScalarAttributeType.N, null, null);
        ensure(dynamo, DynamoEvidenceAccess.CUSTODY_EVENTS_TABLE,
                "evidence_id", ScalarAttributeType.N, "event_index", ScalarAttributeType.N);
        ensure(dynamo, DynamoEvidenceAccess.FINGERPRINT_CLAIMS_TABLE, "fingerprint", ScalarAttributeType.S, null, null);
        ensure(dynamo, DynamoEvidenceAccess.LEDGER_COUNTERS_TABLE, "counter_name", ScalarAttributeType.S, null, null);
        ensure(dynamo, DynamoAttestationAccess.TABLE,
                "evidence_id", ScalarAttributeType.N, "verifier", ScalarAttributeType.S);
        ensure(dynamo, DynamoVerifierAccess.TABLE, "verifier", ScalarAttributeType.S, null, null);
        ensure(dynamo, DynamoLedgerEventAccess.TABLE,
                "evidence_id", ScalarAttributeType.N, "sequence", ScalarAttributeType.N);
    }

    private static void ensure(DynamoDbClient dynamo,
                               String table,
                               String hashKey,
                               ScalarAttributeType hashType,
                               String rangeKey,
                               ScalarAttributeType rangeType) {
        try {
            dynamo.describeTable(b -> b.tableName(table));
            return;
        } catch (ResourceNotFoundException ex) {
            // missing, create it
        }
        CreateTableRequest.Builder request = CreateTableRequest.builder()
                .tableName(table)
                .billingMode("PAY_PER_REQUEST");
        if (rangeKey == null) {
            request.attributeDefinitions(
                            AttributeDefinition.builder().attributeName(hashKey).attributeType(hashType).build())
                    .keySchema(KeySchemaElement.builder().attributeName(hashKey).keyType(KeyType.HASH).build());
        } else {
            request.attributeDefinitions(
                            AttributeDefinition.builder().attributeName(hashKey).attributeType(hashType).build(),
                            AttributeDefinition.builder().attributeName(rangeKey).attributeType(rangeType).build())
                    .keySchema(
                            KeySchemaElement.builder().attributeName(hashKey).keyType(KeyType.HASH).build(),
                            KeySchemaElement.builder().attributeName(rangeKey).keyType(KeyType.RANGE).build());
        }
        dynamo.createTable(request.build());
    }

    static void truncateAll(DynamoDbClient dynamo) {
        for (String table : dynamo.listTables().tableNames()) {
            List<KeySchemaElement> keySchema = dynamo.describeTable(b -> b.tableName(table)).table().keySchema();
            dynamo.scanPaginator(b -> b.tableName(table)).items().forEach(item -> {
                Map<String, AttributeValue> key = new HashMap<>();
                keySchema.forEach(k -> key.put(k.attributeName(), item.get(k.attributeName())));
                dynamo.deleteItem(b -> b.tableName(table).key(key));
            });
        }
    }
}
