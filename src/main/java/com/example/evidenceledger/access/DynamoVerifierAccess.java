package com.example.evidenceledger.access;

import com.example.evidenceledger.models.Verifier;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
public class DynamoVerifierAccess implements VerifierAccess {

    public static final String TABLE = "verifiers";

    private final DynamoDbTable<Verifier> table;

    public DynamoVerifierAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(Verifier.class));
    }

    @Override
    public Optional<Verifier> findByVerifier(String verifier) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(verifier)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public Verifier saveIfAbsent(Verifier verifier) {
        try {
            table.putItem(r -> r.item(verifier)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_not_exists(verifier)")
                            .build()));
            return verifier;
        } catch (ConditionalCheckFailedException ex) {
            // Already registered; keep the original registration time.
            return findByVerifier(verifier.getVerifier()).orElse(verifier);
        }
    }
}
