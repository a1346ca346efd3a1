package com.example.evidenceledger.access;

import com.example.evidenceledger.models.Attestation;
import com.example.evidenceledger.service.EvidenceLedgerException;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
public class DynamoAttestationAccess implements AttestationAccess {

    public static final String TABLE = "attestations";

    private final DynamoDbTable<Attestation> table;

    public DynamoAttestationAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(Attestation.class));
    }

    @Override
    public Attestation create(Attestation attestation) {
        try {
            table.putItem(r -> r.item(attestation)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_not_exists(evidence_id)")
                            .build()));
        } catch (ConditionalCheckFailedException ex) {
            throw EvidenceLedgerException.duplicateAttestation(
                    attestation.getEvidenceId(), attestation.getVerifier());
        }
        return attestation;
    }

    @Override
    public List<Attestation> findAllByEvidenceId(long evidenceId) {
        // The sort key is the verifier, so arrival order has to be restored here.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(Key.builder()
                                .partitionValue(evidenceId)
                                .build()))
                        .consistentRead(true))
                .items()
                .stream()
                .sorted(Comparator.comparing(Attestation::getAttestationIndex))
                .toList();
    }
}
