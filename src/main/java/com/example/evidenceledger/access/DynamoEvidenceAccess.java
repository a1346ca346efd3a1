package com.example.evidenceledger.access;

import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.models.FingerprintClaim;
import com.example.evidenceledger.models.LedgerCounter;
import com.example.evidenceledger.service.EvidenceLedgerException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

@Component
@Slf4j
public class DynamoEvidenceAccess implements EvidenceAccess {

    public static final String EVIDENCE_TABLE = "evidence";
    public static final String CUSTODY_EVENTS_TABLE = "custody_events";
    public static final String FINGERPRINT_CLAIMS_TABLE = "fingerprint_claims";
    public static final String LEDGER_COUNTERS_TABLE = "ledger_counters";

    // position of the fingerprint claim inside the registration transaction
    private static final int CLAIM_ITEM = 1;
    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<Evidence> evidenceTable;
    private final DynamoDbTable<CustodyEvent> custodyTable;
    private final DynamoDbTable<FingerprintClaim> claimTable;
    private final DynamoDbTable<LedgerCounter> counterTable;

    public DynamoEvidenceAccess(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.evidenceTable = enhancedClient.table(EVIDENCE_TABLE, TableSchema.fromBean(Evidence.class));
        this.custodyTable = enhancedClient.table(CUSTODY_EVENTS_TABLE, TableSchema.fromBean(CustodyEvent.class));
        this.claimTable = enhancedClient.table(FINGERPRINT_CLAIMS_TABLE, TableSchema.fromBean(FingerprintClaim.class));
        this.counterTable = enhancedClient.table(LEDGER_COUNTERS_TABLE, TableSchema.fromBean(LedgerCounter.class));
    }

    @Override
    public Optional<Evidence> findById(long evidenceId) {
        return Optional.ofNullable(evidenceTable.getItem(r -> r.key(Key.builder()
                        .partitionValue(evidenceId)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public long count() {
        LedgerCounter counter = counterTable.getItem(r -> r.key(Key.builder()
                        .partitionValue(LedgerCounter.EVIDENCE)
                        .build())
                .consistentRead(true));
        return counter == null ? 0L : counter.getCounterValue();
    }

    @Override
    public boolean isFingerprintClaimed(Fingerprint fingerprint) {
        return claimTable.getItem(r -> r.key(Key.builder()
                        .partitionValue(fingerprint.toHex())
                        .build())
                .consistentRead(true)) != null;
    }

    @Override
    public void create(Evidence evidence, CustodyEvent genesisEvent) {
        long allocatedId = evidence.getEvidenceId();
        LedgerCounter counter = LedgerCounter.builder()
                .counterName(LedgerCounter.EVIDENCE)
                .counterValue(allocatedId)
                .build();
        FingerprintClaim claim = FingerprintClaim.builder()
                .fingerprint(evidence.getFingerprint().toHex())
                .evidenceId(allocatedId)
                .build();

        Expression counterAdvance = Expression.builder()
                .expression("attribute_not_exists(counter_name) OR #value = :expected")
                .putExpressionName("#value", "counter_value")
                .putExpressionValue(":expected", number(allocatedId - 1))
                .build();

        // Item order matters: CLAIM_ITEM indexes into the cancellation reasons below.
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(counterTable, TransactPutItemEnhancedRequest.builder(LedgerCounter.class)
                        .item(counter)
                        .conditionExpression(counterAdvance)
                        .build())
                .addPutItem(claimTable, TransactPutItemEnhancedRequest.builder(FingerprintClaim.class)
                        .item(claim)
                        .conditionExpression(notExists("fingerprint"))
                        .build())
                .addPutItem(evidenceTable, TransactPutItemEnhancedRequest.builder(Evidence.class)
                        .item(evidence)
                        .conditionExpression(notExists("evidence_id"))
                        .build())
                .addPutItem(custodyTable, TransactPutItemEnhancedRequest.builder(CustodyEvent.class)
                        .item(genesisEvent)
                        .conditionExpression(notExists("evidence_id"))
                        .build())
                .build();

        try {
            enhancedClient.transactWriteItems(request);
        } catch (TransactionCanceledException ex) {
            if (conditionFailedAt(ex, CLAIM_ITEM)) {
                throw EvidenceLedgerException.duplicateFingerprint(evidence.getFingerprint().toHex());
            }
            log.warn("Registration of evidence {} lost a concurrent write: {}", allocatedId, ex.getMessage());
            throw EvidenceLedgerException.commitFailed(
                    "Evidence id " + allocatedId + " was allocated by a concurrent writer", ex);
        }
    }

    @Override
    public void appendCustodyEvent(Evidence updated, CustodyEvent event) {
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(evidenceTable, TransactPutItemEnhancedRequest.builder(Evidence.class)
                        .item(updated)
                        .conditionExpression(custodyCountIs(updated.getCustodyEventCount() - 1))
                        .build())
                .addPutItem(custodyTable, TransactPutItemEnhancedRequest.builder(CustodyEvent.class)
                        .item(event)
                        .conditionExpression(notExists("evidence_id"))
                        .build())
                .build();

        try {
            enhancedClient.transactWriteItems(request);
        } catch (TransactionCanceledException ex) {
            throw EvidenceLedgerException.commitFailed(
                    "Custody event " + event.getEventIndex() + " for evidence " + event.getEvidenceId()
                            + " was appended by a concurrent writer", ex);
        }
    }

    @Override
    public void updateStatus(Evidence updated) {
        try {
            evidenceTable.putItem(PutItemEnhancedRequest.builder(Evidence.class)
                    .item(updated)
                    .conditionExpression(custodyCountIs(updated.getCustodyEventCount()))
                    .build());
        } catch (ConditionalCheckFailedException ex) {
            throw EvidenceLedgerException.commitFailed(
                    "Evidence " + updated.getEvidenceId() + " changed during status update", ex);
        }
    }

    private static boolean conditionFailedAt(TransactionCanceledException ex, int itemIndex) {
        if (!ex.hasCancellationReasons()) {
            return false;
        }
        List<CancellationReason> reasons = ex.cancellationReasons();
        return reasons.size() > itemIndex
                && CONDITIONAL_CHECK_FAILED.equals(reasons.get(itemIndex).code());
    }

    private static Expression custodyCountIs(long expected) {
        return Expression.builder()
                .expression("#count = :expected")
                .putExpressionName("#count", "custody_event_count")
                .putExpressionValue(":expected", number(expected))
                .build();
    }

    private static Expression notExists(String attribute) {
        return Expression.builder()
                .expression("attribute_not_exists(" + attribute + ")")
                .build();
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
