package com.example.evidenceledger.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Monotonic sequence used to allocate evidence ids. Advanced only inside the registration
 * transaction, conditioned on the value the writer read.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@Getter @Setter
public class LedgerCounter {

    public static final String EVIDENCE = "evidence";

    @NonNull
    private String counterName;

    @NonNull
    private Long counterValue;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("counter_name")
    public String getCounterName() { return counterName; }

    @DynamoDbAttribute("counter_value")
    public Long getCounterValue() { return counterValue; }
}
