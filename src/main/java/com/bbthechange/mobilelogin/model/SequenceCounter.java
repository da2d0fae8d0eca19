package com.bbthechange.mobilelogin.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Named monotonic counter. Only moved by the registration transaction, on the condition that
 * it still holds the value read just before.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class SequenceCounter {
    private String counterName;
    private Long value;

    @DynamoDbPartitionKey
    public String getCounterName() {
        return counterName;
    }
}
