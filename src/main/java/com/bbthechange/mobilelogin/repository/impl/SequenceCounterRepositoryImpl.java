package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.repository.SequenceCounterRepository;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.Map;

/**
 * Reads named counters. A counter only moves inside the transaction that inserts the row it
 * numbers, see {@link UserRepositoryImpl#insertNumbered}.
 */
@Repository
public class SequenceCounterRepositoryImpl implements SequenceCounterRepository {

    private static final Logger logger = LoggerFactory.getLogger(SequenceCounterRepositoryImpl.class);
    public static final String TABLE_NAME = "Counters";
    static final String COUNTER_NAME = "counterName";
    static final String VALUE = "value";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;

    public SequenceCounterRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
    }

    @Override
    public long current(String counterName) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(counterName))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || !response.item().containsKey(VALUE)) {
                    return 0L;
                }
                return Long.parseLong(response.item().get(VALUE).n());

            } catch (DynamoDbException e) {
                logger.error("Failed to read counter {}", counterName, e);
                throw new RepositoryException("Failed to read counter " + counterName, e);
            }
        });
    }

    static Map<String, AttributeValue> keyFor(String counterName) {
        return Map.of(COUNTER_NAME, AttributeValue.builder().s(counterName).build());
    }
}
