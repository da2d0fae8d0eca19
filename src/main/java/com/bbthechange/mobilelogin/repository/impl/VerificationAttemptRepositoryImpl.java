package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.VerificationAttempt;
import com.bbthechange.mobilelogin.repository.VerificationAttemptRepository;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;

import java.util.Map;

/**
 * Append-only attempt log. The sort key is the attempt's position within its session and
 * each put is conditional on that position being free. Rows carry their challenge's expiry,
 * which doubles as the table's TTL attribute.
 */
@Repository
public class VerificationAttemptRepositoryImpl implements VerificationAttemptRepository {

    private static final Logger logger = LoggerFactory.getLogger(VerificationAttemptRepositoryImpl.class);
    public static final String TABLE_NAME = "VerificationAttempts";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<VerificationAttempt> attemptSchema;
    private final QueryPerformanceTracker queryTracker;

    public VerificationAttemptRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.attemptSchema = TableSchema.fromBean(VerificationAttempt.class);
    }

    @Override
    public int countFor(String mobileNumber, String sessionToken) {
        String challengeKey = VerificationAttempt.keyFor(mobileNumber, sessionToken);
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                int count = 0;
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryRequest.Builder request = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .keyConditionExpression("challengeKey = :key")
                        .expressionAttributeValues(Map.of(
                            ":key", AttributeValue.builder().s(challengeKey).build()
                        ))
                        .select(Select.COUNT)
                        .consistentRead(true);
                    if (startKey != null) {
                        request.exclusiveStartKey(startKey);
                    }
                    QueryResponse response = dynamoDbClient.query(request.build());
                    count += response.count();
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                            ? response.lastEvaluatedKey()
                            : null;
                } while (startKey != null);
                return count;

            } catch (DynamoDbException e) {
                logger.error("Failed to count verification attempts for {}", mobileNumber, e);
                throw new RepositoryException("Failed to count verification attempts", e);
            }
        });
    }

    @Override
    public boolean saveIfPositionFree(VerificationAttempt attempt) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(attemptSchema.itemToMap(attempt, true))
                    .conditionExpression("attribute_not_exists(attemptNumber)")
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Attempt position {} for {} already taken",
                        attempt.getAttemptNumber(), attempt.getMobileNumber());
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to record verification attempt for {}", attempt.getMobileNumber(), e);
                throw new RepositoryException("Failed to record verification attempt", e);
            }
        });
    }

    @Override
    public int deleteExpiredBefore(long epochSecond) {
        int deleted = 0;
        Map<String, AttributeValue> startKey = null;
        do {
            ScanResponse page = scanExpired(epochSecond, startKey);
            for (Map<String, AttributeValue> item : page.items()) {
                delete(item.get("challengeKey").s(), item.get("attemptNumber").n());
                deleted++;
            }
            startKey = page.hasLastEvaluatedKey() && !page.lastEvaluatedKey().isEmpty()
                    ? page.lastEvaluatedKey()
                    : null;
        } while (startKey != null);
        return deleted;
    }

    private ScanResponse scanExpired(long epochSecond, Map<String, AttributeValue> startKey) {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                ScanRequest.Builder request = ScanRequest.builder()
                    .tableName(TABLE_NAME)
                    .filterExpression("expiresAt < :now")
                    .projectionExpression("challengeKey, attemptNumber")
                    .expressionAttributeValues(Map.of(
                        ":now", AttributeValue.builder().n(String.valueOf(epochSecond)).build()
                    ));
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                return dynamoDbClient.scan(request.build());

            } catch (DynamoDbException e) {
                logger.error("Failed to scan for expired verification attempts", e);
                throw new RepositoryException("Failed to scan for expired verification attempts", e);
            }
        });
    }

    private void delete(String challengeKey, String attemptNumber) {
        queryTracker.trackCommand("DeleteItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "challengeKey", AttributeValue.builder().s(challengeKey).build(),
                        "attemptNumber", AttributeValue.builder().n(attemptNumber).build()
                    ))
                    .build());

            } catch (DynamoDbException e) {
                logger.error("Failed to delete verification attempt {} of {}", attemptNumber, challengeKey, e);
                throw new RepositoryException("Failed to delete verification attempt", e);
            }
        });
    }
}
