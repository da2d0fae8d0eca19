package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.repository.LoginChallengeRepository;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.Map;
import java.util.Optional;

@Repository
public class LoginChallengeRepositoryImpl implements LoginChallengeRepository {

    private static final Logger logger = LoggerFactory.getLogger(LoginChallengeRepositoryImpl.class);
    public static final String TABLE_NAME = "LoginChallenges";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<LoginChallenge> challengeSchema;
    private final QueryPerformanceTracker queryTracker;

    public LoginChallengeRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.challengeSchema = TableSchema.fromBean(LoginChallenge.class);
    }

    @Override
    public void save(LoginChallenge challenge) {
        queryTracker.trackCommand("PutItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(challengeSchema.itemToMap(challenge, true))
                    .build());
                logger.debug("Saved login challenge for {}", challenge.getMobileNumber());

            } catch (DynamoDbException e) {
                logger.error("Failed to save login challenge for {}", challenge.getMobileNumber(), e);
                throw new RepositoryException("Failed to save login challenge", e);
            }
        });
    }

    @Override
    public Optional<LoginChallenge> find(String mobileNumber, String sessionToken) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber, sessionToken))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(challengeSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find login challenge for {}", mobileNumber, e);
                throw new RepositoryException("Failed to find login challenge", e);
            }
        });
    }

    @Override
    public void markVerified(String mobileNumber, String sessionToken, long verifiedAt, String credentialId) {
        queryTracker.trackCommand("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber, sessionToken))
                    .updateExpression("SET verifiedAt = :verifiedAt, credentialId = :credentialId")
                    .expressionAttributeValues(Map.of(
                        ":verifiedAt", AttributeValue.builder().n(String.valueOf(verifiedAt)).build(),
                        ":credentialId", AttributeValue.builder().s(credentialId).build()
                    ))
                    .build());

            } catch (DynamoDbException e) {
                logger.error("Failed to mark login challenge verified for {}", mobileNumber, e);
                throw new RepositoryException("Failed to mark login challenge verified", e);
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
                delete(item.get("mobileNumber").s(), item.get("sessionToken").s());
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
                    .projectionExpression("mobileNumber, sessionToken")
                    .expressionAttributeValues(Map.of(
                        ":now", AttributeValue.builder().n(String.valueOf(epochSecond)).build()
                    ));
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                return dynamoDbClient.scan(request.build());

            } catch (DynamoDbException e) {
                logger.error("Failed to scan for expired login challenges", e);
                throw new RepositoryException("Failed to scan for expired login challenges", e);
            }
        });
    }

    private void delete(String mobileNumber, String sessionToken) {
        queryTracker.trackCommand("DeleteItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber, sessionToken))
                    .build());

            } catch (DynamoDbException e) {
                logger.error("Failed to delete login challenge for {}", mobileNumber, e);
                throw new RepositoryException("Failed to delete login challenge", e);
            }
        });
    }

    private static Map<String, AttributeValue> keyFor(String mobileNumber, String sessionToken) {
        return Map.of(
            "mobileNumber", AttributeValue.builder().s(mobileNumber).build(),
            "sessionToken", AttributeValue.builder().s(sessionToken).build()
        );
    }
}
