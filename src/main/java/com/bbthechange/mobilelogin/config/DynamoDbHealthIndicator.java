package com.bbthechange.mobilelogin.config;

import com.bbthechange.mobilelogin.repository.impl.LoginChallengeRepositoryImpl;
import com.bbthechange.mobilelogin.repository.impl.UserRepositoryImpl;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports DOWN unless both the user directory and the challenge table are ACTIVE.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            TableStatus usersStatus = statusOf(UserRepositoryImpl.TABLE_NAME);
            TableStatus challengesStatus = statusOf(LoginChallengeRepositoryImpl.TABLE_NAME);

            Health.Builder builder = usersStatus == TableStatus.ACTIVE && challengesStatus == TableStatus.ACTIVE
                    ? Health.up()
                    : Health.down();
            return builder
                    .withDetail("usersTable", String.valueOf(usersStatus))
                    .withDetail("loginChallengesTable", String.valueOf(challengesStatus))
                    .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }

    private TableStatus statusOf(String tableName) {
        return dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build())
                .table()
                .tableStatus();
    }
}
