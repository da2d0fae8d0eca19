package com.bbthechange.mobilelogin.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DynamoDbHealthIndicatorTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    private DynamoDbHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new DynamoDbHealthIndicator(dynamoDbClient);
    }

    private static DescribeTableResponse withStatus(TableStatus status) {
        return DescribeTableResponse.builder()
            .table(TableDescription.builder().tableStatus(status).build())
            .build();
    }

    @Test
    void health_BothTablesActive_IsUp() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(withStatus(TableStatus.ACTIVE));

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("usersTable", "ACTIVE");
    }

    @Test
    void health_TableStillCreating_IsDown() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenReturn(withStatus(TableStatus.ACTIVE), withStatus(TableStatus.CREATING));

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("loginChallengesTable", "CREATING");
    }

    @Test
    void health_MissingTable_IsDownWithError() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("Users not found").build());

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "DynamoDB connection failed");
    }
}
