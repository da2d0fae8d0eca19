package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.VerificationAttempt;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;

import java.util.List;
import java.util.Map;

import static com.bbthechange.mobilelogin.testutil.TestConstants.MOBILE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationAttemptRepositoryImplTest {

    private static final String SESSION_TOKEN = "token-1";

    @Mock
    private DynamoDbClient dynamoDbClient;

    private VerificationAttemptRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new VerificationAttemptRepositoryImpl(dynamoDbClient,
            new QueryPerformanceTracker(new SimpleMeterRegistry()));
    }

    @Test
    void countFor_SumsCountsAcrossPages() {
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenReturn(QueryResponse.builder()
                .count(2)
                .lastEvaluatedKey(Map.of("challengeKey", AttributeValue.builder().s("k").build()))
                .build())
            .thenReturn(QueryResponse.builder().count(1).build());

        assertThat(repository.countFor(MOBILE, SESSION_TOKEN)).isEqualTo(3);

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient, times(2)).query(captor.capture());
        QueryRequest first = captor.getAllValues().get(0);
        assertThat(first.select()).isEqualTo(Select.COUNT);
        assertThat(first.consistentRead()).isTrue();
        assertThat(first.expressionAttributeValues().get(":key").s())
            .isEqualTo(VerificationAttempt.keyFor(MOBILE, SESSION_TOKEN));
    }

    @Test
    void saveIfPositionFree_WithFreePosition_ReturnsTrue() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        boolean saved = repository.saveIfPositionFree(
            new VerificationAttempt(MOBILE, SESSION_TOKEN, 2, "hash", false, 1_700_000_000L, 1_700_001_800L));

        assertThat(saved).isTrue();
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_not_exists(attemptNumber)");
        assertThat(captor.getValue().item().get("attemptNumber").n()).isEqualTo("2");
        assertThat(captor.getValue().item().get("success").bool()).isFalse();
        assertThat(captor.getValue().item().get("expiresAt").n()).isEqualTo("1700001800");
    }

    @Test
    void saveIfPositionFree_WithTakenPosition_ReturnsFalse() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
            .thenThrow(ConditionalCheckFailedException.builder().message("taken").build());

        assertThat(repository.saveIfPositionFree(
            new VerificationAttempt(MOBILE, SESSION_TOKEN, 1, "hash", true, 1_700_000_000L, 1_700_001_800L))).isFalse();
    }

    @Test
    void countFor_WithStoreFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.countFor(MOBILE, SESSION_TOKEN))
            .isInstanceOf(RepositoryException.class);
    }

    @Test
    void deleteExpiredBefore_FollowsScanPagesAndDeletesEachAttempt() {
        Map<String, AttributeValue> lastKey = key("a", 1);
        when(dynamoDbClient.scan(any(ScanRequest.class)))
            .thenReturn(ScanResponse.builder()
                .items(List.of(key("a", 1)))
                .lastEvaluatedKey(lastKey)
                .build())
            .thenReturn(ScanResponse.builder()
                .items(List.of(key("a", 2), key("b", 1)))
                .build());
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class)))
            .thenReturn(DeleteItemResponse.builder().build());

        int deleted = repository.deleteExpiredBefore(1_700_000_000L);

        assertThat(deleted).isEqualTo(3);
        ArgumentCaptor<ScanRequest> scans = ArgumentCaptor.forClass(ScanRequest.class);
        verify(dynamoDbClient, times(2)).scan(scans.capture());
        assertThat(scans.getAllValues().get(0).filterExpression()).isEqualTo("expiresAt < :now");
        assertThat(scans.getAllValues().get(0).expressionAttributeValues().get(":now").n()).isEqualTo("1700000000");
        assertThat(scans.getAllValues().get(1).exclusiveStartKey()).isEqualTo(lastKey);
        ArgumentCaptor<DeleteItemRequest> deletes = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDbClient, times(3)).deleteItem(deletes.capture());
        assertThat(deletes.getAllValues().get(1).key()).isEqualTo(key("a", 2));
    }

    @Test
    void deleteExpiredBefore_WithDeleteFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.scan(any(ScanRequest.class)))
            .thenReturn(ScanResponse.builder().items(List.of(key("a", 1))).build());
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.deleteExpiredBefore(1_700_000_000L))
            .isInstanceOf(RepositoryException.class);
    }

    private static Map<String, AttributeValue> key(String challengeKey, int attemptNumber) {
        return Map.of(
            "challengeKey", AttributeValue.builder().s(challengeKey).build(),
            "attemptNumber", AttributeValue.builder().n(String.valueOf(attemptNumber)).build());
    }
}
