package com.bbthechange.mobilelogin.config;

import com.bbthechange.mobilelogin.model.AuditEvent;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.model.ReferralCodeClaim;
import com.bbthechange.mobilelogin.model.SequenceCounter;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.model.VerificationAttempt;
import com.bbthechange.mobilelogin.repository.impl.LoginChallengeRepositoryImpl;
import com.bbthechange.mobilelogin.repository.impl.SequenceCounterRepositoryImpl;
import com.bbthechange.mobilelogin.repository.impl.UserRepositoryImpl;
import com.bbthechange.mobilelogin.repository.impl.VerificationAttemptRepositoryImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;

/**
 * Creates any missing tables at startup. Disabled with {@code dynamodb.table.init.enabled=false}
 * where tables are provisioned outside the application.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient, DynamoDbClient dynamoDbClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(UserRepositoryImpl.TABLE_NAME, User.class);
        createTableIfNotExists(UserRepositoryImpl.REFERRAL_CODES_TABLE, ReferralCodeClaim.class);
        createTableIfNotExists(LoginChallengeRepositoryImpl.TABLE_NAME, LoginChallenge.class);
        createTableIfNotExists(VerificationAttemptRepositoryImpl.TABLE_NAME, VerificationAttempt.class);
        createTableIfNotExists(SequenceCounterRepositoryImpl.TABLE_NAME, SequenceCounter.class);
        for (AuditEventKind kind : AuditEventKind.values()) {
            createTableIfNotExists(kind.getTableName(), AuditEvent.class);
        }

        configureTTL(LoginChallengeRepositoryImpl.TABLE_NAME, "expiresAt");
        configureTTL(VerificationAttemptRepositoryImpl.TABLE_NAME, "expiresAt");
    }

    private <T> void createTableIfNotExists(String tableName, Class<T> entityClass) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .build());
            logger.info("Table {} created", tableName);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }

    private void configureTTL(String tableName, String ttlAttributeName) {
        try {
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                .tableName(tableName)
                .timeToLiveSpecification(TimeToLiveSpecification.builder()
                    .attributeName(ttlAttributeName)
                    .enabled(true)
                    .build())
                .build());
            logger.info("TTL enabled for table {} on attribute {}", tableName, ttlAttributeName);
        } catch (DynamoDbException e) {
            // Already enabled, or not supported by a local emulator; the sweeper still removes expired rows
            logger.warn("Could not configure TTL for table {} on attribute {}: {}",
                tableName, ttlAttributeName, e.getMessage());
        }
    }
}
