package com.bbthechange.mobilelogin.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB clients for the user directory, session ledger, counters and audit tables.
 * Setting {@code aws.dynamodb.endpoint} points both clients at a local emulator.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Bean
    public DynamoDbClient dynamoDbClient(@Value("${aws.region:us-east-1}") String region,
                                         @Value("${aws.dynamodb.endpoint:}") String endpoint) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsFor(endpoint));

        if (!endpoint.isEmpty()) {
            logger.info("Using DynamoDB endpoint override {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    private AwsCredentialsProvider credentialsFor(String endpoint) {
        if (endpoint.isEmpty()) {
            return DefaultCredentialsProvider.create();
        }
        // Local emulators accept any static credentials
        return StaticCredentialsProvider.create(AwsBasicCredentials.create("dummykey", "dummysecret"));
    }
}
