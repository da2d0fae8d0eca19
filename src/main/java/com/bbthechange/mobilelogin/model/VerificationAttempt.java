package com.bbthechange.mobilelogin.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * A single OTP submission against a login challenge. Written once, never updated.
 * <p>
 * {@code attemptNumber} is the 1-based position of the attempt within its session.
 * {@code expiresAt} is copied from the challenge, so the attempt lives exactly as long as it does.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class VerificationAttempt {

    private String challengeKey;
    private Integer attemptNumber;
    private String mobileNumber;
    private String sessionToken;
    private String hashedCode;
    private Boolean success;
    private Long attemptedAt;
    private Long expiresAt;

    public VerificationAttempt(String mobileNumber, String sessionToken, int attemptNumber,
                               String hashedCode, boolean success, long attemptedAt, long expiresAt) {
        this.challengeKey = keyFor(mobileNumber, sessionToken);
        this.attemptNumber = attemptNumber;
        this.mobileNumber = mobileNumber;
        this.sessionToken = sessionToken;
        this.hashedCode = hashedCode;
        this.success = success;
        this.attemptedAt = attemptedAt;
        this.expiresAt = expiresAt;
    }

    public static String keyFor(String mobileNumber, String sessionToken) {
        return mobileNumber + "#" + sessionToken;
    }

    @DynamoDbPartitionKey
    public String getChallengeKey() {
        return challengeKey;
    }

    @DynamoDbSortKey
    public Integer getAttemptNumber() {
        return attemptNumber;
    }
}
