package com.bbthechange.mobilelogin.model;

import com.bbthechange.mobilelogin.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

/**
 * A registered user, keyed by mobile number.
 * <p>
 * {@code mobileNumber}, {@code userId} and {@code userNumber} are written once at
 * registration and never change afterwards. {@code referralCode} is unique across users; the
 * claim on it lives in {@link ReferralCodeClaim}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class User {
    private String mobileNumber;
    private String userId;
    private Long userNumber;
    private String deviceId;
    private String fcmToken;
    private String email;
    private String fullName;
    private String state;
    private String timezone;
    private String languageCode;
    private String languageName;
    private String regionCode;
    private String preferences;
    private String profileData;
    private String referralCode;
    private String referredBy;
    private Long totalLogins;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastLoginAt;

    public User(String mobileNumber, String userId, Long userNumber, String deviceId,
                String fcmToken, String email, Instant createdAt) {
        this.mobileNumber = mobileNumber;
        this.userId = userId;
        this.userNumber = userNumber;
        this.deviceId = deviceId;
        this.fcmToken = fcmToken;
        this.email = email;
        this.totalLogins = 0L;
        this.active = true;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    @DynamoDbPartitionKey
    public String getMobileNumber() {
        return mobileNumber;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastLoginAt() {
        return lastLoginAt;
    }
}
