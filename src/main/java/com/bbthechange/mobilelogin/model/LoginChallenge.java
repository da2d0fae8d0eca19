package com.bbthechange.mobilelogin.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;
import java.util.Objects;

/**
 * One issued login challenge. Each login request produces a new session token, so
 * challenges for the same mobile number never overwrite each other.
 * <p>
 * {@code expiresAt} is epoch seconds and doubles as the table's TTL attribute.
 */
@DynamoDbBean
public class LoginChallenge {

    private String mobileNumber;
    private String sessionToken;
    private String deviceId;
    private String fcmToken;
    private String email;
    private String hashedOtp;
    private Long issuedAt;
    private Long expiresAt;
    private Long verifiedAt;
    private String credentialId;

    public LoginChallenge() {
    }

    public LoginChallenge(String mobileNumber, String sessionToken, String deviceId, String fcmToken,
                          String email, String hashedOtp, Long issuedAt, Long expiresAt) {
        this.mobileNumber = mobileNumber;
        this.sessionToken = sessionToken;
        this.deviceId = deviceId;
        this.fcmToken = fcmToken;
        this.email = email;
        this.hashedOtp = hashedOtp;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    @DynamoDbPartitionKey
    public String getMobileNumber() {
        return mobileNumber;
    }

    public void setMobileNumber(String mobileNumber) {
        this.mobileNumber = mobileNumber;
    }

    @DynamoDbSortKey
    public String getSessionToken() {
        return sessionToken;
    }

    public void setSessionToken(String sessionToken) {
        this.sessionToken = sessionToken;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getFcmToken() {
        return fcmToken;
    }

    public void setFcmToken(String fcmToken) {
        this.fcmToken = fcmToken;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getHashedOtp() {
        return hashedOtp;
    }

    public void setHashedOtp(String hashedOtp) {
        this.hashedOtp = hashedOtp;
    }

    public Long getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(Long issuedAt) {
        this.issuedAt = issuedAt;
    }

    public Long getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Long getVerifiedAt() {
        return verifiedAt;
    }

    public void setVerifiedAt(Long verifiedAt) {
        this.verifiedAt = verifiedAt;
    }

    public String getCredentialId() {
        return credentialId;
    }

    public void setCredentialId(String credentialId) {
        this.credentialId = credentialId;
    }

    /**
     * A challenge is usable only while {@code now <= expiresAt}.
     */
    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() > this.expiresAt;
    }

    public boolean isVerified() {
        return verifiedAt != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoginChallenge that = (LoginChallenge) o;
        return Objects.equals(mobileNumber, that.mobileNumber) &&
                Objects.equals(sessionToken, that.sessionToken) &&
                Objects.equals(deviceId, that.deviceId) &&
                Objects.equals(hashedOtp, that.hashedOtp) &&
                Objects.equals(issuedAt, that.issuedAt) &&
                Objects.equals(expiresAt, that.expiresAt) &&
                Objects.equals(verifiedAt, that.verifiedAt) &&
                Objects.equals(credentialId, that.credentialId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mobileNumber, sessionToken, deviceId, hashedOtp, issuedAt, expiresAt, verifiedAt, credentialId);
    }

    @Override
    public String toString() {
        return "LoginChallenge{" +
                "mobileNumber='" + mobileNumber + '\'' +
                ", sessionToken='[REDACTED]'" +
                ", deviceId='" + deviceId + '\'' +
                ", hashedOtp='[REDACTED]'" +
                ", issuedAt=" + issuedAt +
                ", expiresAt=" + expiresAt +
                ", verifiedAt=" + verifiedAt +
                '}';
    }
}
