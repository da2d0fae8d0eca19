package com.bbthechange.mobilelogin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the OTP login flow, bound from {@code login.*}.
 */
@Component
@ConfigurationProperties(prefix = "login")
public class LoginProperties {

    private Duration otpLifetime = Duration.ofMinutes(30);

    private int maxVerificationAttempts = 5;

    private Duration credentialLifetime = Duration.ofDays(7);

    private int referralCodeLength = 6;

    private int referralCodeMaxAttempts = 10;

    private Duration sweepInterval = Duration.ofMinutes(5);

    // OTP issuance per mobile number per hour
    private int issueLimitPerHour = 10;

    private int workerPoolSize = 16;

    public Duration getOtpLifetime() {
        return otpLifetime;
    }

    public void setOtpLifetime(Duration otpLifetime) {
        this.otpLifetime = otpLifetime;
    }

    public int getMaxVerificationAttempts() {
        return maxVerificationAttempts;
    }

    public void setMaxVerificationAttempts(int maxVerificationAttempts) {
        this.maxVerificationAttempts = maxVerificationAttempts;
    }

    public Duration getCredentialLifetime() {
        return credentialLifetime;
    }

    public void setCredentialLifetime(Duration credentialLifetime) {
        this.credentialLifetime = credentialLifetime;
    }

    public int getReferralCodeLength() {
        return referralCodeLength;
    }

    public void setReferralCodeLength(int referralCodeLength) {
        this.referralCodeLength = referralCodeLength;
    }

    public int getReferralCodeMaxAttempts() {
        return referralCodeMaxAttempts;
    }

    public void setReferralCodeMaxAttempts(int referralCodeMaxAttempts) {
        this.referralCodeMaxAttempts = referralCodeMaxAttempts;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getIssueLimitPerHour() {
        return issueLimitPerHour;
    }

    public void setIssueLimitPerHour(int issueLimitPerHour) {
        this.issueLimitPerHour = issueLimitPerHour;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }
}
