package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.model.LoginChallenge;

/**
 * Outcome of checking a submitted OTP. Authentication failures are values, never exceptions.
 */
public class VerificationResult {
    public enum Status {
        VERIFIED(null),
        INVALID("INVALID_OTP"),
        EXPIRED("OTP_EXPIRED"),
        NOT_FOUND("SESSION_NOT_FOUND"),
        RATE_LIMITED("RATE_LIMIT_EXCEEDED");

        private final String errorCode;

        Status(String errorCode) {
            this.errorCode = errorCode;
        }

        public String getErrorCode() {
            return errorCode;
        }
    }

    private final Status status;
    private final String message;
    private final int attemptsRemaining;
    private final LoginChallenge challenge;

    private VerificationResult(Status status, String message, int attemptsRemaining, LoginChallenge challenge) {
        this.status = status;
        this.message = message;
        this.attemptsRemaining = Math.max(0, attemptsRemaining);
        this.challenge = challenge;
    }

    public static VerificationResult verified(LoginChallenge challenge, int attemptsRemaining) {
        return new VerificationResult(Status.VERIFIED, "OTP verified successfully", attemptsRemaining, challenge);
    }

    public static VerificationResult invalid(int attemptsRemaining) {
        return new VerificationResult(Status.INVALID, "The OTP is incorrect.", attemptsRemaining, null);
    }

    public static VerificationResult expired(int attemptsRemaining) {
        return new VerificationResult(Status.EXPIRED, "The OTP has expired. Please request a new one.",
                attemptsRemaining, null);
    }

    public static VerificationResult notFound(int attemptsRemaining) {
        return new VerificationResult(Status.NOT_FOUND, "No login session found for this mobile number and token.",
                attemptsRemaining, null);
    }

    public static VerificationResult rateLimited() {
        return new VerificationResult(Status.RATE_LIMITED,
                "Too many verification attempts. Please request a new OTP.", 0, null);
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public int getAttemptsRemaining() {
        return attemptsRemaining;
    }

    /**
     * The matched challenge; only set when verified.
     */
    public LoginChallenge getChallenge() {
        return challenge;
    }

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }
}
