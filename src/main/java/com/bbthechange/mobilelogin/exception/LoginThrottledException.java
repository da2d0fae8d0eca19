package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when a mobile number requests OTPs faster than the configured limit.
 */
public class LoginThrottledException extends RuntimeException {

    private final String mobileNumber;

    public LoginThrottledException(String mobileNumber) {
        super("Too many login requests for this mobile number. Please try again later.");
        this.mobileNumber = mobileNumber;
    }

    public String getMobileNumber() {
        return mobileNumber;
    }
}
