package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when no free referral code was found within the retry budget.
 */
public class ReferralCodeExhaustedException extends RuntimeException {
    public ReferralCodeExhaustedException(int attempts) {
        super("Failed to generate a unique referral code after " + attempts + " attempts");
    }
}
