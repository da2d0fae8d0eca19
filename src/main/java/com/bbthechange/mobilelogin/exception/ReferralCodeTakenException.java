package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when a caller-supplied referral code already belongs to another user.
 */
public class ReferralCodeTakenException extends RuntimeException {

    private final String referralCode;

    public ReferralCodeTakenException(String referralCode) {
        super("Referral code is already in use: " + referralCode);
        this.referralCode = referralCode;
    }

    public String getReferralCode() {
        return referralCode;
    }
}
