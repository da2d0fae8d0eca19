package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.dto.OtpVerifiedResponse;

/**
 * Result of the {@code verify:otp} flow. {@code response} is set only when verification succeeded.
 */
public record VerifyOtpOutcome(VerificationResult result, OtpVerifiedResponse response) {

    public boolean isVerified() {
        return result.isVerified();
    }
}
