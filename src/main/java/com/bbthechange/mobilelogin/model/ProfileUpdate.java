package com.bbthechange.mobilelogin.model;

/**
 * Profile attributes to overwrite on a user. Null components are left untouched.
 *
 * @param profileData free-form profile object serialized as JSON text
 * @param replacedReferralCode the user's current code when {@code referralCode} replaces it;
 *                             its claim is released in the same write
 */
public record ProfileUpdate(String fullName, String state, String referralCode, String referredBy,
                            String profileData, String replacedReferralCode) {

    public ProfileUpdate(String fullName, String state, String referralCode, String referredBy, String profileData) {
        this(fullName, state, referralCode, referredBy, profileData, null);
    }
}
