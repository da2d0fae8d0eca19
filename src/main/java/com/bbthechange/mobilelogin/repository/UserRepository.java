package com.bbthechange.mobilelogin.repository;

import com.bbthechange.mobilelogin.exception.ReferralCodeTakenException;
import com.bbthechange.mobilelogin.model.LocaleUpdate;
import com.bbthechange.mobilelogin.model.ProfileUpdate;
import com.bbthechange.mobilelogin.model.RegistrationOutcome;
import com.bbthechange.mobilelogin.model.User;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository {

    Optional<User> findByMobileNumber(String mobileNumber);

    /**
     * Insert a new user and move the named counter from {@code expectedCounterValue} to the
     * user's number, atomically. Neither write happens unless both conditions hold.
     */
    RegistrationOutcome insertNumbered(User user, String counterName, long expectedCounterValue);

    /**
     * Increment total logins and stamp the login time. Missing users are ignored.
     */
    void updateLoginStats(String mobileNumber, Instant loginAt);

    void updateDeviceTokens(String mobileNumber, String deviceId, String fcmToken, Instant updatedAt);

    /**
     * Overwrite only the supplied profile attributes. A supplied referral code is claimed for
     * the user in the same write.
     *
     * @return the updated user, or empty if the user does not exist
     * @throws ReferralCodeTakenException if another user holds the referral code
     */
    Optional<User> updateProfile(String mobileNumber, ProfileUpdate update, Instant updatedAt);

    Optional<User> updateLocale(String mobileNumber, LocaleUpdate update, Instant updatedAt);

    /**
     * Mobile number of the user holding the referral code, if any. Strongly consistent.
     */
    Optional<String> findOwnerOfReferralCode(String referralCode);
}
