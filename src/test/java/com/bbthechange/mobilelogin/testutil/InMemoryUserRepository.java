package com.bbthechange.mobilelogin.testutil;

import com.bbthechange.mobilelogin.exception.ReferralCodeTakenException;
import com.bbthechange.mobilelogin.model.LocaleUpdate;
import com.bbthechange.mobilelogin.model.ProfileUpdate;
import com.bbthechange.mobilelogin.model.RegistrationOutcome;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.repository.SequenceCounterRepository;
import com.bbthechange.mobilelogin.repository.UserRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies the same "only supplied attributes" rule as the DynamoDB update expressions.
 * Also stands in for the counter table and the referral code claims, since the real writes
 * touch them in the same transaction as the user row.
 */
public class InMemoryUserRepository implements UserRepository, SequenceCounterRepository {

    private final Map<String, User> users = new ConcurrentHashMap<>();
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Map<String, String> claims = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findByMobileNumber(String mobileNumber) {
        return Optional.ofNullable(users.get(mobileNumber));
    }

    @Override
    public synchronized RegistrationOutcome insertNumbered(User user, String counterName, long expectedCounterValue) {
        if (users.containsKey(user.getMobileNumber())) {
            return RegistrationOutcome.MOBILE_TAKEN;
        }
        if (current(counterName) != expectedCounterValue) {
            return RegistrationOutcome.NUMBER_TAKEN;
        }
        users.put(user.getMobileNumber(), user);
        counters.put(counterName, user.getUserNumber());
        return RegistrationOutcome.INSERTED;
    }

    @Override
    public long current(String counterName) {
        return counters.getOrDefault(counterName, 0L);
    }

    @Override
    public void updateLoginStats(String mobileNumber, Instant loginAt) {
        users.computeIfPresent(mobileNumber, (k, user) -> {
            user.setTotalLogins(user.getTotalLogins() + 1);
            user.setLastLoginAt(loginAt);
            user.setActive(true);
            user.setUpdatedAt(loginAt);
            return user;
        });
    }

    @Override
    public void updateDeviceTokens(String mobileNumber, String deviceId, String fcmToken, Instant updatedAt) {
        users.computeIfPresent(mobileNumber, (k, user) -> {
            user.setDeviceId(deviceId);
            user.setFcmToken(fcmToken);
            user.setUpdatedAt(updatedAt);
            return user;
        });
    }

    @Override
    public synchronized Optional<User> updateProfile(String mobileNumber, ProfileUpdate update, Instant updatedAt) {
        if (!users.containsKey(mobileNumber)) {
            return Optional.empty();
        }
        String code = update.referralCode();
        if (code != null) {
            String owner = claims.get(code);
            if (owner != null && !owner.equals(mobileNumber)) {
                throw new ReferralCodeTakenException(code);
            }
            claims.put(code, mobileNumber);
            String replaced = update.replacedReferralCode();
            if (replaced != null && !replaced.equals(code)) {
                claims.remove(replaced, mobileNumber);
            }
        }
        return Optional.ofNullable(users.computeIfPresent(mobileNumber, (k, user) -> {
            if (update.fullName() != null) user.setFullName(update.fullName());
            if (update.state() != null) user.setState(update.state());
            if (update.referralCode() != null) user.setReferralCode(update.referralCode());
            if (update.referredBy() != null) user.setReferredBy(update.referredBy());
            if (update.profileData() != null) user.setProfileData(update.profileData());
            user.setUpdatedAt(updatedAt);
            return user;
        }));
    }

    @Override
    public Optional<User> updateLocale(String mobileNumber, LocaleUpdate update, Instant updatedAt) {
        return Optional.ofNullable(users.computeIfPresent(mobileNumber, (k, user) -> {
            if (update.languageCode() != null) user.setLanguageCode(update.languageCode());
            if (update.languageName() != null) user.setLanguageName(update.languageName());
            if (update.regionCode() != null) user.setRegionCode(update.regionCode());
            if (update.timezone() != null) user.setTimezone(update.timezone());
            if (update.preferences() != null) user.setPreferences(update.preferences());
            user.setUpdatedAt(updatedAt);
            return user;
        }));
    }

    @Override
    public Optional<String> findOwnerOfReferralCode(String referralCode) {
        return Optional.ofNullable(claims.get(referralCode));
    }
}
