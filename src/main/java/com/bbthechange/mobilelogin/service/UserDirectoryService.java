package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.LocaleUpdate;
import com.bbthechange.mobilelogin.model.ProfileUpdate;
import com.bbthechange.mobilelogin.model.RegisteredUser;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.repository.SequenceCounterRepository;
import com.bbthechange.mobilelogin.repository.UserRepository;
import com.bbthechange.mobilelogin.util.TimeOrderedIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of users keyed by mobile number.
 * <p>
 * Registration assigns a time-ordered UUID and the value after the current one of the durable
 * {@value #USER_NUMBER_COUNTER} counter. The user row and the counter move in one transaction,
 * so a number is only consumed by the registration that stores it: a loser of a race for the
 * same mobile number returns the winner's record and leaves the counter alone, and a loser of
 * a race for the same number reads the counter again.
 */
@Service
public class UserDirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(UserDirectoryService.class);

    static final String USER_NUMBER_COUNTER = "userNumber";
    static final int MAX_REGISTRATION_ATTEMPTS = 100;

    private final UserRepository userRepository;
    private final SequenceCounterRepository counterRepository;
    private final Clock clock;

    public UserDirectoryService(UserRepository userRepository, SequenceCounterRepository counterRepository,
                                Clock clock) {
        this.userRepository = userRepository;
        this.counterRepository = counterRepository;
        this.clock = clock;
    }

    public boolean exists(String mobileNumber) {
        return userRepository.findByMobileNumber(mobileNumber).isPresent();
    }

    public Optional<User> find(String mobileNumber) {
        return userRepository.findByMobileNumber(mobileNumber);
    }

    public RegisteredUser register(String mobileNumber, String deviceId, String fcmToken, String email) {
        String userId = TimeOrderedIds.next(clock).toString();

        for (int attempt = 1; attempt <= MAX_REGISTRATION_ATTEMPTS; attempt++) {
            Optional<User> existing = userRepository.findByMobileNumber(mobileNumber);
            if (existing.isPresent()) {
                return new RegisteredUser(existing.get(), false);
            }

            long current = counterRepository.current(USER_NUMBER_COUNTER);
            User user = new User(mobileNumber, userId, current + 1, deviceId, fcmToken, email, clock.instant());

            switch (userRepository.insertNumbered(user, USER_NUMBER_COUNTER, current)) {
                case INSERTED -> {
                    logger.info("New user {} registered as number {}", userId, user.getUserNumber());
                    return new RegisteredUser(user, true);
                }
                case MOBILE_TAKEN -> {
                    // Lost a concurrent registration for the same number
                    User winner = userRepository.findByMobileNumber(mobileNumber)
                            .orElseThrow(() -> new RepositoryException(
                                    "User " + mobileNumber + " vanished after a conflicting insert"));
                    return new RegisteredUser(winner, false);
                }
                case NUMBER_TAKEN -> logger.debug("User number {} was taken, retrying registration of {}",
                        user.getUserNumber(), mobileNumber);
            }
        }
        throw new RepositoryException("No user number could be assigned to " + mobileNumber
                + " after " + MAX_REGISTRATION_ATTEMPTS + " attempts");
    }

    public void recordLogin(String mobileNumber) {
        userRepository.updateLoginStats(mobileNumber, clock.instant());
    }

    /**
     * Refresh the device binding for a returning user if it changed.
     */
    public void refreshDevice(User user, String deviceId, String fcmToken) {
        if (Objects.equals(user.getDeviceId(), deviceId) && Objects.equals(user.getFcmToken(), fcmToken)) {
            return;
        }
        Instant now = clock.instant();
        userRepository.updateDeviceTokens(user.getMobileNumber(), deviceId, fcmToken, now);
        user.setDeviceId(deviceId);
        user.setFcmToken(fcmToken);
        user.setUpdatedAt(now);
        logger.debug("Device binding refreshed for user {}", user.getUserId());
    }

    public Optional<User> updateProfile(String mobileNumber, ProfileUpdate update) {
        return userRepository.updateProfile(mobileNumber, update, clock.instant());
    }

    public Optional<User> updateLocale(String mobileNumber, LocaleUpdate update) {
        return userRepository.updateLocale(mobileNumber, update, clock.instant());
    }

    public Optional<String> findReferralCodeOwner(String referralCode) {
        return userRepository.findOwnerOfReferralCode(referralCode);
    }
}
