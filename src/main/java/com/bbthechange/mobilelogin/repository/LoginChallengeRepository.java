package com.bbthechange.mobilelogin.repository;

import com.bbthechange.mobilelogin.model.LoginChallenge;

import java.util.Optional;

public interface LoginChallengeRepository {

    void save(LoginChallenge challenge);

    Optional<LoginChallenge> find(String mobileNumber, String sessionToken);

    void markVerified(String mobileNumber, String sessionToken, long verifiedAt, String credentialId);

    /**
     * Delete every challenge whose {@code expiresAt} is strictly before the given epoch second.
     *
     * @return number of challenges deleted
     */
    int deleteExpiredBefore(long epochSecond);
}
