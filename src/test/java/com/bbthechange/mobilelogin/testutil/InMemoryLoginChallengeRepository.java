package com.bbthechange.mobilelogin.testutil;

import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.repository.LoginChallengeRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLoginChallengeRepository implements LoginChallengeRepository {

    private final Map<String, LoginChallenge> challenges = new ConcurrentHashMap<>();

    @Override
    public void save(LoginChallenge challenge) {
        challenges.put(key(challenge.getMobileNumber(), challenge.getSessionToken()), challenge);
    }

    @Override
    public Optional<LoginChallenge> find(String mobileNumber, String sessionToken) {
        return Optional.ofNullable(challenges.get(key(mobileNumber, sessionToken)));
    }

    @Override
    public void markVerified(String mobileNumber, String sessionToken, long verifiedAt, String credentialId) {
        LoginChallenge challenge = challenges.get(key(mobileNumber, sessionToken));
        if (challenge != null) {
            challenge.setVerifiedAt(verifiedAt);
            challenge.setCredentialId(credentialId);
        }
    }

    @Override
    public int deleteExpiredBefore(long epochSecond) {
        int before = challenges.size();
        challenges.values().removeIf(c -> c.getExpiresAt() < epochSecond);
        return before - challenges.size();
    }

    public int size() {
        return challenges.size();
    }

    private static String key(String mobileNumber, String sessionToken) {
        return mobileNumber + "#" + sessionToken;
    }
}
