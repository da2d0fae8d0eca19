package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.model.VerificationAttempt;
import com.bbthechange.mobilelogin.repository.LoginChallengeRepository;
import com.bbthechange.mobilelogin.repository.VerificationAttemptRepository;
import com.bbthechange.mobilelogin.util.SecureTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Issued login challenges and the attempts made against them.
 * Only the SHA-256 hash of an OTP is ever persisted.
 */
@Service
public class SessionLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(SessionLedgerService.class);

    private final LoginChallengeRepository challengeRepository;
    private final VerificationAttemptRepository attemptRepository;
    private final LoginProperties properties;
    private final Clock clock;

    public SessionLedgerService(LoginChallengeRepository challengeRepository,
                                VerificationAttemptRepository attemptRepository,
                                LoginProperties properties,
                                Clock clock) {
        this.challengeRepository = challengeRepository;
        this.attemptRepository = attemptRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public LoginChallenge issue(String mobileNumber, String deviceId, String fcmToken, String email, String otp) {
        Instant now = clock.instant();
        long issuedAt = now.getEpochSecond();
        long expiresAt = now.plus(properties.getOtpLifetime()).getEpochSecond();

        LoginChallenge challenge = new LoginChallenge(mobileNumber, SecureTokens.generateSessionToken(), deviceId,
                fcmToken, email, SecureTokens.sha256Hex(otp), issuedAt, expiresAt);
        challengeRepository.save(challenge);
        logger.info("Login challenge issued for {}, expires at {}", mobileNumber, expiresAt);
        return challenge;
    }

    public Optional<LoginChallenge> find(String mobileNumber, String sessionToken) {
        return challengeRepository.find(mobileNumber, sessionToken);
    }

    /**
     * Record an attempt against the challenge at the given 1-based position.
     *
     * @return false if a concurrent attempt already holds that position
     */
    public boolean recordAttempt(LoginChallenge challenge, String submittedCode, boolean success, int position) {
        VerificationAttempt attempt = new VerificationAttempt(challenge.getMobileNumber(),
                challenge.getSessionToken(), position, SecureTokens.sha256Hex(submittedCode), success,
                clock.instant().getEpochSecond(), challenge.getExpiresAt());
        return attemptRepository.saveIfPositionFree(attempt);
    }

    public int attemptCount(String mobileNumber, String sessionToken) {
        return attemptRepository.countFor(mobileNumber, sessionToken);
    }

    public void markVerified(LoginChallenge challenge, String credentialId) {
        long verifiedAt = clock.instant().getEpochSecond();
        challengeRepository.markVerified(challenge.getMobileNumber(), challenge.getSessionToken(),
                verifiedAt, credentialId);
        challenge.setVerifiedAt(verifiedAt);
        challenge.setCredentialId(credentialId);
    }

    /**
     * Remove challenges whose expiry is already in the past, and the attempts made against them.
     *
     * @return number of challenges removed
     */
    public int sweepExpired() {
        long now = clock.instant().getEpochSecond();
        int removed = challengeRepository.deleteExpiredBefore(now);
        int attempts = attemptRepository.deleteExpiredBefore(now);
        if (removed > 0 || attempts > 0) {
            logger.info("Removed {} expired login challenges and {} verification attempts", removed, attempts);
        }
        return removed;
    }
}
