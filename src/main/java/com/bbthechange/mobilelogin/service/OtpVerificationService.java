package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.util.SecureTokens;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides whether a submitted OTP opens a login challenge.
 * <p>
 * Checks run in a fixed order:
 * <ol>
 *   <li>attempt budget exhausted: rate limited, the code is not compared</li>
 *   <li>no challenge for the number and token: not found, nothing recorded</li>
 *   <li>challenge already used for a login: not found, nothing recorded</li>
 *   <li>challenge past its expiry: expired, a failed attempt is recorded</li>
 *   <li>constant-time hash comparison: verified or invalid, the attempt is recorded</li>
 * </ol>
 * The attempt log never holds more records than the ceiling for a session.
 */
@Service
public class OtpVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(OtpVerificationService.class);

    private final SessionLedgerService sessionLedger;
    private final LoginProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public OtpVerificationService(SessionLedgerService sessionLedger, LoginProperties properties,
                                  MeterRegistry meterRegistry, Clock clock) {
        this.sessionLedger = sessionLedger;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public VerificationResult verify(String mobileNumber, String sessionToken, String submittedCode) {
        VerificationResult result = evaluate(mobileNumber, sessionToken, submittedCode);
        meterRegistry.counter("otp.verification",
                "outcome", result.getStatus().name().toLowerCase(Locale.ROOT)).increment();
        logger.info("OTP verification for {}: {}", mobileNumber, result.getStatus());
        return result;
    }

    private VerificationResult evaluate(String mobileNumber, String sessionToken, String submittedCode) {
        int ceiling = properties.getMaxVerificationAttempts();

        int attempts = sessionLedger.attemptCount(mobileNumber, sessionToken);
        if (attempts >= ceiling) {
            return VerificationResult.rateLimited();
        }

        Optional<LoginChallenge> found = sessionLedger.find(mobileNumber, sessionToken);
        if (found.isEmpty()) {
            return VerificationResult.notFound(ceiling - attempts);
        }
        LoginChallenge challenge = found.get();
        if (challenge.isVerified()) {
            logger.debug("Challenge for {} was already used", mobileNumber);
            return VerificationResult.notFound(ceiling - attempts);
        }

        if (challenge.isExpiredAt(clock.instant())) {
            OptionalInt position = record(challenge, submittedCode, false, attempts + 1);
            if (position.isEmpty()) {
                return VerificationResult.rateLimited();
            }
            return VerificationResult.expired(ceiling - position.getAsInt());
        }

        boolean matches = SecureTokens.hashesMatch(challenge.getHashedOtp(), SecureTokens.sha256Hex(submittedCode));
        OptionalInt position = record(challenge, submittedCode, matches, attempts + 1);
        if (position.isEmpty()) {
            return VerificationResult.rateLimited();
        }
        int remaining = ceiling - position.getAsInt();
        return matches ? VerificationResult.verified(challenge, remaining) : VerificationResult.invalid(remaining);
    }

    /**
     * Claim the next free attempt position. When a concurrent attempt took the position, the
     * count is read again; the call gives up once the ceiling is reached.
     *
     * @return the claimed position, or empty if the budget ran out
     */
    private OptionalInt record(LoginChallenge challenge, String submittedCode, boolean success, int position) {
        String mobileNumber = challenge.getMobileNumber();
        String sessionToken = challenge.getSessionToken();
        int ceiling = properties.getMaxVerificationAttempts();
        int next = position;
        while (next <= ceiling) {
            if (sessionLedger.recordAttempt(challenge, submittedCode, success, next)) {
                return OptionalInt.of(next);
            }
            next = sessionLedger.attemptCount(mobileNumber, sessionToken) + 1;
        }
        logger.warn("Attempt budget for {} exhausted by concurrent attempts", mobileNumber);
        return OptionalInt.empty();
    }
}
