package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.bbthechange.mobilelogin.exception.ReferralCodeExhaustedException;
import com.bbthechange.mobilelogin.exception.ReferralCodeTakenException;
import com.bbthechange.mobilelogin.exception.ValidationException;
import com.bbthechange.mobilelogin.util.ReferralCodeGenerator;
import com.bbthechange.mobilelogin.validation.ValidationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Hands out referral codes that no other user holds.
 * <p>
 * The write that stores a code on a user also claims it in the store, and that claim is what
 * makes a code unique. The checks here only avoid handing out codes already known to be taken:
 * a code returned by {@link #reserve} stays reserved in this process until {@link #release},
 * and the lock covers only the check-and-reserve step.
 */
@Service
public class ReferralCodeService {

    private static final Logger logger = LoggerFactory.getLogger(ReferralCodeService.class);

    static final int MIN_LENGTH = 4;
    static final int MAX_LENGTH = 20;

    private final UserDirectoryService userDirectory;
    private final LoginProperties properties;
    private final ReentrantLock reservationLock = new ReentrantLock();
    private final Set<String> reserved = ConcurrentHashMap.newKeySet();

    public ReferralCodeService(UserDirectoryService userDirectory, LoginProperties properties) {
        this.userDirectory = userDirectory;
        this.properties = properties;
    }

    /**
     * Pick a code for the owner and hand it to {@code claim}, which must store and claim it.
     * A generated code that {@code claim} finds taken is replaced by a new one, within the
     * same retry budget as generation; a caller-supplied code is never replaced.
     *
     * @return what {@code claim} returned for the code it stored
     * @throws ReferralCodeTakenException if the caller-supplied code is held by another user
     * @throws ReferralCodeExhaustedException if every generated code was taken
     */
    public <T> T assign(String candidate, String ownerMobileNumber, Function<String, T> claim) {
        int attempts = candidate == null ? properties.getReferralCodeMaxAttempts() : 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String code = reserve(candidate, ownerMobileNumber);
            try {
                return claim.apply(code);
            } catch (ReferralCodeTakenException e) {
                if (candidate != null) {
                    throw e;
                }
                logger.debug("Generated referral code for {} was claimed concurrently, picking another", ownerMobileNumber);
            } finally {
                release(code);
            }
        }
        throw new ReferralCodeExhaustedException(properties.getReferralCodeMaxAttempts());
    }

    /**
     * Reserve {@code candidate} for the owner, or generate a fresh code when it is null.
     *
     * @throws ValidationException if the candidate is not 4-20 ASCII letters and digits
     * @throws ReferralCodeTakenException if another user holds or is claiming the candidate
     * @throws ReferralCodeExhaustedException if no free code was generated within the retry budget
     */
    public String reserve(String candidate, String ownerMobileNumber) {
        if (candidate != null && !ReferralCodeGenerator.isWellFormed(candidate, MIN_LENGTH, MAX_LENGTH)) {
            throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_FORMAT,
                    ValidationFailure.FORMAT_ERROR, "referral_code",
                    "referral_code must be between 4 and 20 alphanumeric characters",
                    Map.of("min_length", MIN_LENGTH, "max_length", MAX_LENGTH)));
        }

        reservationLock.lock();
        try {
            if (candidate != null) {
                String code = candidate.toUpperCase(Locale.ROOT);
                if (reserved.contains(code) || heldByAnotherUser(code, ownerMobileNumber)) {
                    throw new ReferralCodeTakenException(code);
                }
                reserved.add(code);
                return code;
            }

            Optional<String> generated = ReferralCodeGenerator.generateUnique(
                    properties.getReferralCodeLength(),
                    properties.getReferralCodeMaxAttempts(),
                    code -> reserved.contains(code) || userDirectory.findReferralCodeOwner(code).isPresent());
            String code = generated.orElseThrow(
                    () -> new ReferralCodeExhaustedException(properties.getReferralCodeMaxAttempts()));
            reserved.add(code);
            logger.debug("Generated referral code for {}", ownerMobileNumber);
            return code;
        } finally {
            reservationLock.unlock();
        }
    }

    public void release(String code) {
        if (code != null) {
            reserved.remove(code);
        }
    }

    /**
     * Normalize a referrer code and check that some user holds it.
     *
     * @throws ValidationException with {@code INVALID_REFERRAL} if no user holds the code
     */
    public String validateReferrer(String referredBy) {
        String code = referredBy.toUpperCase(Locale.ROOT);
        if (userDirectory.findReferralCodeOwner(code).isEmpty()) {
            throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_REFERRAL,
                    ValidationFailure.VALUE_ERROR, "referred_by",
                    "referred_by does not match any existing referral code", Map.of("referred_by", code)));
        }
        return code;
    }

    private boolean heldByAnotherUser(String code, String ownerMobileNumber) {
        return userDirectory.findReferralCodeOwner(code)
                .map(owner -> !owner.equals(ownerMobileNumber))
                .orElse(false);
    }
}
