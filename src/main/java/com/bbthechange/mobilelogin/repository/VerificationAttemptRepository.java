package com.bbthechange.mobilelogin.repository;

import com.bbthechange.mobilelogin.model.VerificationAttempt;

public interface VerificationAttemptRepository {

    int countFor(String mobileNumber, String sessionToken);

    /**
     * Store the attempt at its position within the session.
     *
     * @return false if a concurrent attempt already holds that position
     */
    boolean saveIfPositionFree(VerificationAttempt attempt);

    /**
     * Delete attempts whose challenge expired before the given time.
     *
     * @return number of attempts deleted
     */
    int deleteExpiredBefore(long epochSecond);
}
