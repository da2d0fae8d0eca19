package com.bbthechange.mobilelogin.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/**
 * Version 7 UUIDs: 48-bit Unix millisecond timestamp followed by random bits,
 * so identifiers sort by creation time.
 */
public final class TimeOrderedIds {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private TimeOrderedIds() {
    }

    public static UUID next(Clock clock) {
        return fromMillis(clock.millis());
    }

    static UUID fromMillis(long epochMillis) {
        long randA = SECURE_RANDOM.nextInt(1 << 12);
        long randB = SECURE_RANDOM.nextLong();

        long mostSigBits = ((epochMillis & 0xFFFFFFFFFFFFL) << 16)
                | (0x7L << 12)
                | randA;
        long leastSigBits = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(mostSigBits, leastSigBits);
    }
}
