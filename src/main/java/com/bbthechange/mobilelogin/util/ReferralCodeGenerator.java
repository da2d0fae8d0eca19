package com.bbthechange.mobilelogin.util;

import java.security.SecureRandom;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Generates short uppercase alphanumeric referral codes.
 */
public class ReferralCodeGenerator {

    private static final String CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom random = new SecureRandom();

    private ReferralCodeGenerator() {
    }

    /**
     * Generate a random code of the given length, e.g. "K7Q2ZD".
     */
    public static String generate(int length) {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(CHARACTERS.charAt(random.nextInt(CHARACTERS.length())));
        }
        return code.toString();
    }

    /**
     * Generate codes until {@code isTaken} accepts one as free or the attempt budget runs out.
     *
     * @param length code length
     * @param maxAttempts number of candidates to try before giving up
     * @param isTaken returns true if a candidate is already in use
     * @return the first free code, or empty if every candidate was taken
     */
    public static Optional<String> generateUnique(int length, int maxAttempts, Predicate<String> isTaken) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String code = generate(length);
            if (!isTaken.test(code)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    public static boolean isWellFormed(String code, int minLength, int maxLength) {
        if (code == null || code.length() < minLength || code.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            boolean alphanumeric = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            if (!alphanumeric) {
                return false;
            }
        }
        return true;
    }
}
