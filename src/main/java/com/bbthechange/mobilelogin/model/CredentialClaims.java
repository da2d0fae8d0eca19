package com.bbthechange.mobilelogin.model;

import java.time.Instant;

/**
 * Claims carried by a verified bearer credential.
 */
public record CredentialClaims(String userId, long userNumber, String mobileNo, String deviceId,
                               String fcmToken, String tokenId, Instant issuedAt, Instant expiresAt) {
}
