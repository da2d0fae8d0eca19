package com.bbthechange.mobilelogin.model;

import java.time.Instant;

/**
 * A freshly signed bearer credential.
 *
 * @param token compact JWS
 * @param tokenId the {@code jti} claim
 * @param expiresAt the {@code exp} claim
 */
public record IssuedCredential(String token, String tokenId, Instant expiresAt) {
}
