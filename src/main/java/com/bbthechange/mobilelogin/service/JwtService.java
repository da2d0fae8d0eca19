package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.bbthechange.mobilelogin.exception.CredentialIssueException;
import com.bbthechange.mobilelogin.exception.InvalidTokenException;
import com.bbthechange.mobilelogin.model.CredentialClaims;
import com.bbthechange.mobilelogin.model.IssuedCredential;
import com.bbthechange.mobilelogin.util.TimeOrderedIds;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Mints and checks the HS256 bearer credential handed out after a verified login.
 */
@Service
public class JwtService {

    private static final Logger logger = LoggerFactory.getLogger(JwtService.class);

    static final String USER_NUMBER = "user_number";
    static final String MOBILE_NO = "mobile_no";
    static final String DEVICE_ID = "device_id";
    static final String FCM_TOKEN = "fcm_token";

    /**
     * Signing secret from {@code jwt.secret}. The default only exists so local runs and builds
     * start without extra setup; deployed environments always override it.
     */
    @Value("${jwt.secret:default_secret_for_local_development_only_12345}")
    private String secretKey;

    private final LoginProperties properties;
    private final Clock clock;

    private SecretKey key;

    public JwtService(LoginProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (secretKey == null || secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was "
                    + (secretKey == null ? 0 : secretKey.length()) + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public IssuedCredential mint(String userId, long userNumber, String mobileNo, String deviceId, String fcmToken) {
        Instant issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant expiresAt = issuedAt.plus(properties.getCredentialLifetime());
        String tokenId = TimeOrderedIds.next(clock).toString();

        try {
            String token = Jwts.builder()
                    .subject(userId)
                    .claim(USER_NUMBER, userNumber)
                    .claim(MOBILE_NO, mobileNo)
                    .claim(DEVICE_ID, deviceId)
                    .claim(FCM_TOKEN, fcmToken)
                    .id(tokenId)
                    .issuedAt(Date.from(issuedAt))
                    .expiration(Date.from(expiresAt))
                    .signWith(key, SignatureAlgorithm.HS256)
                    .compact();
            logger.debug("Issued credential {} for user {}", tokenId, userId);
            return new IssuedCredential(token, tokenId, expiresAt);
        } catch (JwtException | IllegalArgumentException e) {
            throw new CredentialIssueException("Failed to sign credential for user " + userId, e);
        }
    }

    /**
     * Check signature and expiry.
     *
     * @throws InvalidTokenException if the token is malformed, tampered with or expired
     */
    public CredentialClaims verify(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Credential has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Credential is not valid", e);
        }
        return toCredentialClaims(claims);
    }

    /**
     * {@link #verify(String)} plus a check that the credential was issued to this device and number.
     */
    public CredentialClaims verifyWithDeviceBinding(String token, String deviceId, String mobileNo) {
        CredentialClaims claims = verify(token);
        if (!claims.deviceId().equals(deviceId) || !claims.mobileNo().equals(mobileNo)) {
            throw new InvalidTokenException("Credential was not issued to this device");
        }
        return claims;
    }

    /**
     * Re-issue a still valid credential with a new id and expiry and the same identity claims.
     */
    public IssuedCredential refresh(String token) {
        CredentialClaims claims = verify(token);
        return mint(claims.userId(), claims.userNumber(), claims.mobileNo(), claims.deviceId(), claims.fcmToken());
    }

    public long getCredentialLifetimeSeconds() {
        return properties.getCredentialLifetime().getSeconds();
    }

    private CredentialClaims toCredentialClaims(Claims claims) {
        Object userNumber = claims.get(USER_NUMBER);
        if (claims.getSubject() == null || !(userNumber instanceof Number)
                || claims.get(MOBILE_NO) == null || claims.get(DEVICE_ID) == null) {
            throw new InvalidTokenException("Credential is missing required claims");
        }
        return new CredentialClaims(
                claims.getSubject(),
                ((Number) userNumber).longValue(),
                claims.get(MOBILE_NO, String.class),
                claims.get(DEVICE_ID, String.class),
                claims.get(FCM_TOKEN, String.class),
                claims.getId(),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant());
    }
}
