package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.bbthechange.mobilelogin.exception.InvalidTokenException;
import com.bbthechange.mobilelogin.model.CredentialClaims;
import com.bbthechange.mobilelogin.model.IssuedCredential;
import com.bbthechange.mobilelogin.testutil.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;

import static com.bbthechange.mobilelogin.testutil.TestConstants.DEVICE_ID;
import static com.bbthechange.mobilelogin.testutil.TestConstants.FCM_TOKEN;
import static com.bbthechange.mobilelogin.testutil.TestConstants.JWT_SECRET;
import static com.bbthechange.mobilelogin.testutil.TestConstants.MOBILE;
import static com.bbthechange.mobilelogin.testutil.TestConstants.OTHER_MOBILE;
import static com.bbthechange.mobilelogin.testutil.TestConstants.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtService Tests")
class JwtServiceTest {

    private static final String USER_ID = "01890a5d-ac96-774b-bcce-b302099a8057";

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        jwtService = newService(JWT_SECRET);
    }

    private JwtService newService(String secret) {
        JwtService service = new JwtService(new LoginProperties(), clock);
        ReflectionTestUtils.setField(service, "secretKey", secret);
        service.init();
        return service;
    }

    @Nested
    @DisplayName("mint and verify")
    class MintTests {

        @Test
        @DisplayName("Minted credential carries the identity claims")
        void mintedCredential_RoundTripsClaims() {
            IssuedCredential credential = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            CredentialClaims claims = jwtService.verify(credential.token());

            assertThat(claims.userId()).isEqualTo(USER_ID);
            assertThat(claims.userNumber()).isEqualTo(7L);
            assertThat(claims.mobileNo()).isEqualTo(MOBILE);
            assertThat(claims.deviceId()).isEqualTo(DEVICE_ID);
            assertThat(claims.fcmToken()).isEqualTo(FCM_TOKEN);
            assertThat(claims.tokenId()).isEqualTo(credential.tokenId());
            assertThat(claims.issuedAt()).isEqualTo(START);
            assertThat(claims.expiresAt()).isEqualTo(START.plus(Duration.ofDays(7)));
            assertThat(credential.expiresAt()).isEqualTo(claims.expiresAt());
        }

        @Test
        @DisplayName("Each credential gets its own id")
        void mint_AssignsDistinctTokenIds() {
            IssuedCredential first = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);
            IssuedCredential second = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            assertThat(first.tokenId()).isNotEqualTo(second.tokenId());
        }

        @Test
        void verify_AfterLifetime_ThrowsExpired() {
            IssuedCredential credential = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);
            clock.advance(Duration.ofDays(7).plusMinutes(1));

            assertThatThrownBy(() -> jwtService.verify(credential.token()))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("expired");
        }

        @Test
        void verify_WithTokenFromOtherSecret_Throws() {
            JwtService other = newService("another_secret_that_is_long_enough_0123456789");
            IssuedCredential forged = other.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            assertThatThrownBy(() -> jwtService.verify(forged.token()))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        void verify_WithGarbage_Throws() {
            assertThatThrownBy(() -> jwtService.verify("not.a.jwt"))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        void verify_WithoutIdentityClaims_Throws() {
            String bare = Jwts.builder()
                .subject(USER_ID)
                .issuedAt(Date.from(START))
                .expiration(Date.from(START.plusSeconds(3600)))
                .signWith(Keys.hmacShaKeyFor(JWT_SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

            assertThatThrownBy(() -> jwtService.verify(bare))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("missing required claims");
        }
    }

    @Nested
    @DisplayName("device binding")
    class DeviceBindingTests {

        @Test
        void verifyWithDeviceBinding_SameDeviceAndNumber_Passes() {
            IssuedCredential credential = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            assertThat(jwtService.verifyWithDeviceBinding(credential.token(), DEVICE_ID, MOBILE).userId())
                .isEqualTo(USER_ID);
        }

        @Test
        void verifyWithDeviceBinding_OtherDevice_Throws() {
            IssuedCredential credential = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            assertThatThrownBy(() -> jwtService.verifyWithDeviceBinding(credential.token(), "other-device", MOBILE))
                .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        void verifyWithDeviceBinding_OtherNumber_Throws() {
            IssuedCredential credential = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);

            assertThatThrownBy(() -> jwtService.verifyWithDeviceBinding(credential.token(), DEVICE_ID, OTHER_MOBILE))
                .isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    @DisplayName("refresh")
    class RefreshTests {

        @Test
        void refresh_IssuesNewCredentialWithLaterExpiry() {
            IssuedCredential original = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);
            clock.advance(Duration.ofHours(1));

            IssuedCredential refreshed = jwtService.refresh(original.token());

            assertThat(refreshed.tokenId()).isNotEqualTo(original.tokenId());
            assertThat(refreshed.expiresAt()).isAfter(original.expiresAt());
            CredentialClaims claims = jwtService.verify(refreshed.token());
            assertThat(claims.userNumber()).isEqualTo(7L);
            assertThat(claims.deviceId()).isEqualTo(DEVICE_ID);
        }

        @Test
        void refresh_WithExpiredCredential_Throws() {
            IssuedCredential original = jwtService.mint(USER_ID, 7L, MOBILE, DEVICE_ID, FCM_TOKEN);
            clock.advance(Duration.ofDays(8));

            assertThatThrownBy(() -> jwtService.refresh(original.token()))
                .isInstanceOf(InvalidTokenException.class);
        }
    }

    @Test
    @DisplayName("Secrets shorter than 32 characters are rejected at startup")
    void init_WithShortSecret_Throws() {
        assertThatThrownBy(() -> newService("too-short"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 32 characters");
    }

    @Test
    void getCredentialLifetimeSeconds_IsSevenDaysByDefault() {
        assertThat(jwtService.getCredentialLifetimeSeconds()).isEqualTo(604_800L);
    }
}
