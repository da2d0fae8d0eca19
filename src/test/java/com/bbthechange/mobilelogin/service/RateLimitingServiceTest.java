package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bbthechange.mobilelogin.testutil.TestConstants.MOBILE;
import static com.bbthechange.mobilelogin.testutil.TestConstants.OTHER_MOBILE;
import static org.assertj.core.api.Assertions.assertThat;

class RateLimitingServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private RateLimitingService rateLimitingService;

    @BeforeEach
    void setUp() {
        LoginProperties properties = new LoginProperties();
        properties.setIssueLimitPerHour(3);
        meterRegistry = new SimpleMeterRegistry();
        rateLimitingService = new RateLimitingService(properties, meterRegistry);
    }

    @Test
    void isLoginAllowed_UpToLimit_ThenBlocked() {
        assertThat(rateLimitingService.isLoginAllowed(MOBILE)).isTrue();
        assertThat(rateLimitingService.isLoginAllowed(MOBILE)).isTrue();
        assertThat(rateLimitingService.isLoginAllowed(MOBILE)).isTrue();

        assertThat(rateLimitingService.isLoginAllowed(MOBILE)).isFalse();
        assertThat(meterRegistry.counter("login.rate_limited").count()).isEqualTo(1.0);
    }

    @Test
    void isLoginAllowed_CountsEachNumberSeparately() {
        for (int i = 0; i < 3; i++) {
            rateLimitingService.isLoginAllowed(MOBILE);
        }

        assertThat(rateLimitingService.isLoginAllowed(MOBILE)).isFalse();
        assertThat(rateLimitingService.isLoginAllowed(OTHER_MOBILE)).isTrue();
    }
}
