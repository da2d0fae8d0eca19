package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.config.LoginProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory throttle on OTP issuance per mobile number. Independent of the per-session
 * verification ceiling, which lives in the attempt log.
 */
@Service
public class RateLimitingService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingService.class);

    private final Cache<String, AtomicInteger> loginPerHourCache;
    private final LoginProperties properties;
    private final MeterRegistry meterRegistry;

    public RateLimitingService(LoginProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.loginPerHourCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(10000)
                .build();
    }

    /**
     * Count a login request for the number and report whether it is within the hourly limit.
     */
    public boolean isLoginAllowed(String mobileNumber) {
        AtomicInteger hourlyCount = loginPerHourCache.get("login_" + mobileNumber, k -> new AtomicInteger());
        if (hourlyCount.incrementAndGet() > properties.getIssueLimitPerHour()) {
            logger.warn("Rate limit exceeded for login ({}/hour limit): {}",
                    properties.getIssueLimitPerHour(), mobileNumber);
            meterRegistry.counter("login.rate_limited").increment();
            return false;
        }
        return true;
    }
}
