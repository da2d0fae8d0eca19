package com.bbthechange.mobilelogin.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TimeOrderedIdsTest {

    @Test
    void next_producesVersion7WithRfcVariant() {
        UUID id = TimeOrderedIds.next(Clock.systemUTC());

        assertThat(id.version()).isEqualTo(7);
        assertThat(id.variant()).isEqualTo(2);
    }

    @Test
    void next_embedsClockMillisInLeadingBits() {
        Instant at = Instant.parse("2024-01-15T10:30:00.123Z");
        UUID id = TimeOrderedIds.next(Clock.fixed(at, ZoneOffset.UTC));

        assertThat(id.getMostSignificantBits() >>> 16).isEqualTo(at.toEpochMilli());
    }

    @Test
    void idsFromLaterMillisecondsSortAfterEarlierOnes() {
        UUID earlier = TimeOrderedIds.fromMillis(1_700_000_000_000L);
        UUID later = TimeOrderedIds.fromMillis(1_700_000_000_001L);

        assertThat(later.toString()).isGreaterThan(earlier.toString());
    }
}
