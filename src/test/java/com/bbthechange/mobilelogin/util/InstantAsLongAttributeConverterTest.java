package com.bbthechange.mobilelogin.util;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstantAsLongAttributeConverterTest {

    private final InstantAsLongAttributeConverter converter = new InstantAsLongAttributeConverter();

    @Test
    void transformFrom_writesEpochMillis() {
        Instant instant = Instant.parse("2024-01-15T10:30:00.250Z");

        assertThat(converter.transformFrom(instant).n()).isEqualTo(String.valueOf(instant.toEpochMilli()));
    }

    @Test
    void nullsRoundTripAsDynamoNull() {
        AttributeValue value = converter.transformFrom(null);

        assertThat(value.nul()).isTrue();
        assertThat(converter.transformTo(value)).isNull();
    }

    @Test
    void transformTo_rejectsNonNumbers() {
        assertThatThrownBy(() -> converter.transformTo(AttributeValue.builder().s("yesterday").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
