package com.bbthechange.mobilelogin.model;

import com.bbthechange.mobilelogin.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

/**
 * Ownership of a referral code. Keyed by the code so that a conditional put is the single
 * authority on which user holds it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ReferralCodeClaim {
    private String referralCode;
    private String mobileNumber;
    private Instant claimedAt;

    @DynamoDbPartitionKey
    public String getReferralCode() {
        return referralCode;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getClaimedAt() {
        return claimedAt;
    }
}
