package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSetResponse {

    @JsonProperty("mobile_no")
    private String mobileNo;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user_number")
    private long userNumber;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("state")
    private String state;

    @JsonProperty("referral_code")
    private String referralCode;

    @JsonProperty("referred_by")
    private String referredBy;
}
