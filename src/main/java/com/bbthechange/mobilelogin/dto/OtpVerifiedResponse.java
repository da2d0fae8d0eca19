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
public class OtpVerifiedResponse {

    @JsonProperty("mobile_no")
    private String mobileNo;

    @JsonProperty("session_token")
    private String sessionToken;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user_number")
    private long userNumber;

    @JsonProperty("user_status")
    private String userStatus;

    @JsonProperty("jwt_token")
    private String jwtToken;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("expires_in")
    private long expiresIn;
}
