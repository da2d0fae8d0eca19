package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code login:success}. Carries the OTP in-band; there is no SMS delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginSuccessResponse {

    @JsonProperty("mobile_no")
    private String mobileNo;

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("session_token")
    private String sessionToken;

    @JsonProperty("otp")
    private String otp;

    @JsonProperty("is_new_user")
    private boolean newUser;

    @JsonProperty("expires_at")
    private long expiresAt;
}
