package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Payload of the {@code set:profile} event. Requires the bearer credential issued by
 * {@code otp:verified}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SetProfileRequest {

    @JsonProperty("mobile_no")
    @NotNull(message = "mobile_no is required and must be a string")
    @NotBlank(message = "mobile_no cannot be empty")
    @Size(min = 10, max = 15, message = "mobile_no must be between 10 and 15 digits")
    @Pattern(regexp = RequestPatterns.DIGITS, message = "mobile_no must contain only digits")
    private String mobileNo;

    @JsonProperty("session_token")
    @NotNull(message = "session_token is required and must be a string")
    @NotBlank(message = "session_token cannot be empty")
    private String sessionToken;

    @JsonProperty("jwt_token")
    @NotNull(message = "jwt_token is required and must be a string")
    @NotBlank(message = "jwt_token cannot be empty")
    private String jwtToken;

    @JsonProperty("device_id")
    @Size(min = 3, max = 50, message = "device_id must be between 3 and 50 characters")
    @Pattern(regexp = RequestPatterns.DEVICE_ID, message = "device_id may only contain letters, digits, '_' and '-'")
    private String deviceId;

    @JsonProperty("full_name")
    @NotNull(message = "full_name is required and must be a string")
    @NotBlank(message = "full_name cannot be empty")
    @Size(min = 2, max = 100, message = "full_name must be between 2 and 100 characters")
    @Pattern(regexp = RequestPatterns.CONTAINS_LETTER, message = "full_name must contain at least one letter")
    private String fullName;

    @JsonProperty("state")
    @NotNull(message = "state is required and must be a string")
    @NotBlank(message = "state cannot be empty")
    @Size(min = 2, max = 50, message = "state must be between 2 and 50 characters")
    private String state;

    @JsonProperty("referral_code")
    @Size(min = 4, max = 20, message = "referral_code must be between 4 and 20 characters")
    @Pattern(regexp = RequestPatterns.ALPHANUMERIC, message = "referral_code must be alphanumeric")
    private String referralCode;

    @JsonProperty("referred_by")
    @Size(min = 4, max = 20, message = "referred_by must be between 4 and 20 characters")
    @Pattern(regexp = RequestPatterns.ALPHANUMERIC, message = "referred_by must be alphanumeric")
    private String referredBy;

    @JsonProperty("profile_data")
    private Map<String, Object> profileData;

    @JsonProperty("timestamp")
    @Pattern(regexp = RequestPatterns.ISO_TIMESTAMP, message = "timestamp must be in ISO format (e.g., 2024-01-15T10:30:00Z)")
    private String timestamp;
}
