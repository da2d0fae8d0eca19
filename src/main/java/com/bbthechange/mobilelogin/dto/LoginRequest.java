package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the {@code login} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoginRequest {

    @JsonProperty("mobile_no")
    @NotNull(message = "mobile_no is required and must be a string")
    @NotBlank(message = "mobile_no cannot be empty")
    @Size(min = 10, max = 15, message = "mobile_no must be between 10 and 15 digits")
    @Pattern(regexp = RequestPatterns.DIGITS, message = "mobile_no must contain only digits")
    private String mobileNo;

    @JsonProperty("device_id")
    @NotNull(message = "device_id is required and must be a string")
    @NotBlank(message = "device_id cannot be empty")
    @Size(min = 3, max = 50, message = "device_id must be between 3 and 50 characters")
    @Pattern(regexp = RequestPatterns.DEVICE_ID, message = "device_id may only contain letters, digits, '_' and '-'")
    private String deviceId;

    @JsonProperty("fcm_token")
    @NotNull(message = "fcm_token is required and must be a string")
    @NotBlank(message = "fcm_token cannot be empty")
    @Size(min = 100, max = 500, message = "fcm_token must be between 100 and 500 characters")
    private String fcmToken;

    @JsonProperty("email")
    @Email(message = "email must be a valid email address")
    private String email;

    @JsonProperty("timestamp")
    @Pattern(regexp = RequestPatterns.ISO_TIMESTAMP, message = "timestamp must be in ISO format (e.g., 2024-01-15T10:30:00Z)")
    private String timestamp;
}
