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

/**
 * Payload of the {@code verify:otp} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerifyOtpRequest {

    @JsonProperty("mobile_no")
    @NotNull(message = "mobile_no is required and must be a string")
    @NotBlank(message = "mobile_no cannot be empty")
    @Size(min = 10, max = 15, message = "mobile_no must be between 10 and 15 digits")
    @Pattern(regexp = RequestPatterns.DIGITS, message = "mobile_no must contain only digits")
    private String mobileNo;

    @JsonProperty("otp")
    @NotNull(message = "otp is required and must be a string")
    @NotBlank(message = "otp cannot be empty")
    @Size(min = 6, max = 6, message = "otp must be exactly 6 digits")
    @Pattern(regexp = RequestPatterns.DIGITS, message = "otp must contain only digits")
    private String otp;

    @JsonProperty("session_token")
    @NotNull(message = "session_token is required and must be a string")
    @NotBlank(message = "session_token cannot be empty")
    private String sessionToken;

    @JsonProperty("timestamp")
    @Pattern(regexp = RequestPatterns.ISO_TIMESTAMP, message = "timestamp must be in ISO format (e.g., 2024-01-15T10:30:00Z)")
    private String timestamp;
}
