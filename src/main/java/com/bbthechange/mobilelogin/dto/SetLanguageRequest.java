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
 * Payload of the {@code set:language} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SetLanguageRequest {

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

    @JsonProperty("language_code")
    @NotNull(message = "language_code is required and must be a string")
    @NotBlank(message = "language_code cannot be empty")
    @Size(min = 2, max = 2, message = "language_code must be exactly 2 characters")
    @Pattern(regexp = RequestPatterns.LANGUAGE_CODE, message = "language_code must be lowercase letters (ISO 639-1)")
    private String languageCode;

    @JsonProperty("language_name")
    @NotNull(message = "language_name is required and must be a string")
    @NotBlank(message = "language_name cannot be empty")
    @Size(min = 2, max = 50, message = "language_name must be between 2 and 50 characters")
    private String languageName;

    @JsonProperty("region_code")
    @Size(min = 2, max = 2, message = "region_code must be exactly 2 characters")
    @Pattern(regexp = RequestPatterns.REGION_CODE, message = "region_code must be uppercase letters (ISO 3166-1)")
    private String regionCode;

    @JsonProperty("timezone")
    @Size(min = 3, max = 50, message = "timezone must be between 3 and 50 characters")
    private String timezone;

    @JsonProperty("user_preferences")
    private Map<String, Object> userPreferences;

    @JsonProperty("timestamp")
    @Pattern(regexp = RequestPatterns.ISO_TIMESTAMP, message = "timestamp must be in ISO format (e.g., 2024-01-15T10:30:00Z)")
    private String timestamp;
}
