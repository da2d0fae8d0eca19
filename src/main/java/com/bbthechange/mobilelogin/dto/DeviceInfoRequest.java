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
 * Payload of the {@code device:info} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceInfoRequest {

    @JsonProperty("device_id")
    @NotNull(message = "device_id is required and must be a string")
    @NotBlank(message = "device_id cannot be empty")
    @Size(min = 3, max = 50, message = "device_id must be between 3 and 50 characters")
    @Pattern(regexp = RequestPatterns.DEVICE_ID, message = "device_id may only contain letters, digits, '_' and '-'")
    private String deviceId;

    @JsonProperty("device_type")
    @NotNull(message = "device_type is required and must be a string")
    @NotBlank(message = "device_type cannot be empty")
    @Size(max = 50, message = "device_type must be at most 50 characters")
    private String deviceType;

    @JsonProperty("app_version")
    @Size(max = 30, message = "app_version must be at most 30 characters")
    private String appVersion;

    @JsonProperty("os_version")
    @Size(max = 30, message = "os_version must be at most 30 characters")
    private String osVersion;

    @JsonProperty("timestamp")
    @NotNull(message = "timestamp is required and must be a string")
    @NotBlank(message = "timestamp cannot be empty")
    @Pattern(regexp = RequestPatterns.ISO_TIMESTAMP, message = "timestamp must be in ISO format (e.g., 2024-01-15T10:30:00Z)")
    private String timestamp;
}
