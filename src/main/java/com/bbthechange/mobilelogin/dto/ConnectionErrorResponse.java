package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Payload of {@code connection_error}, sent for any rejected request that is not a system failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionErrorResponse {

    @JsonProperty("status")
    @Builder.Default
    private String status = "error";

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("field")
    private String field;

    @JsonProperty("message")
    private String message;

    @JsonProperty("details")
    private Map<String, Object> details;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("socket_id")
    private String socketId;
}
