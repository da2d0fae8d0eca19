package com.bbthechange.mobilelogin.socket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire frame in both directions: {@code {"event": "...", "data": {...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SocketEnvelope(String event, JsonNode data) {
}
