package com.bbthechange.mobilelogin.socket;

import com.bbthechange.mobilelogin.dto.ConnectionErrorResponse;
import com.bbthechange.mobilelogin.dto.SystemErrorResponse;
import com.bbthechange.mobilelogin.exception.LoginThrottledException;
import com.bbthechange.mobilelogin.exception.ReferralCodeExhaustedException;
import com.bbthechange.mobilelogin.exception.ReferralCodeTakenException;
import com.bbthechange.mobilelogin.exception.UnauthorizedException;
import com.bbthechange.mobilelogin.exception.ValidationException;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.service.AuditService;
import com.bbthechange.mobilelogin.validation.ValidationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Maps exceptions raised while handling an event to the error event the client receives.
 * Client mistakes become {@code connection_error}; everything else is a {@code system_error}
 * that carries no internal detail.
 */
@Component
public class SocketExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(SocketExceptionHandler.class);

    static final String UNKNOWN_EVENT = "UNKNOWN_EVENT";
    static final String UNAUTHORIZED = "UNAUTHORIZED";
    static final String AUTH_ERROR = "AUTH_ERROR";
    static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    static final String RATE_LIMIT_ERROR = "RATE_LIMIT_ERROR";
    static final String REFERRAL_CODE_TAKEN = "REFERRAL_CODE_TAKEN";
    static final String CONFLICT_ERROR = "CONFLICT_ERROR";
    static final String SYSTEM_ERROR = "SYSTEM_ERROR";
    static final String REFERRAL_CODE_GENERATION_FAILED = "REFERRAL_CODE_GENERATION_FAILED";

    private final AuditService auditService;
    private final Clock clock;

    public SocketExceptionHandler(AuditService auditService, Clock clock) {
        this.auditService = auditService;
        this.clock = clock;
    }

    public void handle(SocketConnection connection, String eventName, Throwable error) {
        if (error instanceof ValidationException) {
            ValidationFailure failure = ((ValidationException) error).getFailure();
            logger.info("Rejected {} from socket {}: {} on {}", eventName, connection.getSocketId(),
                    failure.code(), failure.field());
            sendConnectionError(connection, eventName, failure.code(), failure.errorType(), failure.field(),
                    failure.message(), failure.details());

        } else if (error instanceof UnauthorizedException) {
            logger.info("Unauthorized {} from socket {}: {}", eventName, connection.getSocketId(), error.getMessage());
            sendConnectionError(connection, eventName, UNAUTHORIZED, AUTH_ERROR, "jwt_token",
                    error.getMessage(), Map.of());

        } else if (error instanceof LoginThrottledException) {
            sendConnectionError(connection, eventName, RATE_LIMIT_EXCEEDED, RATE_LIMIT_ERROR, "mobile_no",
                    "Too many login requests. Please try again later.", Map.of());

        } else if (error instanceof ReferralCodeTakenException) {
            ReferralCodeTakenException taken = (ReferralCodeTakenException) error;
            sendConnectionError(connection, eventName, REFERRAL_CODE_TAKEN, CONFLICT_ERROR, "referral_code",
                    "referral_code is already in use", Map.of("referral_code", taken.getReferralCode()));

        } else if (error instanceof ReferralCodeExhaustedException) {
            logger.error("Referral code generation failed for {} on socket {}", eventName, connection.getSocketId(), error);
            sendSystemError(connection, REFERRAL_CODE_GENERATION_FAILED,
                    "Could not generate a referral code. Please try again.");

        } else {
            logger.error("Unexpected error handling {} on socket {}", eventName, connection.getSocketId(), error);
            sendSystemError(connection, SYSTEM_ERROR, "An unexpected error occurred. Please try again later.");
        }
    }

    /**
     * Reject an event name this server does not handle.
     */
    public void unknownEvent(SocketConnection connection, String eventName) {
        sendConnectionError(connection, eventName, UNKNOWN_EVENT, ValidationFailure.VALUE_ERROR, "event",
                "Unknown event: " + eventName, Map.of("event", String.valueOf(eventName)));
    }

    private void sendConnectionError(SocketConnection connection, String eventName, String code, String type,
                                     String field, String message, Map<String, Object> details) {
        connection.send(SocketEvents.CONNECTION_ERROR, ConnectionErrorResponse.builder()
                .errorCode(code)
                .errorType(type)
                .field(field)
                .message(message)
                .details(details)
                .timestamp(clock.instant().toString())
                .socketId(connection.getSocketId())
                .build());
        auditService.record(AuditEventKind.CONNECTION_ERROR, connection.getSocketId(), String.valueOf(eventName),
                null, code, Map.of("error_type", type, "field", field));
    }

    private void sendSystemError(SocketConnection connection, String code, String message) {
        connection.send(SocketEvents.SYSTEM_ERROR, SystemErrorResponse.builder()
                .errorCode(code)
                .message(message)
                .timestamp(clock.instant().toString())
                .build());
    }
}
