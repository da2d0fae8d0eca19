package com.bbthechange.mobilelogin.socket;

import com.bbthechange.mobilelogin.dto.DeviceInfoAck;
import com.bbthechange.mobilelogin.dto.DeviceInfoRequest;
import com.bbthechange.mobilelogin.dto.HealthCheckAck;
import com.bbthechange.mobilelogin.dto.LanguageSetResponse;
import com.bbthechange.mobilelogin.dto.LoginRequest;
import com.bbthechange.mobilelogin.dto.LoginSuccessResponse;
import com.bbthechange.mobilelogin.dto.OtpVerificationFailedResponse;
import com.bbthechange.mobilelogin.dto.ProfileSetResponse;
import com.bbthechange.mobilelogin.dto.RefreshTokenRequest;
import com.bbthechange.mobilelogin.dto.SetLanguageRequest;
import com.bbthechange.mobilelogin.dto.SetProfileRequest;
import com.bbthechange.mobilelogin.dto.VerifyOtpRequest;
import com.bbthechange.mobilelogin.exception.ValidationException;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.service.AuditService;
import com.bbthechange.mobilelogin.service.LoginService;
import com.bbthechange.mobilelogin.service.ProfileService;
import com.bbthechange.mobilelogin.service.VerificationResult;
import com.bbthechange.mobilelogin.service.VerifyOtpOutcome;
import com.bbthechange.mobilelogin.validation.RequestValidator;
import com.bbthechange.mobilelogin.validation.ValidationFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes one inbound frame to its flow and sends the response event.
 * <p>
 * Every exception thrown while handling a frame stops here and becomes an error event for
 * that client alone; it never reaches the socket container or other connections.
 */
@Component
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final RequestValidator requestValidator;
    private final LoginService loginService;
    private final ProfileService profileService;
    private final AuditService auditService;
    private final SocketExceptionHandler exceptionHandler;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventDispatcher(RequestValidator requestValidator,
                           LoginService loginService,
                           ProfileService profileService,
                           AuditService auditService,
                           SocketExceptionHandler exceptionHandler,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.requestValidator = requestValidator;
        this.loginService = loginService;
        this.profileService = profileService;
        this.auditService = auditService;
        this.exceptionHandler = exceptionHandler;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void dispatch(SocketConnection connection, String frame) {
        String eventName = null;
        try {
            SocketEnvelope envelope = parse(frame);
            eventName = envelope.event();
            logger.debug("Socket {} sent {}", connection.getSocketId(), eventName);
            route(connection, envelope);
        } catch (Exception e) {
            exceptionHandler.handle(connection, eventName == null ? "unknown" : eventName, e);
        }
    }

    private void route(SocketConnection connection, SocketEnvelope envelope) {
        String event = envelope.event();
        if (event == null) {
            exceptionHandler.unknownEvent(connection, null);
            return;
        }
        switch (event) {
            case SocketEvents.DEVICE_INFO -> handleDeviceInfo(connection, envelope);
            case SocketEvents.LOGIN -> handleLogin(connection, envelope);
            case SocketEvents.VERIFY_OTP -> handleVerifyOtp(connection, envelope);
            case SocketEvents.SET_PROFILE -> handleSetProfile(connection, envelope);
            case SocketEvents.SET_LANGUAGE -> handleSetLanguage(connection, envelope);
            case SocketEvents.TOKEN_REFRESH -> handleTokenRefresh(connection, envelope);
            case SocketEvents.HEALTH_CHECK -> connection.send(SocketEvents.HEALTH_CHECK_ACK, HealthCheckAck.builder()
                    .status("healthy")
                    .timestamp(now())
                    .socketId(connection.getSocketId())
                    .build());
            default -> exceptionHandler.unknownEvent(connection, event);
        }
    }

    private void handleDeviceInfo(SocketConnection connection, SocketEnvelope envelope) {
        DeviceInfoRequest request = requestValidator.validate(SocketEvents.DEVICE_INFO, envelope.data(),
                DeviceInfoRequest.class);
        Map<String, String> attributes = new HashMap<>();
        attributes.put("device_id", request.getDeviceId());
        attributes.put("device_type", request.getDeviceType());
        putIfPresent(attributes, "app_version", request.getAppVersion());
        putIfPresent(attributes, "os_version", request.getOsVersion());
        auditService.record(AuditEventKind.DEVICE_INFO, connection.getSocketId(), SocketEvents.DEVICE_INFO,
                null, "success", attributes);

        connection.send(SocketEvents.DEVICE_INFO_ACK, DeviceInfoAck.builder()
                .status("success")
                .message("Device info received and validated")
                .timestamp(now())
                .socketId(connection.getSocketId())
                .build());
    }

    private void handleLogin(SocketConnection connection, SocketEnvelope envelope) {
        LoginRequest request = requestValidator.validate(SocketEvents.LOGIN, envelope.data(), LoginRequest.class);
        LoginSuccessResponse response = loginService.login(request);
        auditService.record(AuditEventKind.LOGIN, connection.getSocketId(), SocketEvents.LOGIN,
                request.getMobileNo(), "success",
                Map.of("device_id", request.getDeviceId(), "is_new_user", String.valueOf(response.isNewUser())));
        connection.send(SocketEvents.LOGIN_SUCCESS, response);
    }

    private void handleVerifyOtp(SocketConnection connection, SocketEnvelope envelope) {
        VerifyOtpRequest request = requestValidator.validate(SocketEvents.VERIFY_OTP, envelope.data(),
                VerifyOtpRequest.class);
        VerifyOtpOutcome outcome = loginService.verifyOtp(request);
        VerificationResult result = outcome.result();
        auditService.record(AuditEventKind.OTP_VERIFICATION, connection.getSocketId(), SocketEvents.VERIFY_OTP,
                request.getMobileNo(), result.getStatus().name(),
                Map.of("attempts_remaining", String.valueOf(result.getAttemptsRemaining())));

        if (outcome.isVerified()) {
            connection.send(SocketEvents.OTP_VERIFIED, outcome.response());
            return;
        }
        connection.send(SocketEvents.OTP_VERIFICATION_FAILED, OtpVerificationFailedResponse.builder()
                .errorCode(result.getStatus().getErrorCode())
                .message(result.getMessage())
                .attemptsRemaining(result.getAttemptsRemaining())
                .mobileNo(request.getMobileNo())
                .sessionToken(request.getSessionToken())
                .build());
    }

    private void handleSetProfile(SocketConnection connection, SocketEnvelope envelope) {
        SetProfileRequest request = requestValidator.validate(SocketEvents.SET_PROFILE, envelope.data(),
                SetProfileRequest.class);
        ProfileSetResponse response = profileService.setProfile(request);
        auditService.record(AuditEventKind.PROFILE, connection.getSocketId(), SocketEvents.SET_PROFILE,
                request.getMobileNo(), "success", Map.of("user_id", response.getUserId()));
        connection.send(SocketEvents.PROFILE_SET, response);
    }

    private void handleSetLanguage(SocketConnection connection, SocketEnvelope envelope) {
        SetLanguageRequest request = requestValidator.validate(SocketEvents.SET_LANGUAGE, envelope.data(),
                SetLanguageRequest.class);
        LanguageSetResponse response = profileService.setLanguage(request);
        auditService.record(AuditEventKind.LANGUAGE, connection.getSocketId(), SocketEvents.SET_LANGUAGE,
                request.getMobileNo(), "success", Map.of("language_code", response.getLanguageCode()));
        connection.send(SocketEvents.LANGUAGE_SET, response);
    }

    private void handleTokenRefresh(SocketConnection connection, SocketEnvelope envelope) {
        RefreshTokenRequest request = requestValidator.validate(SocketEvents.TOKEN_REFRESH, envelope.data(),
                RefreshTokenRequest.class);
        connection.send(SocketEvents.TOKEN_REFRESHED, loginService.refresh(request));
    }

    private SocketEnvelope parse(String frame) {
        SocketEnvelope envelope = null;
        try {
            envelope = objectMapper.readValue(frame, SocketEnvelope.class);
        } catch (JsonProcessingException e) {
            logger.debug("Unreadable frame: {}", e.getOriginalMessage());
        }
        if (envelope == null) {
            throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_FORMAT,
                    ValidationFailure.FORMAT_ERROR, "root", "Message must be a JSON object with event and data",
                    Map.of()));
        }
        return envelope;
    }

    private String now() {
        return clock.instant().toString();
    }

    private static void putIfPresent(Map<String, String> attributes, String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
    }
}
