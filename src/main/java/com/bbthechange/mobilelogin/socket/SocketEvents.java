package com.bbthechange.mobilelogin.socket;

/**
 * Event names used on the socket.
 */
public final class SocketEvents {

    public static final String CONNECT_RESPONSE = "connect_response";
    public static final String DEVICE_INFO = "device:info";
    public static final String DEVICE_INFO_ACK = "device:info:ack";
    public static final String LOGIN = "login";
    public static final String LOGIN_SUCCESS = "login:success";
    public static final String VERIFY_OTP = "verify:otp";
    public static final String OTP_VERIFIED = "otp:verified";
    public static final String OTP_VERIFICATION_FAILED = "otp:verification_failed";
    public static final String SET_PROFILE = "set:profile";
    public static final String PROFILE_SET = "profile:set";
    public static final String SET_LANGUAGE = "set:language";
    public static final String LANGUAGE_SET = "language:set";
    public static final String TOKEN_REFRESH = "token:refresh";
    public static final String TOKEN_REFRESHED = "token:refreshed";
    public static final String HEALTH_CHECK = "health_check";
    public static final String HEALTH_CHECK_ACK = "health_check:ack";
    public static final String CONNECTION_ERROR = "connection_error";
    public static final String SYSTEM_ERROR = "system_error";

    private SocketEvents() {
    }
}
