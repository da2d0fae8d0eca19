package com.bbthechange.mobilelogin.service;

import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client-facing message table for a language and optional region, backed by
 * {@code messages*.properties}. Unknown languages fall back to English.
 */
@Service
public class LocalizationService {

    static final List<String> MESSAGE_KEYS = List.of(
            "welcome",
            "login_success",
            "otp_sent",
            "otp_verified",
            "otp_invalid",
            "otp_expired",
            "profile_updated",
            "language_updated",
            "logout");

    private final MessageSource messageSource;

    public LocalizationService(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public Map<String, String> messagesFor(String languageCode, String regionCode) {
        Locale locale = regionCode == null ? new Locale(languageCode) : new Locale(languageCode, regionCode);
        Map<String, String> messages = new LinkedHashMap<>();
        for (String key : MESSAGE_KEYS) {
            messages.put(key, messageSource.getMessage("client." + key, null, locale));
        }
        return messages;
    }
}
