package com.bbthechange.mobilelogin.dto;

/**
 * Regular expressions shared by the inbound request contracts.
 */
final class RequestPatterns {

    static final String DIGITS = "^[0-9]*$";
    static final String DEVICE_ID = "^[A-Za-z0-9_-]*$";
    static final String ALPHANUMERIC = "^[A-Za-z0-9]*$";
    static final String CONTAINS_LETTER = "^.*\\p{L}.*$";
    static final String LANGUAGE_CODE = "^[a-z]{2}$";
    static final String REGION_CODE = "^[A-Z]{2}$";
    static final String ISO_TIMESTAMP = "^\\d{4}-\\d{2}-\\d{2}T[^Z]*Z$";

    private RequestPatterns() {
    }
}
