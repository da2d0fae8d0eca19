package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when a bearer credential cannot be trusted:
 * - The JWT is malformed or its signature is invalid
 * - The token has expired
 * - Its device or mobile number binding does not match the caller
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
