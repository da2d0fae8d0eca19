package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when a bearer credential could not be signed.
 */
public class CredentialIssueException extends RuntimeException {
    public CredentialIssueException(String message, Throwable cause) {
        super(message, cause);
    }
}
