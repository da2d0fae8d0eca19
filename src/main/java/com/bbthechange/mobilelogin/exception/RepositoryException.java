package com.bbthechange.mobilelogin.exception;

/**
 * Thrown when a DynamoDB operation fails. Wraps the driver exception so callers
 * never see store-specific types; surfaced to clients as a generic system error.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
