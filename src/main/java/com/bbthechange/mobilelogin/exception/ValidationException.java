package com.bbthechange.mobilelogin.exception;

import com.bbthechange.mobilelogin.validation.ValidationFailure;

/**
 * Thrown when an inbound payload fails the field contract for its event.
 */
public class ValidationException extends RuntimeException {

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
