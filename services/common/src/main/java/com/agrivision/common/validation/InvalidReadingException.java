package com.agrivision.common.validation;

/**
 * Thrown when a reading payload fails validation. Always maps to a client error.
 */
public class InvalidReadingException extends RuntimeException {

    private final ValidationFailure failure;

    public InvalidReadingException(ValidationFailure failure) {
        super(failure.getMessage());
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
