package com.paycollect.domain.exception;

/**
 * Request input rejected before any store access.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
