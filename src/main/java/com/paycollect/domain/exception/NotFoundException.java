package com.paycollect.domain.exception;

/**
 * Referenced customer does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
