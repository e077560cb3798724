package com.paycollect.domain.exception;

/**
 * Database access or transaction failure. The message is safe to return to
 * callers; the underlying cause is only logged.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
