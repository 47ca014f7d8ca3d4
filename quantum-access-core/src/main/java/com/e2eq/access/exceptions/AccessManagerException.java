package com.e2eq.access.exceptions;

/**
 * Base type for all errors raised by the access manager engine.
 */
public class AccessManagerException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public AccessManagerException(String message) {
        super(message);
    }

    public AccessManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
