package com.e2eq.access.serialization;

import com.e2eq.access.exceptions.AccessManagerException;

/**
 * Thrown when an access manager cannot be written to, or read from, its JSON form.
 */
public class AccessManagerSerializationException extends AccessManagerException {
    private static final long serialVersionUID = 1L;

    public AccessManagerSerializationException(String message) {
        super(message);
    }

    public AccessManagerSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
