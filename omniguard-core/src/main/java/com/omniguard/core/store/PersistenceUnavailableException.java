package com.omniguard.core.store;

/**
 * Raised by store adapters when the backing store cannot be reached or refuses the operation.
 * Callers treat it as retryable.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message) {
        super(message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
