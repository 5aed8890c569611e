package com.cityhive.service.domain.creation;

/**
 * Raised by repository adapters when the store cannot complete an operation.
 * Carries no store-specific detail in its message.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
