package com.cityhive.service.domain.creation;

/**
 * Raised by repository adapters when a write breaks a uniqueness or foreign-key constraint.
 */
public class IntegrityViolationException extends PersistenceException {

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
