package com.cityhive.service.domain.creation;

/**
 * Outcome of a creation request: either the persisted entity or an error kind with a
 * caller-safe message. Exactly one arm is populated.
 *
 * @param success   whether the entity was created
 * @param entity    the persisted entity, only on success
 * @param errorKind the failure reason, only on failure
 * @param message   caller-safe failure message, only on failure
 * @param <E>       entity type
 */
public record CreationResult<E>(boolean success, E entity, CreationErrorKind errorKind, String message) {

    public CreationResult {
        if (success) {
            if (entity == null || errorKind != null || message != null) {
                throw new IllegalArgumentException("a successful result carries only the entity");
            }
        } else if (entity != null || errorKind == null || message == null || message.isBlank()) {
            throw new IllegalArgumentException("a failed result carries an error kind and a message, never an entity");
        }
    }

    public static <E> CreationResult<E> success(E entity) {
        return new CreationResult<>(true, entity, null, null);
    }

    public static <E> CreationResult<E> failure(CreationErrorKind errorKind, String message) {
        return new CreationResult<>(false, null, errorKind, message);
    }
}
