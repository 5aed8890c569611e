package com.cityhive.service.domain.user;

import java.util.Optional;

/**
 * Persistence port for users. Adapters throw
 * {@link com.cityhive.service.domain.creation.IntegrityViolationException} when a save breaks the
 * email or API key uniqueness constraint and
 * {@link com.cityhive.service.domain.creation.PersistenceException} for other store failures.
 */
public interface UserRepository {

    Optional<User> findById(long id);

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /** Inserts the user and returns it with its assigned ID. */
    User save(User user);
}
