package com.cityhive.service.domain.hive;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for hives. Adapters throw
 * {@link com.cityhive.service.domain.creation.IntegrityViolationException} when a save breaks the
 * owner foreign key and {@link com.cityhive.service.domain.creation.PersistenceException} for
 * other store failures.
 */
public interface HiveRepository {

    Optional<Hive> findById(long id);

    /** Hives of a user, newest installation first. */
    List<Hive> findByUserId(long userId);

    /** Inserts the hive and returns it with its assigned ID. */
    Hive save(Hive hive);
}
