package com.cityhive.service.domain.inspection;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for inspections. Adapters throw
 * {@link com.cityhive.service.domain.creation.IntegrityViolationException} when a save breaks the
 * hive foreign key and {@link com.cityhive.service.domain.creation.PersistenceException} for
 * other store failures.
 */
public interface InspectionRepository {

    Optional<Inspection> findById(long id);

    /** Inspections of a hive, earliest scheduled date first. */
    List<Inspection> findByHiveId(long hiveId);

    /** Inserts the inspection and returns it with its assigned ID. */
    Inspection save(Inspection inspection);
}
