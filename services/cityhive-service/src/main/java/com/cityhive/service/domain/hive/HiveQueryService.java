package com.cityhive.service.domain.hive;

import java.util.List;
import java.util.Optional;

/** Read-side lookups for hives. */
public class HiveQueryService {

    private final HiveRepository hives;

    public HiveQueryService(HiveRepository hives) {
        this.hives = hives;
    }

    public Optional<Hive> findById(long id) {
        return hives.findById(id);
    }

    public List<Hive> findByUserId(long userId) {
        return hives.findByUserId(userId);
    }
}
