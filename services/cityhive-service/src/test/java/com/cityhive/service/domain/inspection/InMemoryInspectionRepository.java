package com.cityhive.service.domain.inspection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** In-memory {@link InspectionRepository}. */
public class InMemoryInspectionRepository implements InspectionRepository {

    private final Map<Long, Inspection> inspections = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final List<Inspection> saved = new ArrayList<>();
    private volatile RuntimeException saveFailure;

    public void failSavesWith(RuntimeException e) {
        this.saveFailure = e;
    }

    public List<Inspection> saved() {
        return List.copyOf(saved);
    }

    @Override
    public Optional<Inspection> findById(long id) {
        return Optional.ofNullable(inspections.get(id));
    }

    @Override
    public List<Inspection> findByHiveId(long hiveId) {
        return inspections.values().stream()
                .filter(i -> i.hiveId() == hiveId)
                .sorted(Comparator.comparing(Inspection::scheduledFor))
                .toList();
    }

    @Override
    public Inspection save(Inspection inspection) {
        if (saveFailure != null) {
            throw saveFailure;
        }
        Inspection stored = inspection.withId(ids.incrementAndGet());
        inspections.put(stored.id(), stored);
        saved.add(stored);
        return stored;
    }
}
