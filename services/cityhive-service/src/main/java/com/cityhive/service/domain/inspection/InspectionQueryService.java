package com.cityhive.service.domain.inspection;

import java.util.List;
import java.util.Optional;

/** Read-side lookups for inspections. */
public class InspectionQueryService {

    private final InspectionRepository inspections;

    public InspectionQueryService(InspectionRepository inspections) {
        this.inspections = inspections;
    }

    public Optional<Inspection> findById(long id) {
        return inspections.findById(id);
    }

    public List<Inspection> findByHiveId(long hiveId) {
        return inspections.findByHiveId(hiveId);
    }
}
