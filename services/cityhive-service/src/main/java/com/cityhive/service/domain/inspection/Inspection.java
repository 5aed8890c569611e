package com.cityhive.service.domain.inspection;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A scheduled inspection of a hive.
 *
 * @param id           store-assigned identifier, null before the first save
 * @param hiveId       inspected hive
 * @param scheduledFor calendar date of the inspection
 * @param notes        optional notes
 * @param createdAt    creation time
 */
public record Inspection(Long id, long hiveId, LocalDate scheduledFor, String notes, Instant createdAt) {

    public Inspection withId(long newId) {
        return new Inspection(newId, hiveId, scheduledFor, notes, createdAt);
    }
}
