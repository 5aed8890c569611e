package com.cityhive.service.domain.inspection;

import java.time.LocalDate;

/**
 * Inspection creation request after sanitizing.
 *
 * @param hiveId       hive to inspect
 * @param scheduledFor requested date
 * @param notes        trimmed notes, null when empty
 */
public record InspectionCreationInput(long hiveId, LocalDate scheduledFor, String notes) {
}
