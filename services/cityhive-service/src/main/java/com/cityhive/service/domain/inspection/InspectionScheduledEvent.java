package com.cityhive.service.domain.inspection;

import java.time.LocalDate;

/**
 * Published after an inspection has been stored.
 */
public record InspectionScheduledEvent(long inspectionId, long hiveId, LocalDate scheduledFor) {
}
