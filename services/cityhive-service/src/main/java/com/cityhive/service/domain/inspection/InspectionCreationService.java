package com.cityhive.service.domain.inspection;

import com.cityhive.observability.MetricFactory;
import com.cityhive.service.domain.creation.CreationErrorKind;
import com.cityhive.service.domain.creation.CreationResult;
import com.cityhive.service.domain.creation.CreationWorkflow;
import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.domain.hive.HiveRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Schedules inspections.
 *
 * <p>The date must fall between today and {@code maxDaysAhead} days from today, both inclusive.
 * "Today" is the calendar date of the injected {@link Clock}. After a successful save an
 * {@link InspectionScheduledEvent} is published so reminders can be arranged.
 */
public class InspectionCreationService extends CreationWorkflow<InspectionCreationInput, Inspection> {

    private static final Logger log = LoggerFactory.getLogger(InspectionCreationService.class);

    public static final int DEFAULT_MAX_DAYS_AHEAD = 365;
    public static final String HIVE_NOT_FOUND = "Hive not found";
    public static final String DATE_REQUIRED = "Scheduled date is required";
    public static final String DATE_IN_PAST = "Scheduled date cannot be in the past";
    public static final String TOO_FAR_AHEAD = "Inspection cannot be scheduled more than 1 year in advance";
    public static final String CONFLICT = "Inspection creation failed due to data conflict";

    private final HiveRepository hives;
    private final InspectionRepository inspections;
    private final Clock clock;
    private final int maxDaysAhead;
    private final ApplicationEventPublisher events;

    public InspectionCreationService(
            HiveRepository hives,
            InspectionRepository inspections,
            Clock clock,
            int maxDaysAhead,
            ApplicationEventPublisher events,
            MetricFactory metrics) {
        super(EntityType.INSPECTION, metrics);
        if (maxDaysAhead < 0) {
            throw new IllegalArgumentException("maxDaysAhead must not be negative");
        }
        this.hives = hives;
        this.inspections = inspections;
        this.clock = clock;
        this.maxDaysAhead = maxDaysAhead;
        this.events = events;
    }

    @Override
    protected CreationResult<Inspection> attempt(InspectionCreationInput input) {
        if (hives.findById(input.hiveId()).isEmpty()) {
            log.warn("Inspection creation failed - hive not found: hiveId={}", input.hiveId());
            return CreationResult.failure(CreationErrorKind.NOT_FOUND, HIVE_NOT_FOUND);
        }

        if (input.scheduledFor() == null) {
            return invalid(DATE_REQUIRED);
        }
        LocalDate today = LocalDate.now(clock);
        if (input.scheduledFor().isBefore(today)) {
            return invalid(DATE_IN_PAST);
        }
        long daysAhead = ChronoUnit.DAYS.between(today, input.scheduledFor());
        if (daysAhead > maxDaysAhead) {
            return invalid(maxDaysAhead == DEFAULT_MAX_DAYS_AHEAD
                    ? TOO_FAR_AHEAD
                    : "Inspection cannot be scheduled more than " + maxDaysAhead + " days in advance");
        }

        Inspection inspection = new Inspection(
                null, input.hiveId(), input.scheduledFor(), input.notes(), clock.instant());
        CreationResult<Inspection> result = persist(inspection, inspections::save);
        if (result.success()) {
            Inspection saved = result.entity();
            log.info("Inspection scheduled: inspectionId={}, hiveId={}, scheduledFor={}",
                    saved.id(), saved.hiveId(), saved.scheduledFor());
            publishScheduled(saved);
        }
        return result;
    }

    @Override
    protected String conflictMessage() {
        return CONFLICT;
    }

    // The inspection is already stored, so a failing listener must not turn the outcome into an error.
    private void publishScheduled(Inspection saved) {
        try {
            events.publishEvent(new InspectionScheduledEvent(saved.id(), saved.hiveId(), saved.scheduledFor()));
        } catch (RuntimeException e) {
            log.error("Failed to publish scheduled event: inspectionId={}", saved.id(), e);
        }
    }
}
