package com.cityhive.service.infrastructure.notification;

import com.cityhive.service.domain.inspection.InspectionScheduledEvent;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Arranges a reminder the day before each scheduled inspection.
 *
 * <p>No delivery channel exists yet, so the reminder is only logged. Inspections scheduled for
 * today get a same-day reminder.
 */
@Component
public class InspectionReminderListener {

    private static final Logger log = LoggerFactory.getLogger(InspectionReminderListener.class);

    private final Clock clock;

    public InspectionReminderListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    public void onInspectionScheduled(InspectionScheduledEvent event) {
        LocalDate remindOn = reminderDate(event.scheduledFor());
        log.info("Inspection reminder scheduled: inspectionId={}, hiveId={}, remindOn={}",
                event.inspectionId(), event.hiveId(), remindOn);
    }

    LocalDate reminderDate(LocalDate scheduledFor) {
        LocalDate dayBefore = scheduledFor.minusDays(1);
        LocalDate today = LocalDate.now(clock);
        return dayBefore.isBefore(today) ? today : dayBefore;
    }
}
