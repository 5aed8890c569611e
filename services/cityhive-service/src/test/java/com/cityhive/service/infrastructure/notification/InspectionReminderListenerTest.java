package com.cityhive.service.infrastructure.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.cityhive.service.domain.inspection.InspectionScheduledEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InspectionReminderListener")
class InspectionReminderListenerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 7);

    private final InspectionReminderListener listener =
            new InspectionReminderListener(Clock.fixed(Instant.parse("2025-06-07T09:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("reminds the day before the inspection")
    void dayBefore() {
        assertThat(listener.reminderDate(TODAY.plusDays(10))).isEqualTo(TODAY.plusDays(9));
        assertThat(listener.reminderDate(TODAY.plusDays(1))).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("reminds the same day for an inspection due today")
    void sameDay() {
        assertThat(listener.reminderDate(TODAY)).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("handles a scheduled event")
    void handlesEvent() {
        assertThatCode(() -> listener.onInspectionScheduled(new InspectionScheduledEvent(1L, 2L, TODAY.plusDays(3))))
                .doesNotThrowAnyException();
    }
}
