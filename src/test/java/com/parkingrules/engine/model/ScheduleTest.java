package com.parkingrules.engine.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleTest {

    // 2024-01-02 is a Tuesday
    private static final LocalDateTime TUESDAY_10AM = LocalDateTime.of(2024, 1, 2, 10, 0);

    @Test
    void shouldFindNextStartOfWindow() {
        Schedule sweeping = Schedule.of(DaySet.of(DayOfWeek.THURSDAY), TimeWindow.of(360, 480));

        assertThat(sweeping.nextStart(TUESDAY_10AM, 7)).contains(LocalDateTime.of(2024, 1, 4, 6, 0));
    }

    @Test
    void shouldHaveNoNextStartWhenScheduleNeverLifts() {
        assertThat(Schedule.always().nextStart(TUESDAY_10AM, 7)).isEmpty();
    }

    @Test
    void shouldTreatBackToBackDaysAsOneOccurrence() {
        Schedule weekdays = Schedule.of(DaySet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), null);

        // Wednesday to Friday midnights continue Tuesday's block; Monday 2024-01-08 starts a new one
        assertThat(weekdays.nextStart(TUESDAY_10AM, 7)).contains(LocalDateTime.of(2024, 1, 8, 0, 0));
    }

    @Test
    void shouldStillStartOvernightWindowEachEvening() {
        Schedule overnight = Schedule.of(DaySet.daily(), TimeWindow.of(1320, 360));

        assertThat(overnight.nextStart(TUESDAY_10AM, 7)).contains(LocalDateTime.of(2024, 1, 2, 22, 0));
    }
}
