package com.parkingrules.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical activity schedule produced by the normalization stage.
 *
 * Join and evaluation code only ever see this shape, never raw day or hour strings.
 *
 * @param days         active weekdays
 * @param window       active time of day, or {@code null} for all day
 * @param weeksOfMonth weeks (1-5) of the month the schedule runs in, empty for every week
 */
public record Schedule(DaySet days, TimeWindow window, Set<Integer> weeksOfMonth) {

    private static final Schedule ALWAYS = new Schedule(DaySet.daily(), null, Set.of());

    public Schedule {
        if (days == null) {
            days = DaySet.daily();
        }
        if (weeksOfMonth == null) {
            weeksOfMonth = Set.of();
        }
        for (Integer week : weeksOfMonth) {
            if (week == null || week < 1 || week > 5) {
                throw new IllegalArgumentException("Week of month must be in 1..5: " + week);
            }
        }
        weeksOfMonth = Collections.unmodifiableSet(new TreeSet<>(weeksOfMonth));
    }

    /**
     * Every day, all day.
     */
    public static Schedule always() {
        return ALWAYS;
    }

    public static Schedule of(DaySet days, TimeWindow window) {
        return new Schedule(days, window, Set.of());
    }

    @JsonIgnore
    public boolean isAllDay() {
        return window == null;
    }

    /**
     * True when an occurrence starts on {@code date}.
     */
    public boolean activeOn(LocalDate date) {
        if (!days.contains(date.getDayOfWeek())) {
            return false;
        }
        return weeksOfMonth.isEmpty() || weeksOfMonth.contains(weekOfMonth(date));
    }

    /**
     * True when any occurrence intersects the stay {@code [from, to)}.
     * A zero-length stay checks the single instant {@code from}.
     */
    public boolean overlaps(LocalDateTime from, LocalDateTime to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Stay ends before it starts");
        }
        // an occurrence that started the previous day may still be running
        LocalDate date = from.toLocalDate().minusDays(1);
        LocalDate last = to.toLocalDate();
        while (!date.isAfter(last)) {
            if (activeOn(date)) {
                LocalDateTime start = occurrenceStart(date);
                LocalDateTime end = occurrenceEnd(date);
                boolean hit = from.equals(to)
                    ? !start.isAfter(from) && from.isBefore(end)
                    : start.isBefore(to) && from.isBefore(end);
                if (hit) {
                    return true;
                }
            }
            date = date.plusDays(1);
        }
        return false;
    }

    /**
     * Earliest occurrence starting at or after {@code notBefore}, looking ahead at most
     * {@code lookaheadDays} days. An occurrence that begins exactly where the previous one
     * ends is a continuation, not a new start; a schedule that never lifts has none.
     */
    public Optional<LocalDateTime> nextStart(LocalDateTime notBefore, int lookaheadDays) {
        LocalDate date = notBefore.toLocalDate();
        LocalDate last = date.plusDays(lookaheadDays);
        while (!date.isAfter(last)) {
            if (activeOn(date)) {
                LocalDateTime start = occurrenceStart(date);
                if (!start.isBefore(notBefore) && !continuesPrevious(start)) {
                    return Optional.of(start);
                }
            }
            date = date.plusDays(1);
        }
        return Optional.empty();
    }

    private boolean continuesPrevious(LocalDateTime start) {
        return overlaps(start.minusMinutes(1), start);
    }

    private LocalDateTime occurrenceStart(LocalDate date) {
        return window == null
            ? date.atStartOfDay()
            : date.atStartOfDay().plusMinutes(window.startMinute());
    }

    private LocalDateTime occurrenceEnd(LocalDate date) {
        if (window == null) {
            return date.plusDays(1).atStartOfDay();
        }
        return occurrenceStart(date).plusMinutes(window.lengthMinutes());
    }

    static int weekOfMonth(LocalDate date) {
        return (date.getDayOfMonth() - 1) / 7 + 1;
    }

    @Override
    public String toString() {
        String base = days + " " + (window == null ? "all day" : window.toString());
        return weeksOfMonth.isEmpty() ? base : base + " weeks " + weeksOfMonth;
    }
}
