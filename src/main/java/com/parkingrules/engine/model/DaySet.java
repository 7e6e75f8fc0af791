package com.parkingrules.engine.model;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical set of weekdays a schedule is active on. "Daily" is the full week.
 *
 * @param days the active weekdays, never empty
 */
public record DaySet(Set<DayOfWeek> days) {

    private static final DaySet DAILY = new DaySet(EnumSet.allOf(DayOfWeek.class));

    public DaySet {
        if (days == null || days.isEmpty()) {
            throw new IllegalArgumentException("Day set cannot be empty");
        }
        days = Collections.unmodifiableSet(EnumSet.copyOf(days));
    }

    public static DaySet daily() {
        return DAILY;
    }

    public static DaySet of(DayOfWeek first, DayOfWeek... rest) {
        return new DaySet(EnumSet.of(first, rest));
    }

    public static DaySet of(Collection<DayOfWeek> days) {
        return new DaySet(EnumSet.copyOf(days));
    }

    /**
     * Inclusive weekday range; wraps past Sunday (e.g. FRIDAY..MONDAY).
     */
    public static DaySet range(DayOfWeek from, DayOfWeek to) {
        EnumSet<DayOfWeek> result = EnumSet.noneOf(DayOfWeek.class);
        DayOfWeek day = from;
        while (true) {
            result.add(day);
            if (day == to) {
                break;
            }
            day = day.plus(1);
        }
        return new DaySet(result);
    }

    public boolean isDaily() {
        return days.size() == DayOfWeek.values().length;
    }

    public boolean contains(DayOfWeek day) {
        return days.contains(day);
    }

    @Override
    public String toString() {
        if (isDaily()) {
            return "Daily";
        }
        return days.stream()
            .map(d -> d.name().charAt(0) + d.name().substring(1, 3).toLowerCase())
            .collect(Collectors.joining(","));
    }
}
