package com.parkingrules.engine.model;

/**
 * Half-open time-of-day window {@code [startMinute, endMinute)} in minutes after midnight.
 *
 * An end at or before the start runs past midnight into the following day; equal ends
 * cover a full 24 hours.
 */
public record TimeWindow(int startMinute, int endMinute) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    public TimeWindow {
        if (startMinute < 0 || startMinute >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Window start out of range: " + startMinute);
        }
        if (endMinute < 0 || endMinute > MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Window end out of range: " + endMinute);
        }
    }

    public static TimeWindow of(int startMinute, int endMinute) {
        return new TimeWindow(startMinute, endMinute);
    }

    public boolean crossesMidnight() {
        return endMinute <= startMinute;
    }

    /**
     * Length of one occurrence in minutes.
     */
    public int lengthMinutes() {
        if (crossesMidnight()) {
            return MINUTES_PER_DAY - startMinute + endMinute;
        }
        return endMinute - startMinute;
    }

    @Override
    public String toString() {
        return format(startMinute) + "-" + format(endMinute);
    }

    private static String format(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }
}
