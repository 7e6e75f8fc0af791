package com.parkingrules.engine.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Paid-parking window for a centerline.
 *
 * @param centerlineId centerline the meters stand on
 * @param side         side of the meters, or {@code null} when they cover both sides
 * @param ratePerHour  hourly rate in dollars
 * @param schedule     when payment is required
 */
public record MeterSchedule(String centerlineId, StreetSide side, BigDecimal ratePerHour, Schedule schedule) {

    public MeterSchedule {
        if (centerlineId == null || centerlineId.isBlank()) {
            throw new IllegalArgumentException("Meter centerline id cannot be blank");
        }
        Objects.requireNonNull(ratePerHour, "ratePerHour");
        if (ratePerHour.signum() < 0) {
            throw new IllegalArgumentException("Meter rate cannot be negative: " + ratePerHour);
        }
        if (schedule == null) {
            schedule = Schedule.always();
        }
    }

    public boolean coversBothSides() {
        return side == null;
    }
}
