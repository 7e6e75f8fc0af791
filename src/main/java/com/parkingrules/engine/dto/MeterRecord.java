package com.parkingrules.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Raw meter schedule for a centerline.
 *
 * @param centerlineId centerline the meters stand on
 * @param side         {@code L} / {@code R}, or blank for both sides
 * @param ratePerHour  dollars per hour
 * @param days         day text
 * @param fromTime     start of paid hours
 * @param toTime       end of paid hours
 */
public record MeterRecord(
    @NotBlank(message = "Meter centerline id cannot be blank")
    String centerlineId,

    String side,

    @NotNull(message = "Meter rate is required")
    @PositiveOrZero(message = "Meter rate must be >= 0")
    BigDecimal ratePerHour,

    String days,
    String fromTime,
    String toTime
) {
}
