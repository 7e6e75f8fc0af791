package com.parkingrules.engine.dto;

import java.util.List;

/**
 * Raw street-cleaning schedule, already keyed to a centerline side by the source.
 *
 * @param centerlineId centerline id
 * @param side         {@code L} or {@code R}
 * @param weekday      day text, e.g. {@code Tues}
 * @param fromHour     start, e.g. {@code 9} or {@code 0900}
 * @param toHour       end
 * @param weeksOfMonth weeks the schedule runs, 1..5; empty for every week
 * @param limits       block limits, e.g. {@code York St - Bryant St}
 * @param blockside    side label, e.g. {@code North} or {@code NE}
 */
public record SweepingRecord(
    String centerlineId,
    String side,
    String weekday,
    String fromHour,
    String toHour,
    List<Integer> weeksOfMonth,
    String limits,
    String blockside
) {
}
