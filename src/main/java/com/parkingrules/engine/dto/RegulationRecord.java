package com.parkingrules.engine.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Raw regulation line. Day and hour fields arrive as free text in whatever spelling the
 * survey used; the normalizer turns them into a schedule.
 *
 * @param id            record id
 * @param geometry      WKT line (or multi-line) in lon/lat
 * @param regulation    regulation type text, e.g. {@code Time limited}, {@code No parking any time}
 * @param description   free-text details
 * @param days          day text, e.g. {@code M-F}, {@code Mon, Wed}, {@code Daily}
 * @param hours         combined hour text, e.g. {@code 800-1800}; used when from/to are absent
 * @param fromTime      window start, e.g. {@code 8am}
 * @param toTime        window end, e.g. {@code 6pm}
 * @param hourLimit     stated limit, e.g. {@code 2}, {@code 90 min}
 * @param permitZone    residential permit zone code
 * @param exceptions    exception text
 * @param neighborhood  neighborhood the regulation was surveyed in
 * @param district      district the regulation was surveyed in
 * @param streetName    street of a building-level address, if any
 * @param addressNumber house number of a building-level address, if any
 */
public record RegulationRecord(
    @NotBlank(message = "Regulation id cannot be blank")
    String id,

    @NotBlank(message = "Regulation geometry is required")
    String geometry,

    String regulation,
    String description,
    String days,
    String hours,
    String fromTime,
    String toTime,
    String hourLimit,
    String permitZone,
    String exceptions,
    String neighborhood,
    String district,
    String streetName,
    Integer addressNumber
) {
}
