package com.parkingrules.engine.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Raw street centerline as delivered by the dataset source.
 *
 * @param id               stable centerline id
 * @param streetName       street name, e.g. {@code 20TH ST}
 * @param geometry         WKT {@code LINESTRING} in lon/lat
 * @param leftFromAddress  first address on the left side
 * @param leftToAddress    last address on the left side
 * @param rightFromAddress first address on the right side
 * @param rightToAddress   last address on the right side
 */
public record CenterlineRecord(
    @NotBlank(message = "Centerline id cannot be blank")
    String id,

    String streetName,

    @NotBlank(message = "Centerline geometry is required")
    String geometry,

    Integer leftFromAddress,
    Integer leftToAddress,
    Integer rightFromAddress,
    Integer rightToAddress
) {
}
