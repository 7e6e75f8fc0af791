package com.parkingrules.engine.model;

import lombok.Builder;
import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * Normalized regulation awaiting the spatial join. It carries geometry but no side or
 * segment; the join resolves it into zero, one or two attachments.
 */
@Builder
public record Regulation(
    String id,
    Geometry geometry,
    RuleKind kind,
    Schedule schedule,
    Integer durationLimitMinutes,
    String permitZone,
    String description,
    String neighborhood,
    String district,
    String streetName,
    Integer addressNumber,
    String interpretationKey
) {

    public Regulation {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Regulation id cannot be blank");
        }
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean hasAddress() {
        return streetName != null && !streetName.isBlank() && addressNumber != null;
    }

    /**
     * The rule this regulation contributes to every segment it attaches to.
     */
    public Rule toRule(MatchConfidence confidence) {
        return Rule.builder()
            .kind(kind)
            .schedule(schedule)
            .durationLimitMinutes(durationLimitMinutes)
            .permitZone(permitZone)
            .description(description)
            .interpretationKey(interpretationKey)
            .confidence(confidence)
            .sourceId(id)
            .build();
    }
}
