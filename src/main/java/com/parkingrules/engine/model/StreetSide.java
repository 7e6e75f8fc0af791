package com.parkingrules.engine.model;

import java.util.Locale;

/**
 * Side of a street centerline, relative to the centerline's digitized direction.
 *
 * Left is the side a traveller following the vertex order sees on their left hand.
 */
public enum StreetSide {
    LEFT("L"),
    RIGHT("R");

    private final String code;

    StreetSide(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public StreetSide opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }

    /**
     * Parses the side codes used by the source datasets ("L", "R", "Left", "RIGHT").
     *
     * @throws IllegalArgumentException for anything else
     */
    public static StreetSide fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side code cannot be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "L", "LEFT" -> LEFT;
            case "R", "RIGHT" -> RIGHT;
            default -> throw new IllegalArgumentException("Unknown side code: " + value);
        };
    }
}
