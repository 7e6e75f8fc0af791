package com.parkingrules.engine.geometry;

/**
 * Raised for malformed or degenerate input geometry: fewer than two vertices, zero length,
 * or an empty geometry where a line is required. Aborts the one record being processed.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }
}
