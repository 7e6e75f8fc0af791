package com.parkingrules.engine.controller;

import com.parkingrules.engine.dto.SegmentLegalityRecord;
import com.parkingrules.engine.dto.SegmentView;
import com.parkingrules.engine.dto.SnapshotStatsRecord;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.service.IngestionJob;
import com.parkingrules.engine.service.ParkingLegalityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST surface over the published segment snapshot.
 *
 * This controller provides endpoints to:
 * 1. Inspect a segment side and its merged rules
 * 2. Ask whether parking is legal for a stay
 * 3. Check every segment near a GPS point
 * 4. Inspect and refresh the snapshot
 *
 * Times are local wall-clock times in the configured zone (parking.zone-id).
 */
@RestController
@RequestMapping("/api/parking")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Parking Rules", description = "Street-parking regulation lookup and legality checks")
public class ParkingLegalityController {

    private static final int MAX_DURATION_MINUTES = 7 * 24 * 60;
    private static final double MAX_RADIUS_METERS = 500.0;

    private final ParkingLegalityService legalityService;
    private final IngestionJob ingestionJob;

    /**
     * Example:
     * GET /api/parking/segments/CNN-1001/L
     */
    @Operation(
            summary = "Get a segment side",
            description = "Returns the segment side with its geometry (WKT) and merged rules."
    )
    @GetMapping("/segments/{centerlineId}/{side}")
    public ResponseEntity<?> getSegment(
        @Parameter(description = "Centerline identifier", example = "CNN-1001") @PathVariable String centerlineId,
        @Parameter(description = "Side code, L or R", example = "L") @PathVariable String side
    ) {
        StreetSide streetSide;
        try {
            streetSide = StreetSide.fromCode(side);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        return legalityService.findSegment(centerlineId, streetSide)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Example:
     * GET /api/parking/segments/CNN-1001/L/legality?at=2024-01-02T10:00:00&duration=60
     */
    @Operation(
            summary = "Check parking legality on a segment side",
            description = "Evaluates every rule of the segment side against a stay starting at 'at' " +
                    "(local time, defaults to now) and lasting 'duration' minutes."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Legality evaluated",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "Street cleaning",
                                    value = "{\"centerlineId\":\"CNN-1001\",\"side\":\"L\",\"status\":\"illegal\",\"explanation\":\"Street cleaning Tue 09:00-11:00\"}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Invalid side or duration"),
            @ApiResponse(responseCode = "404", description = "Unknown segment")
    })
    @GetMapping("/segments/{centerlineId}/{side}/legality")
    public ResponseEntity<?> checkLegality(
        @PathVariable String centerlineId,
        @PathVariable String side,
        @Parameter(description = "Local start of the stay", example = "2024-01-02T10:00:00")
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at,
        @Parameter(description = "Stay length in minutes", example = "60")
        @RequestParam(defaultValue = "60") int duration
    ) {
        if (!isValidDuration(duration)) {
            return badRequest("duration must be between 0 and " + MAX_DURATION_MINUTES + " minutes");
        }
        StreetSide streetSide;
        try {
            streetSide = StreetSide.fromCode(side);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        return legalityService.evaluate(centerlineId, streetSide, at, duration)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Example:
     * GET /api/parking/legality/nearby?lat=37.7800&lon=-122.4150&radius=30&duration=120
     */
    @Operation(
            summary = "Check legality on segments near a point",
            description = "Returns one legality result per segment side within 'radius' meters, nearest first."
    )
    @GetMapping("/legality/nearby")
    public ResponseEntity<?> checkNearby(
        @Parameter(description = "Latitude", example = "37.7800") @RequestParam double lat,
        @Parameter(description = "Longitude", example = "-122.4150") @RequestParam double lon,
        @Parameter(description = "Search radius in meters", example = "30") @RequestParam(defaultValue = "30") double radius,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at,
        @RequestParam(defaultValue = "60") int duration
    ) {
        if (!isValidDuration(duration)) {
            return badRequest("duration must be between 0 and " + MAX_DURATION_MINUTES + " minutes");
        }
        if (!Double.isFinite(lat) || !Double.isFinite(lon)
            || lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            return badRequest("lat/lon out of range");
        }
        if (!Double.isFinite(radius) || radius <= 0 || radius > MAX_RADIUS_METERS) {
            return badRequest("radius must be in (0, " + MAX_RADIUS_METERS + "] meters");
        }

        List<SegmentLegalityRecord> results = legalityService.evaluateNearby(lat, lon, radius, at, duration);
        return ResponseEntity.ok(Map.of(
            "count", results.size(),
            "results", results
        ));
    }

    @Operation(summary = "Get snapshot statistics")
    @GetMapping("/snapshot")
    public ResponseEntity<SnapshotStatsRecord> getSnapshotStats() {
        return ResponseEntity.ok(legalityService.snapshotStats(ingestionJob.lastReport().orElse(null)));
    }

    /**
     * Starts a re-ingestion in the background. The current snapshot keeps serving until the
     * new one is published.
     */
    @Operation(summary = "Refresh the snapshot from the configured datasets")
    @PostMapping("/ingestion/refresh")
    public ResponseEntity<?> refreshSnapshot() {
        log.info("Manual ingestion requested");
        ingestionJob.refreshAsync();
        return ResponseEntity.accepted().body(Map.of(
            "status", "ACCEPTED",
            "message", "Ingestion started"
        ));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        SnapshotStatsRecord stats = legalityService.snapshotStats(null);
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Parking Rules Engine",
            "snapshotPublished", stats.published(),
            "timestamp", Instant.now()
        ));
    }

    private static boolean isValidDuration(int duration) {
        return duration >= 0 && duration <= MAX_DURATION_MINUTES;
    }

    private static ResponseEntity<?> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
            "status", "BAD_REQUEST",
            "message", message
        ));
    }
}
