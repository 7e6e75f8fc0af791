package com.parkingrules.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.locationtech.jts.geom.LineString;

import java.time.Instant;

/**
 * Persisted copy of one segment side from the published snapshot.
 *
 * Design Rationale:
 * - The table is a read model for the surrounding CRUD layer; the engine itself serves
 *   from the in-memory snapshot
 * - Every ingestion replaces the whole table, rows are never patched
 * - Geometry columns use PostGIS with SRID 4326 (x = longitude, y = latitude)
 * - Rules and meters are stored as JSON documents
 */
@Entity
@Table(name = "street_segments",
    uniqueConstraints = @UniqueConstraint(name = "uk_segment_side", columnNames = {"centerline_id", "side"}),
    indexes = @Index(name = "idx_segment_street", columnList = "street_name"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StreetSegmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "centerline_id", nullable = false, length = 64)
    private String centerlineId;

    /**
     * "L" or "R"
     */
    @Column(nullable = false, length = 1)
    private String side;

    @Column(name = "street_name", length = 255)
    private String streetName;

    @Column(name = "from_street", length = 255)
    private String fromStreet;

    @Column(name = "to_street", length = 255)
    private String toStreet;

    @Column(name = "from_address")
    private Integer fromAddress;

    @Column(name = "to_address")
    private Integer toAddress;

    @Column(name = "cardinal_direction", length = 32)
    private String cardinalDirection;

    @Column(name = "centerline", columnDefinition = "geometry(LineString,4326)", nullable = false)
    private LineString centerline;

    @Column(name = "curb_geometry", columnDefinition = "geometry(LineString,4326)")
    private LineString curbGeometry;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rules", columnDefinition = "jsonb")
    private String rules;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meters", columnDefinition = "jsonb")
    private String meters;

    @Column(name = "rule_count", nullable = false)
    private int ruleCount;

    /**
     * When the snapshot this row belongs to was built
     */
    @Column(name = "snapshot_built_at", nullable = false)
    private Instant snapshotBuiltAt;
}
