package com.parkingrules.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkingrules.engine.config.ParkingProperties;
import com.parkingrules.engine.entity.StreetSegmentEntity;
import com.parkingrules.engine.model.AddressRange;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.repository.StreetSegmentRepository;
import com.parkingrules.engine.store.SegmentSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a published snapshot to PostgreSQL/PostGIS.
 *
 * Flow:
 * 1. Delete every existing segment row
 * 2. Insert one row per segment side of the new snapshot
 * 3. Commit as one transaction, so the table never holds two runs at once
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotPersistenceService {

    private final StreetSegmentRepository segmentRepository;
    private final ObjectMapper objectMapper;
    private final ParkingProperties properties;

    /**
     * @return number of rows written, 0 when persistence is disabled
     */
    @Transactional
    public int persist(SegmentSnapshot snapshot) {
        if (!properties.getPersistence().isEnabled()) {
            log.debug("Persistence disabled, snapshot kept in memory only");
            return 0;
        }

        long startTime = System.currentTimeMillis();
        List<StreetSegmentEntity> entities = new ArrayList<>(snapshot.size());
        for (StreetSegment segment : snapshot.segments()) {
            entities.add(toEntity(segment, snapshot));
        }

        segmentRepository.deleteAllInBatch();
        segmentRepository.saveAll(entities);

        log.info("Persisted {} segments in {}ms", entities.size(), System.currentTimeMillis() - startTime);
        return entities.size();
    }

    StreetSegmentEntity toEntity(StreetSegment segment, SegmentSnapshot snapshot) {
        AddressRange range = segment.addressRange();
        return StreetSegmentEntity.builder()
            .centerlineId(segment.centerlineId())
            .side(segment.side().code())
            .streetName(segment.streetName())
            .fromStreet(segment.fromStreet())
            .toStreet(segment.toStreet())
            .fromAddress(range != null ? range.fromAddress() : null)
            .toAddress(range != null ? range.toAddress() : null)
            .cardinalDirection(segment.cardinalDirection())
            .centerline(segment.centerline())
            .curbGeometry(segment.curbGeometry())
            .rules(toJson(segment.rules(), segment))
            .meters(toJson(segment.meters(), segment))
            .ruleCount(segment.rules().size())
            .snapshotBuiltAt(snapshot.builtAt())
            .build();
    }

    private String toJson(Object value, StreetSegment segment) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rules of " + segment.key(), e);
        }
    }
}
