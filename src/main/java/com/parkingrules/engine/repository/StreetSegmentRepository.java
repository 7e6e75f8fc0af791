package com.parkingrules.engine.repository;

import com.parkingrules.engine.entity.StreetSegmentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the persisted segment read model.
 *
 * Writes happen only through {@code SnapshotPersistenceService}, which replaces the whole
 * table per ingestion run.
 */
@Repository
public interface StreetSegmentRepository extends JpaRepository<StreetSegmentEntity, Long> {
}
