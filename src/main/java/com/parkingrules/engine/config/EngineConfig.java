package com.parkingrules.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkingrules.engine.geometry.CurbOffsetGenerator;
import com.parkingrules.engine.ingest.DatasetSource;
import com.parkingrules.engine.ingest.IngestionService;
import com.parkingrules.engine.ingest.JsonDatasetSource;
import com.parkingrules.engine.matching.AddressRangeMatcher;
import com.parkingrules.engine.matching.BoundaryConflictResolver;
import com.parkingrules.engine.matching.JoinSettings;
import com.parkingrules.engine.matching.SideDeterminer;
import com.parkingrules.engine.matching.SpatialJoinEngine;
import com.parkingrules.engine.normalize.RecordNormalizer;
import com.parkingrules.engine.rules.LegalityRuleEngine;
import com.parkingrules.engine.rules.RuleEngineSettings;
import com.parkingrules.engine.rules.VisitorAllowanceParser;
import com.parkingrules.engine.store.SnapshotRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the framework-free engine classes as beans.
 *
 * The engine packages carry no Spring annotations so their tests build them with plain
 * constructors; this is the only place they meet the container.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock parkingClock(ParkingProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }

    @Bean
    public JoinSettings joinSettings(ParkingProperties properties) {
        ParkingProperties.Join join = properties.getJoin();
        return new JoinSettings(join.getSearchRadiusMeters(), join.getClearThresholdMeters(),
            join.getBoundaryThresholdMeters());
    }

    @Bean
    public SpatialJoinEngine spatialJoinEngine(JoinSettings joinSettings) {
        return new SpatialJoinEngine(joinSettings, new AddressRangeMatcher(), new BoundaryConflictResolver());
    }

    @Bean
    public IngestionService ingestionService(ParkingProperties properties, SpatialJoinEngine spatialJoinEngine,
                                             Clock parkingClock) {
        ParkingProperties.Join join = properties.getJoin();
        return new IngestionService(
            new RecordNormalizer(),
            new SideDeterminer(join.getTangentDeltaMeters()),
            spatialJoinEngine,
            new CurbOffsetGenerator(join.getCurbOffsetMeters()),
            properties.getIngestion().getParallelism(),
            parkingClock);
    }

    @Bean
    public DatasetSource datasetSource(ParkingProperties properties, ObjectMapper objectMapper) {
        return new JsonDatasetSource(Path.of(properties.getIngestion().getDatasetDir()), objectMapper);
    }

    @Bean
    public LegalityRuleEngine legalityRuleEngine(ParkingProperties properties) {
        ParkingProperties.Rules rules = properties.getRules();
        return new LegalityRuleEngine(
            new RuleEngineSettings(rules.getDefaultVisitorAllowanceMinutes(), rules.getDefaultTimeLimitMinutes(),
                rules.getLookaheadDays()),
            new VisitorAllowanceParser());
    }

    @Bean
    public SnapshotRegistry snapshotRegistry() {
        return new SnapshotRegistry();
    }
}
