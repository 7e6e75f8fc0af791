package com.parkingrules.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Everything under {@code parking.*} in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "parking")
@Data
public class ParkingProperties {

    /**
     * Local time zone of the city; "now" in the API is taken in this zone.
     */
    private String zoneId = "America/Los_Angeles";

    private Join join = new Join();
    private Rules rules = new Rules();
    private Ingestion ingestion = new Ingestion();
    private Interpretation interpretation = new Interpretation();
    private Persistence persistence = new Persistence();

    @Data
    public static class Join {
        private double searchRadiusMeters = 25.0;
        private double clearThresholdMeters = 6.0;
        private double boundaryThresholdMeters = 15.0;
        private double curbOffsetMeters = 5.0;
        private double tangentDeltaMeters = 0.5;
    }

    @Data
    public static class Rules {
        private int defaultVisitorAllowanceMinutes = 120;
        private int defaultTimeLimitMinutes = 120;
        private int lookaheadDays = 7;
    }

    @Data
    public static class Ingestion {
        private String datasetDir = "./data";
        private String cron = "0 0 3 * * *";
        private boolean runOnStartup = true;
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Interpretation {
        private boolean enabled = true;
        private String keyPrefix = "interpretation:";
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
    }
}
