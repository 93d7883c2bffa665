package com.fincore.foresight.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for FORESIGHT service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Metric store capacity</li>
 *     <li>Feature extraction (window size, calendar zone)</li>
 *     <li>Forecast and anomaly model parameters</li>
 *     <li>Background training (parallelism, per-series budget, schedule)</li>
 *     <li>Health and capacity analysis windows</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "foresight")
public class ForesightProperties {

    @Valid
    private final Store store = new Store();
    @Valid
    private final Features features = new Features();
    @Valid
    private final Forecast forecast = new Forecast();
    @Valid
    private final Anomaly anomaly = new Anomaly();
    @Valid
    private final Training training = new Training();
    @Valid
    private final Health health = new Health();
    @Valid
    private final Capacity capacity = new Capacity();

    /**
     * Bounded metric store configuration.
     */
    @Data
    public static class Store {
        /** Maximum number of points retained; oldest are evicted first */
        @Positive
        private int capacity = 10_000;
    }

    /**
     * Feature extraction configuration shared by both model families.
     */
    @Data
    public static class Features {
        /** Trailing values used as regression context */
        @Positive
        private int windowSize = 10;

        /** Zone used to derive hour-of-day and weekday features */
        @NotBlank
        private String zone = "UTC";

        /** Guards divisions by values close to zero */
        private double epsilon = 1e-8;

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * Forecast model configuration.
     */
    @Data
    public static class Forecast {
        /** Minimum raw points before a fit is attempted */
        @Positive
        private int minTrainingPoints = 20;

        /** Held-out share used to estimate accuracy */
        @DecimalMin("0.05")
        @DecimalMax("0.5")
        private double testFraction = 0.2;

        private long randomSeed = 42L;

        /** L2 penalty of the regression; must be positive to keep the normal equations solvable */
        @DecimalMin(value = "0.0", inclusive = false)
        private double ridgeAlpha = 1.0;

        /** Most recent points pulled from the store for a prediction request */
        @Positive
        private int recentPoints = 50;

        /** Minimum recent points required to serve a prediction request */
        @Positive
        private int minRecentPoints = 10;

        @Positive
        private int defaultHorizon = 60;

        @Positive
        private int maxHorizon = 1440;
    }

    /**
     * Anomaly model configuration.
     */
    @Data
    public static class Anomaly {
        @Positive
        private int minTrainingPoints = 10;

        /** Expected share of anomalous points, used to place the decision offset */
        @DecimalMin("0.001")
        @DecimalMax("0.5")
        private double contamination = 0.1;

        /** Reported decision threshold; not re-estimated during fitting */
        private double threshold = -0.5;

        @Positive
        private int numberOfTrees = 50;

        @Positive
        private int sampleSize = 256;

        private long randomSeed = 42L;

        @Positive
        private int minRecentPoints = 10;

        @Positive
        private int defaultLookbackHours = 24;
    }

    /**
     * Background training configuration.
     */
    @Data
    public static class Training {
        /** Minimum points a series needs before any model is created for it */
        @Positive
        private int minSeriesPoints = 20;

        /** Time budget for a single series fit */
        private Duration seriesTimeout = Duration.ofSeconds(30);

        /** Worker threads fitting series concurrently */
        @Positive
        private int parallelism = 2;

        /** Enable periodic retraining */
        private boolean scheduleEnabled = false;

        /** Delay between scheduled training passes */
        private Duration scheduleInterval = Duration.ofMinutes(15);
    }

    /**
     * Health scoring configuration.
     */
    @Data
    public static class Health {
        /** Trailing window of observations considered */
        private Duration window = Duration.ofHours(1);

        /** Horizon advertised with the health signal, in minutes */
        @Positive
        private int predictionHorizonMinutes = 60;
    }

    /**
     * Capacity projection configuration.
     */
    @Data
    public static class Capacity {
        /** Trailing window of observations considered */
        private Duration window = Duration.ofHours(24);

        /** Monthly cost the simplified cost model scales from */
        @Positive
        private double baseMonthlyCost = 1000.0;
    }
}
