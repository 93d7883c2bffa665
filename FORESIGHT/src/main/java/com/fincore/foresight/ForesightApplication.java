package com.fincore.foresight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FORESIGHT - Metric analytics engine for the FinCore platform.
 *
 * <p>FORESIGHT provides:
 * <ul>
 *   <li>Bounded metric storage fed by service telemetry ingestion</li>
 *   <li>Per-series forecasting with recursive multi-step prediction</li>
 *   <li>Per-series anomaly detection and severity classification</li>
 *   <li>System health scoring and capacity projection from raw observations</li>
 * </ul>
 *
 * <p>Models are trained in the background over whatever the metric store holds at the
 * time of the pass; request handling only ever reads the cached models.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ForesightApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForesightApplication.class, args);
    }
}
