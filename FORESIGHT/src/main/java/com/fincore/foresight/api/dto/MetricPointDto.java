package com.fincore.foresight.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Wire representation of a metric observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPointDto {

    private Instant timestamp;

    @JsonAlias("service")
    private String source;

    @JsonAlias("metric_name")
    private String metricName;

    private Double value;

    private Map<String, String> labels;
}
