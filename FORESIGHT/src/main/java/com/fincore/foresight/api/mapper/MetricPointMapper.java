package com.fincore.foresight.api.mapper;

import com.fincore.foresight.api.dto.MetricPointDto;
import com.fincore.foresight.domain.model.MetricPoint;

import java.util.List;

/**
 * Mapper between metric point DTOs and the domain model.
 */
public final class MetricPointMapper {

    private MetricPointMapper() {}

    /**
     * A missing value maps to NaN so that validation rejects the point.
     */
    public static MetricPoint toDomain(MetricPointDto dto) {
        if (dto == null) {
            return null;
        }
        return MetricPoint.builder()
                .timestamp(dto.getTimestamp())
                .source(dto.getSource())
                .metricName(dto.getMetricName())
                .value(dto.getValue() != null ? dto.getValue() : Double.NaN)
                .labels(dto.getLabels())
                .build();
    }

    public static List<MetricPoint> toDomain(List<MetricPointDto> dtos) {
        return dtos.stream().map(MetricPointMapper::toDomain).toList();
    }
}
