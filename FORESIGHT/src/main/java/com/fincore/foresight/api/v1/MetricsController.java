package com.fincore.foresight.api.v1;

import com.fincore.foresight.api.dto.IngestResponse;
import com.fincore.foresight.api.dto.MetricPointDto;
import com.fincore.foresight.api.mapper.ErrorResponseMapper;
import com.fincore.foresight.api.mapper.MetricPointMapper;
import com.fincore.foresight.domain.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * REST API controller for metric ingestion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Metric ingestion")
public class MetricsController {

    private final AnalyticsService analyticsService;
    private final Clock clock;

    public MetricsController(AnalyticsService analyticsService, Clock clock) {
        this.analyticsService = analyticsService;
        this.clock = clock;
    }

    @PostMapping("/ingest")
    @Operation(summary = "Ingest metrics",
               description = "Append a batch of metric points; the oldest points are evicted at capacity")
    @ApiResponse(responseCode = "200", description = "Batch ingested",
            content = @Content(schema = @Schema(implementation = IngestResponse.class)))
    @ApiResponse(responseCode = "400", description = "A point in the batch is malformed")
    public Mono<ResponseEntity<?>> ingest(@RequestBody List<MetricPointDto> points) {
        return Mono.fromCallable(() -> MetricPointMapper.toDomain(points))
                .flatMap(analyticsService::ingest)
                .<ResponseEntity<?>>map(count -> ResponseEntity.ok(IngestResponse.builder()
                        .status("success")
                        .ingestedCount(count)
                        .build()))
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }
}
