package com.fincore.foresight.api.v1;

import com.fincore.foresight.api.dto.CapacityPlanningRequest;
import com.fincore.foresight.api.mapper.ErrorResponseMapper;
import com.fincore.foresight.domain.model.CapacityPlan;
import com.fincore.foresight.domain.model.HealthSignal;
import com.fincore.foresight.domain.model.InsightSummary;
import com.fincore.foresight.domain.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * REST API controller for signals derived from raw observations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Insights", description = "Health, capacity and summary insights")
public class InsightController {

    private final AnalyticsService analyticsService;
    private final Clock clock;

    public InsightController(AnalyticsService analyticsService, Clock clock) {
        this.analyticsService = analyticsService;
        this.clock = clock;
    }

    @GetMapping("/health/predict")
    @Operation(summary = "Predict system health",
               description = "Score error rate, latency and CPU over the last hour")
    @ApiResponse(responseCode = "200", description = "Health assessed",
            content = @Content(schema = @Schema(implementation = HealthSignal.class)))
    @ApiResponse(responseCode = "400", description = "No metrics ingested yet")
    public Mono<ResponseEntity<?>> predictHealth() {
        return analyticsService.assessHealth()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }

    @PostMapping("/capacity/plan")
    @Operation(summary = "Plan capacity",
               description = "Project the resource needs of a source under compound monthly growth")
    @ApiResponse(responseCode = "200", description = "Plan produced",
            content = @Content(schema = @Schema(implementation = CapacityPlan.class)))
    @ApiResponse(responseCode = "404", description = "The source has no data")
    public Mono<ResponseEntity<?>> planCapacity(@Valid @RequestBody CapacityPlanningRequest request) {
        return analyticsService.planCapacity(request.getSource(), request.getGrowthRate(),
                        request.getPlanningHorizonDays())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }

    @GetMapping("/insights/summary")
    @Operation(summary = "Insight summary", description = "Variability findings and risk over the last day")
    @ApiResponse(responseCode = "200", description = "Summary produced",
            content = @Content(schema = @Schema(implementation = InsightSummary.class)))
    public Mono<ResponseEntity<?>> summary() {
        return analyticsService.summarize()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }
}
