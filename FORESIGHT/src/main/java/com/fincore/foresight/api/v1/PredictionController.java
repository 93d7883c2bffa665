package com.fincore.foresight.api.v1;

import com.fincore.foresight.api.dto.AnomalyDetectionRequest;
import com.fincore.foresight.api.dto.PredictionRequest;
import com.fincore.foresight.api.mapper.ErrorResponseMapper;
import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.AnomalyReport;
import com.fincore.foresight.domain.model.ForecastResult;
import com.fincore.foresight.domain.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * REST API controller for forecasts and anomaly detection.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Predictions", description = "Forecasting and anomaly detection")
public class PredictionController {

    private static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    private final AnalyticsService analyticsService;
    private final ForesightProperties properties;
    private final Clock clock;

    public PredictionController(AnalyticsService analyticsService, ForesightProperties properties,
                                Clock clock) {
        this.analyticsService = analyticsService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping("/predict")
    @Operation(summary = "Forecast a series",
               description = "Recursive multi-step forecast, one step per minute after the last observation")
    @ApiResponse(responseCode = "200", description = "Forecast produced",
            content = @Content(schema = @Schema(implementation = ForecastResult.class)))
    @ApiResponse(responseCode = "404", description = "No model exists for the series")
    @ApiResponse(responseCode = "409", description = "Model untrained or too little recent data")
    public Mono<ResponseEntity<?>> predict(@Valid @RequestBody PredictionRequest request) {
        int horizon = request.getPredictionHorizon() != null
                ? request.getPredictionHorizon()
                : properties.getForecast().getDefaultHorizon();
        double confidenceLevel = request.getConfidenceLevel() != null
                ? request.getConfidenceLevel()
                : DEFAULT_CONFIDENCE_LEVEL;

        return analyticsService.forecast(request.getSource(), request.getMetricName(), horizon, confidenceLevel)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }

    @PostMapping("/anomalies/detect")
    @Operation(summary = "Detect anomalies",
               description = "Score the observations of a trailing window and report the outliers")
    @ApiResponse(responseCode = "200", description = "Detection completed",
            content = @Content(schema = @Schema(implementation = AnomalyReport.class)))
    @ApiResponse(responseCode = "404", description = "No detector exists for the series")
    @ApiResponse(responseCode = "409", description = "Detector untrained or too little recent data")
    public Mono<ResponseEntity<?>> detectAnomalies(@Valid @RequestBody AnomalyDetectionRequest request) {
        int lookbackHours = request.getLookbackHours() != null
                ? request.getLookbackHours()
                : properties.getAnomaly().getDefaultLookbackHours();

        return analyticsService.detectAnomalies(request.getSource(), request.getMetricName(), lookbackHours)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> ErrorResponseMapper.toResponse(error, clock));
    }
}
