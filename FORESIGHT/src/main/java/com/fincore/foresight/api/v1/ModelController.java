package com.fincore.foresight.api.v1;

import com.fincore.foresight.api.dto.ModelStatusResponse;
import com.fincore.foresight.api.dto.TrainingAck;
import com.fincore.foresight.domain.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * REST API controller for model training and status.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Model training and status")
public class ModelController {

    private final AnalyticsService analyticsService;
    private final Clock clock;

    public ModelController(AnalyticsService analyticsService, Clock clock) {
        this.analyticsService = analyticsService;
        this.clock = clock;
    }

    @PostMapping("/train")
    @Operation(summary = "Train models",
               description = "Start training every series with enough data in the background")
    @ApiResponse(responseCode = "202", description = "Training accepted")
    public Mono<ResponseEntity<TrainingAck>> train() {
        return analyticsService.triggerTraining()
                .map(started -> {
                    log.info("Training requested (new pass: {})", started);
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(TrainingAck.builder()
                            .status("training_started")
                            .message("Models are being trained in the background")
                            .newPass(started)
                            .requestedAt(clock.instant())
                            .build());
                });
    }

    @GetMapping("/status")
    @Operation(summary = "Model status", description = "Model counts, store fill level and the last training pass")
    public Mono<ResponseEntity<ModelStatusResponse>> status() {
        return analyticsService.modelStatus()
                .map(models -> ResponseEntity.ok(ModelStatusResponse.builder()
                        .models(models)
                        .trainingInProgress(analyticsService.isTrainingInProgress())
                        .lastTraining(analyticsService.lastTrainingSummary().orElse(null))
                        .build()));
    }
}
