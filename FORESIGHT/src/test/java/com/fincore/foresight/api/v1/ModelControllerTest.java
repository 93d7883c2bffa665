package com.fincore.foresight.api.v1;

import com.fincore.foresight.domain.service.AnalyticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ModelController}.
 */
class ModelControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T02:00:00Z");

    @Test
    @DisplayName("should acknowledge a training request with the injected clock's time")
    void trainingAckUsesClock() {
        AnalyticsService analyticsService = mock(AnalyticsService.class);
        when(analyticsService.triggerTraining()).thenReturn(Mono.just(false));
        ModelController controller = new ModelController(analyticsService, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(controller.train())
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
                    assertThat(response.getBody()).isNotNull();
                    assertThat(response.getBody().getStatus()).isEqualTo("training_started");
                    assertThat(response.getBody().isNewPass()).isFalse();
                    assertThat(response.getBody().getRequestedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
    }
}
