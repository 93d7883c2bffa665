package com.fincore.foresight.api.mapper;

import com.fincore.foresight.api.dto.ErrorResponse;
import com.fincore.foresight.domain.exception.InvalidInputException;
import com.fincore.foresight.domain.exception.ModelNotReadyException;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.exception.SeriesNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ErrorResponseMapper}.
 */
class ErrorResponseMapperTest {

    private static final Instant NOW = Instant.parse("2024-01-01T02:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("should map each error kind to its status")
    void statuses() {
        assertThat(ErrorResponseMapper.statusOf(new InvalidInputException("bad"))).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorResponseMapper.statusOf(new NoDataException("none"))).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorResponseMapper.statusOf(new SeriesNotFoundException("gone"))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ErrorResponseMapper.statusOf(new ModelNotReadyException("wait"))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ErrorResponseMapper.statusOf(new IllegalStateException("boom")))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("should stamp domain errors with the injected clock")
    void domainErrorUsesClock() {
        StepVerifier.create(ErrorResponseMapper.toResponse(new ModelNotReadyException("Model not trained"), clock))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    ErrorResponse body = (ErrorResponse) response.getBody();
                    assertThat(body).isNotNull();
                    assertThat(body.getError()).isEqualTo("not_ready");
                    assertThat(body.getMessage()).isEqualTo("Model not trained");
                    assertThat(body.getTimestamp()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should hide unexpected failures behind internal_error")
    void unexpectedErrorIsGeneric() {
        StepVerifier.create(ErrorResponseMapper.toResponse(new IllegalStateException("stack detail"), clock))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                    ErrorResponse body = (ErrorResponse) response.getBody();
                    assertThat(body).isNotNull();
                    assertThat(body.getError()).isEqualTo("internal_error");
                    assertThat(body.getMessage()).doesNotContain("stack detail");
                    assertThat(body.getTimestamp()).isEqualTo(NOW);
                })
                .verifyComplete();
    }
}
