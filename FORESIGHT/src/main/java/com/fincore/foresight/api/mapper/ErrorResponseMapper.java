package com.fincore.foresight.api.mapper;

import com.fincore.foresight.api.dto.ErrorResponse;
import com.fincore.foresight.domain.exception.ForesightException;
import com.fincore.foresight.domain.exception.InvalidInputException;
import com.fincore.foresight.domain.exception.ModelNotReadyException;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.exception.SeriesNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Maps request failures to HTTP responses carrying an {@link ErrorResponse}.
 */
@Slf4j
public final class ErrorResponseMapper {

    private ErrorResponseMapper() {}

    public static HttpStatus statusOf(Throwable error) {
        if (error instanceof InvalidInputException || error instanceof NoDataException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof SeriesNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof ModelNotReadyException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /**
     * Build the error response for {@code error}, stamped with the current time of {@code clock}.
     */
    public static Mono<ResponseEntity<?>> toResponse(Throwable error, Clock clock) {
        HttpStatus status = statusOf(error);
        String code;
        String message;
        if (error instanceof ForesightException foresightError) {
            code = foresightError.getErrorCode();
            message = foresightError.getMessage();
            log.warn("Request rejected ({}): {}", code, message);
        } else {
            code = "internal_error";
            message = "Request processing failed";
            log.error("Request processing failed", error);
        }
        return Mono.<ResponseEntity<?>>just(ResponseEntity.status(status)
                .body(ErrorResponse.builder()
                        .error(code)
                        .message(message)
                        .timestamp(clock.instant())
                        .build()));
    }
}
