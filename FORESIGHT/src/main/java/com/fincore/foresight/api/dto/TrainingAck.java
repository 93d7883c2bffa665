package com.fincore.foresight.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Acknowledgement of a background training request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingAck {
    private String status;
    private String message;

    /** False when the request was folded into a pass already running */
    private boolean newPass;

    private Instant requestedAt;
}
