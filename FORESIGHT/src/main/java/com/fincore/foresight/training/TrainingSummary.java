package com.fincore.foresight.training;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome counts of one training pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingSummary {
    private String runId;
    private Instant startedAt;
    private Instant completedAt;

    /** Points in the store snapshot the pass worked from */
    private int snapshotPoints;

    /** Distinct series found in the snapshot */
    private int seriesSeen;

    /** Series below the minimum point count; no model was created for them */
    private int seriesSkipped;

    /** Series whose forecast model fitted */
    private int seriesTrained;

    /** Series fitted without error but with too little usable data */
    private int seriesNotFitted;

    private int seriesFailed;
    private int seriesTimedOut;
}
