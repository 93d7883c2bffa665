package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A predicted issue raised by health scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthIssue {

    /** Issue type, e.g. high_error_rate */
    private String type;

    /** high or medium */
    private String severity;

    private String description;

    /** Distinct sources of the observations that raised the issue */
    @Builder.Default
    private List<String> affectedSources = new ArrayList<>();
}
