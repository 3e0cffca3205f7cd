package com.whereq.iris.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-batch particle analysis bounds bound into every rendered macro.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobParameters {

    /**
     * Minimum particle area in pixels
     */
    @Builder.Default
    private double minSize = 10;

    /**
     * Maximum particle area; kept as text so that "Infinity" survives into the macro
     */
    @Builder.Default
    private String maxSize = "Infinity";

    @Builder.Default
    private double minCircularity = 0.00;

    @Builder.Default
    private double maxCircularity = 1.00;

    public static JobParameters defaults() {
        return JobParameters.builder().build();
    }
}
