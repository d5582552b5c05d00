package com.parametric.oracle;

import java.util.List;

/**
 * Statistics over every submitted value of a round, kept on the attestation for audit.
 */
public record AggregatedData(
    List<Double> rawValues,
    double mean,
    double median,
    double standardDeviation,
    double outlierThreshold,
    String outlierMethod
) {

    public AggregatedData {
        rawValues = rawValues == null ? List.of() : List.copyOf(rawValues);
    }
}
