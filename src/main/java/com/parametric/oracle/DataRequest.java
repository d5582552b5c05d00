package com.parametric.oracle;

/**
 * What a consensus round is asked to confirm. {@code policyId} is optional; when
 * present the consensus value is fed to trigger ingestion for that policy.
 */
public record DataRequest(
    String parameter,
    GeoLocation location,
    TimeWindow window,
    double requiredAccuracy,
    String unit,
    String policyId
) {}
