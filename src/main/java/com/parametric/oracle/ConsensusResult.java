package com.parametric.oracle;

import java.util.List;

public record ConsensusResult(
    int requiredSignatures,
    int receivedSignatures,
    double threshold,
    boolean reached,
    double finalValue,
    double confidence,
    List<String> outliers,
    double consensusWeight,
    double totalWeight
) {

    public ConsensusResult {
        outliers = outliers == null ? List.of() : List.copyOf(outliers);
    }
}
