package com.parametric.oracle;

public record ConsensusEvaluation(ConsensusResult result, AggregatedData aggregatedData) {

    public boolean reached() {
        return result.reached();
    }
}
