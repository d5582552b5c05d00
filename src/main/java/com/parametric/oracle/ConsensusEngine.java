package com.parametric.oracle;

import com.parametric.config.SettlementProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns the signatures of one round into a consensus value.
 *
 * <p>The consensus value is the plain mean of the non-outlier values. Agreement is
 * weighted: the round is reached when the non-outliers carry at least the configured
 * share of the total reputation weight. Stateless; callers serialize per attestation.
 */
public class ConsensusEngine {

    private final SettlementProperties.Consensus settings;
    private final OutlierDetector outlierDetector;

    public ConsensusEngine(SettlementProperties.Consensus settings, OutlierDetector outlierDetector) {
        this.settings = settings;
        this.outlierDetector = outlierDetector;
    }

    public boolean quorumMet(int signatureCount) {
        return signatureCount >= settings.getRequiredSignatures();
    }

    public ConsensusEvaluation evaluate(List<OracleSignature> signatures) {
        if (!quorumMet(signatures.size())) {
            throw new IllegalArgumentException("Consensus needs " + settings.getRequiredSignatures()
                + " signatures, got " + signatures.size());
        }

        List<Double> values = signatures.stream().map(OracleSignature::value).toList();
        double mean = DescriptiveStats.mean(values);
        double median = DescriptiveStats.median(values);
        double stdDev = DescriptiveStats.standardDeviation(values);

        Set<Integer> outlierIndexes = outlierDetector.detect(values, settings.getOutlierThreshold());

        List<String> outlierOracles = new ArrayList<>();
        List<Double> agreeing = new ArrayList<>();
        double consensusWeight = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < signatures.size(); i++) {
            OracleSignature signature = signatures.get(i);
            totalWeight += signature.weight();
            if (outlierIndexes.contains(i)) {
                outlierOracles.add(signature.oracleId());
            } else {
                agreeing.add(signature.value());
                consensusWeight += signature.weight();
            }
        }

        boolean reached = totalWeight > 0.0
            && !agreeing.isEmpty()
            && consensusWeight / totalWeight >= settings.getWeightThreshold();
        double finalValue = agreeing.isEmpty() ? mean : DescriptiveStats.mean(agreeing);

        ConsensusResult result = new ConsensusResult(
            settings.getRequiredSignatures(),
            signatures.size(),
            settings.getWeightThreshold(),
            reached,
            finalValue,
            confidence(mean, stdDev),
            outlierOracles,
            consensusWeight,
            totalWeight);
        AggregatedData aggregated = new AggregatedData(
            values, mean, median, stdDev, settings.getOutlierThreshold(), outlierDetector.method());
        return new ConsensusEvaluation(result, aggregated);
    }

    /** {@code 1 - stdDev/|mean|} clamped to [0, 1]; 0 when the mean is 0. */
    static double confidence(double mean, double stdDev) {
        if (mean == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - stdDev / Math.abs(mean)));
    }
}
