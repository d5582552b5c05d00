package com.parametric.oracle;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code |value - mean| / stdDev > threshold}. Identical values (stdDev 0) yield no outliers.
 *
 * <p>With a population standard deviation the largest reachable score over n values is
 * {@code sqrt(n - 1)}, so with small rounds and a threshold of 2.0 this detector only
 * fires from six submissions upward.
 */
public class StandardScoreOutlierDetector implements OutlierDetector {

    public static final String METHOD = "standard-score";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public Set<Integer> detect(List<Double> values, double threshold) {
        Set<Integer> outliers = new LinkedHashSet<>();
        double stdDev = DescriptiveStats.standardDeviation(values);
        if (stdDev == 0.0) {
            return outliers;
        }
        double mean = DescriptiveStats.mean(values);
        for (int i = 0; i < values.size(); i++) {
            if (Math.abs(values.get(i) - mean) / stdDev > threshold) {
                outliers.add(i);
            }
        }
        return outliers;
    }
}
