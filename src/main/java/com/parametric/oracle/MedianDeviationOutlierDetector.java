package com.parametric.oracle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Modified z-score: {@code 0.6745 * |value - median| / MAD > threshold}, where MAD is the
 * median absolute deviation. A single far-off reading cannot drag the centre towards
 * itself, so it is caught even in a round of four.
 *
 * <p>When MAD is 0 (a majority agrees exactly) the scale is undefined, and the round is
 * scored with {@link StandardScoreOutlierDetector} instead, so small spreads around an
 * exact majority are not flagged.
 */
public class MedianDeviationOutlierDetector implements OutlierDetector {

    public static final String METHOD = "median-deviation";
    static final double CONSISTENCY_CONSTANT = 0.6745;

    private final OutlierDetector zeroSpreadFallback = new StandardScoreOutlierDetector();

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public Set<Integer> detect(List<Double> values, double threshold) {
        Set<Integer> outliers = new LinkedHashSet<>();
        if (values.isEmpty()) {
            return outliers;
        }
        double median = DescriptiveStats.median(values);
        List<Double> deviations = new ArrayList<>(values.size());
        for (double v : values) {
            deviations.add(Math.abs(v - median));
        }
        double mad = DescriptiveStats.median(deviations);
        if (mad == 0.0) {
            return zeroSpreadFallback.detect(values, threshold);
        }
        for (int i = 0; i < values.size(); i++) {
            if (CONSISTENCY_CONSTANT * deviations.get(i) / mad > threshold) {
                outliers.add(i);
            }
        }
        return outliers;
    }
}
