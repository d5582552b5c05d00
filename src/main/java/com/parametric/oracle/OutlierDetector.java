package com.parametric.oracle;

import java.util.List;
import java.util.Set;

/**
 * Flags submitted values that disagree with the rest of the round.
 */
public interface OutlierDetector {

    /** Identifier used in configuration and recorded on aggregated data. */
    String method();

    /**
     * @param values    every submitted value of the round, in submission order
     * @param threshold score above which a value is an outlier
     * @return indexes into {@code values} of the outliers
     */
    Set<Integer> detect(List<Double> values, double threshold);
}
