package com.parametric.payout;

import com.parametric.policy.CoverageDetails;

import java.math.BigDecimal;
import java.util.List;

/**
 * {@code netPayout = max(0, maxPayout - deductible)}. Adjustments are carried for
 * future rules and are always empty today.
 */
public class PayoutCalculator {

    public PayoutCalculation calculate(CoverageDetails coverage) {
        BigDecimal base = coverage.maxPayout();
        BigDecimal deductible = coverage.deductible() == null ? BigDecimal.ZERO : coverage.deductible();
        BigDecimal net = base.subtract(deductible).max(BigDecimal.ZERO);
        return new PayoutCalculation(base, deductible, List.of(), net, coverage.currency());
    }
}
