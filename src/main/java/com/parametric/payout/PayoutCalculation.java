package com.parametric.payout;

import java.math.BigDecimal;
import java.util.List;

public record PayoutCalculation(
    BigDecimal basePayout,
    BigDecimal deductible,
    List<PayoutAdjustment> adjustments,
    BigDecimal netPayout,
    String currency
) {

    public PayoutCalculation {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }
}
