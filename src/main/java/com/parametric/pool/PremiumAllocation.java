package com.parametric.pool;

import java.math.BigDecimal;

public record PremiumAllocation(
    BigDecimal premium,
    BigDecimal poolShare,
    BigDecimal reinsurerShare,
    BigDecimal systemFee
) {}
