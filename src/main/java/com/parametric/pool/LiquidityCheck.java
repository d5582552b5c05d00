package com.parametric.pool;

import java.math.BigDecimal;

public record LiquidityCheck(
    String poolId,
    BigDecimal requestedAmount,
    boolean hasSufficientLiquidity,
    boolean hasImmediateLiquidity,
    BigDecimal liquidityGap,
    int estimatedLiquidationDays
) {}
