package com.parametric.payout;

import java.math.BigDecimal;

public record LiquidityDetails(String poolId, String reservationId, BigDecimal reservedAmount) {}
