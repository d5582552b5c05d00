package com.parametric.payout;

import java.math.BigDecimal;

public record PoolDistribution(String poolId, BigDecimal amount, String transactionId) {}
