package com.parametric.payout;

import java.math.BigDecimal;

public record PayoutAdjustment(String description, BigDecimal amount) {}
