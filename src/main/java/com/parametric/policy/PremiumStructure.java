package com.parametric.policy;

import java.math.BigDecimal;

public record PremiumStructure(BigDecimal basePremium, String paymentFrequency, String currency) {}
