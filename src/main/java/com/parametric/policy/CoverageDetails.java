package com.parametric.policy;

import java.math.BigDecimal;

public record CoverageDetails(BigDecimal maxPayout, BigDecimal deductible, String currency) {}
