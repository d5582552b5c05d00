package com.parametric.policy;

import java.math.BigDecimal;

/**
 * Stop-loss cover: the pool pays up to {@code retentionLimit}, the reinsurer funds the excess.
 */
public record ReinsuranceDetails(String reinsurerId, BigDecimal cessionPercentage, BigDecimal retentionLimit) {}
