package com.parametric.payout;

import java.math.BigDecimal;

/**
 * The cession leg of a payout: the excess above retention, the request raised for it and,
 * once the reinsurer pays, the funding that backs the leg.
 */
public record ReinsuranceRecovery(
    String reinsurerId,
    BigDecimal amount,
    String cessionId,
    String fundingId,
    BigDecimal fundedAmount,
    String transactionId
) {

    public ReinsuranceRecovery withCession(String cessionId) {
        return new ReinsuranceRecovery(reinsurerId, amount, cessionId, fundingId, fundedAmount, transactionId);
    }

    public ReinsuranceRecovery withFunding(String fundingId, BigDecimal fundedAmount, String reinsurer) {
        return new ReinsuranceRecovery(reinsurer, amount, cessionId, fundingId, fundedAmount, transactionId);
    }

    public ReinsuranceRecovery withTransaction(String transactionId) {
        return new ReinsuranceRecovery(reinsurerId, amount, cessionId, fundingId, fundedAmount, transactionId);
    }
}
