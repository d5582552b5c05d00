package com.parametric.cession;

import com.parametric.ledger.LedgerRef;

import java.math.BigDecimal;

/**
 * Ask the reinsurer to fund the loss above retention. {@code payoutId} is set when the
 * request is raised by a payout; manual requests leave it empty.
 */
public record CessionRequest(
    String policyId,
    String payoutId,
    BigDecimal excessAmount,
    BigDecimal lossCum,
    BigDecimal retention,
    LedgerRef triggerRef,
    LedgerRef ruleRef
) {}
