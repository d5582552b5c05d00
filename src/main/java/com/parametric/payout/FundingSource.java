package com.parametric.payout;

/**
 * Capital behind a payout leg. Serialized upper-case as carried in {@code PayoutExecuted}.
 */
public enum FundingSource {
    POOL,
    CESSION
}
