package com.parametric.payout;

public enum FailureReason {
    INSUFFICIENT_LIQUIDITY,
    LEDGER_PUBLISH_FAILED,
    FINALITY_TIMEOUT,
    NON_POSITIVE_PAYOUT,
    LEG_FAILED
}
