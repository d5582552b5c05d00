package com.parametric.error;

import java.math.BigDecimal;

/**
 * Thrown by a reservation that the pool's available liquidity cannot cover.
 * The pool document is left untouched when this is raised.
 */
public class InsufficientLiquidityException extends SettlementException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientLiquidityException(String poolId, BigDecimal requested, BigDecimal available) {
        super("INSUFFICIENT_LIQUIDITY",
            "pool " + poolId + " cannot reserve " + requested.toPlainString()
                + " (available " + available.toPlainString() + ")");
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
