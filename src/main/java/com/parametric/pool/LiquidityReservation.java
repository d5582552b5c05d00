package com.parametric.pool;

import java.math.BigDecimal;
import java.time.Instant;

public class LiquidityReservation {

    private String reservationId;
    private String poolId;
    private String claimId;
    private BigDecimal amount;
    private BigDecimal tier1Drawn;
    private BigDecimal tier2Drawn;
    private BigDecimal tier3Drawn;
    private ReservationStatus status;
    private Instant createdAt;
    private Instant closedAt;

    public String getReservationId() {
        return reservationId;
    }

    public void setReservationId(String reservationId) {
        this.reservationId = reservationId;
    }

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public String getClaimId() {
        return claimId;
    }

    public void setClaimId(String claimId) {
        this.claimId = claimId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public BigDecimal getTier1Drawn() {
        return tier1Drawn;
    }

    public void setTier1Drawn(BigDecimal tier1Drawn) {
        this.tier1Drawn = tier1Drawn;
    }

    public BigDecimal getTier2Drawn() {
        return tier2Drawn;
    }

    public void setTier2Drawn(BigDecimal tier2Drawn) {
        this.tier2Drawn = tier2Drawn;
    }

    public BigDecimal getTier3Drawn() {
        return tier3Drawn;
    }

    public void setTier3Drawn(BigDecimal tier3Drawn) {
        this.tier3Drawn = tier3Drawn;
    }

    public ReservationStatus getStatus() {
        return status;
    }

    public void setStatus(ReservationStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }
}
