package com.parametric.pool;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Shared capital backing payouts. {@code availableLiquidity} always equals the sum of
 * the three tier balances, and
 * {@code availableLiquidity + reservedLiquidity == currentCapacity - committedOutflows}.
 */
public class RiskPool {

    private String poolId;
    private String name;
    private String currency;
    private BigDecimal currentCapacity;
    private BigDecimal availableLiquidity;
    private BigDecimal reservedLiquidity;
    private BigDecimal committedOutflows;
    private BigDecimal tier1Balance;
    private BigDecimal tier2Balance;
    private BigDecimal tier3Balance;
    private BigDecimal totalPremiums;
    private BigDecimal reinsurerPremiums;
    private BigDecimal systemFees;
    private Instant createdAt;
    private Instant updatedAt;

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public BigDecimal getCurrentCapacity() {
        return currentCapacity;
    }

    public void setCurrentCapacity(BigDecimal currentCapacity) {
        this.currentCapacity = currentCapacity;
    }

    public BigDecimal getAvailableLiquidity() {
        return availableLiquidity;
    }

    public void setAvailableLiquidity(BigDecimal availableLiquidity) {
        this.availableLiquidity = availableLiquidity;
    }

    public BigDecimal getReservedLiquidity() {
        return reservedLiquidity;
    }

    public void setReservedLiquidity(BigDecimal reservedLiquidity) {
        this.reservedLiquidity = reservedLiquidity;
    }

    public BigDecimal getCommittedOutflows() {
        return committedOutflows;
    }

    public void setCommittedOutflows(BigDecimal committedOutflows) {
        this.committedOutflows = committedOutflows;
    }

    public BigDecimal getTier1Balance() {
        return tier1Balance;
    }

    public void setTier1Balance(BigDecimal tier1Balance) {
        this.tier1Balance = tier1Balance;
    }

    public BigDecimal getTier2Balance() {
        return tier2Balance;
    }

    public void setTier2Balance(BigDecimal tier2Balance) {
        this.tier2Balance = tier2Balance;
    }

    public BigDecimal getTier3Balance() {
        return tier3Balance;
    }

    public void setTier3Balance(BigDecimal tier3Balance) {
        this.tier3Balance = tier3Balance;
    }

    public BigDecimal getTotalPremiums() {
        return totalPremiums;
    }

    public void setTotalPremiums(BigDecimal totalPremiums) {
        this.totalPremiums = totalPremiums;
    }

    public BigDecimal getReinsurerPremiums() {
        return reinsurerPremiums;
    }

    public void setReinsurerPremiums(BigDecimal reinsurerPremiums) {
        this.reinsurerPremiums = reinsurerPremiums;
    }

    public BigDecimal getSystemFees() {
        return systemFees;
    }

    public void setSystemFees(BigDecimal systemFees) {
        this.systemFees = systemFees;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
