package com.parametric.payout;

import com.parametric.ledger.LedgerRef;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Business record of one payout. Execution happens in one {@link PayoutTransaction}
 * per leg: a pool leg for the retained amount and, above retention, a cession leg.
 */
public class Payout {

    private String payoutId;
    private String policyId;
    private String triggerId;
    private String beneficiaryAccountId;
    private String poolId;
    private PayoutCalculation calculation;
    private PayoutStatus status;
    private BigDecimal poolAmount;
    private BigDecimal cessionAmount;
    private List<PoolDistribution> riskPoolDistributions = new ArrayList<>();
    private ReinsuranceRecovery reinsuranceRecovery;
    private LedgerRef triggerRef;
    private LedgerRef ruleRef;
    private LedgerRef stopLossRef;
    private RetryMechanism followUpRetry;
    private FailureReason failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public String getPayoutId() {
        return payoutId;
    }

    public void setPayoutId(String payoutId) {
        this.payoutId = payoutId;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public String getTriggerId() {
        return triggerId;
    }

    public void setTriggerId(String triggerId) {
        this.triggerId = triggerId;
    }

    public String getBeneficiaryAccountId() {
        return beneficiaryAccountId;
    }

    public void setBeneficiaryAccountId(String beneficiaryAccountId) {
        this.beneficiaryAccountId = beneficiaryAccountId;
    }

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public PayoutCalculation getCalculation() {
        return calculation;
    }

    public void setCalculation(PayoutCalculation calculation) {
        this.calculation = calculation;
    }

    public PayoutStatus getStatus() {
        return status;
    }

    public void setStatus(PayoutStatus status) {
        this.status = status;
    }

    public BigDecimal getPoolAmount() {
        return poolAmount;
    }

    public void setPoolAmount(BigDecimal poolAmount) {
        this.poolAmount = poolAmount;
    }

    public BigDecimal getCessionAmount() {
        return cessionAmount;
    }

    public void setCessionAmount(BigDecimal cessionAmount) {
        this.cessionAmount = cessionAmount;
    }

    public List<PoolDistribution> getRiskPoolDistributions() {
        return riskPoolDistributions;
    }

    public void setRiskPoolDistributions(List<PoolDistribution> riskPoolDistributions) {
        this.riskPoolDistributions = riskPoolDistributions == null ? new ArrayList<>() : new ArrayList<>(riskPoolDistributions);
    }

    public ReinsuranceRecovery getReinsuranceRecovery() {
        return reinsuranceRecovery;
    }

    public void setReinsuranceRecovery(ReinsuranceRecovery reinsuranceRecovery) {
        this.reinsuranceRecovery = reinsuranceRecovery;
    }

    public LedgerRef getTriggerRef() {
        return triggerRef;
    }

    public void setTriggerRef(LedgerRef triggerRef) {
        this.triggerRef = triggerRef;
    }

    public LedgerRef getRuleRef() {
        return ruleRef;
    }

    public void setRuleRef(LedgerRef ruleRef) {
        this.ruleRef = ruleRef;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(FailureReason failureReason) {
        this.failureReason = failureReason;
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

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public LedgerRef getStopLossRef() {
        return stopLossRef;
    }

    public void setStopLossRef(LedgerRef stopLossRef) {
        this.stopLossRef = stopLossRef;
    }

    /** Attempts at the cession request or settlement; null while neither has failed. */
    public RetryMechanism getFollowUpRetry() {
        return followUpRetry;
    }

    public void setFollowUpRetry(RetryMechanism followUpRetry) {
        this.followUpRetry = followUpRetry;
    }
}
