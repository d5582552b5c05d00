package com.parametric.cession;

import com.parametric.ledger.LedgerRef;

import java.math.BigDecimal;
import java.time.Instant;

public class CessionRecord {

    private String cessionId;
    private String policyId;
    private String payoutId;
    private BigDecimal excessAmount;
    private BigDecimal lossCum;
    private BigDecimal retention;
    private LedgerRef triggerRef;
    private LedgerRef ruleRef;
    private CessionStatus status;
    private LedgerRef requestRef;
    private String fundingId;
    private BigDecimal fundedAmount;
    private String reinsurer;
    private String fundingTxId;
    private LedgerRef fundingRef;
    private Instant requestedAt;
    private Instant fundedAt;

    public String getCessionId() {
        return cessionId;
    }

    public void setCessionId(String cessionId) {
        this.cessionId = cessionId;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public String getPayoutId() {
        return payoutId;
    }

    public void setPayoutId(String payoutId) {
        this.payoutId = payoutId;
    }

    public BigDecimal getExcessAmount() {
        return excessAmount;
    }

    public void setExcessAmount(BigDecimal excessAmount) {
        this.excessAmount = excessAmount;
    }

    public BigDecimal getLossCum() {
        return lossCum;
    }

    public void setLossCum(BigDecimal lossCum) {
        this.lossCum = lossCum;
    }

    public BigDecimal getRetention() {
        return retention;
    }

    public void setRetention(BigDecimal retention) {
        this.retention = retention;
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

    public CessionStatus getStatus() {
        return status;
    }

    public void setStatus(CessionStatus status) {
        this.status = status;
    }

    public LedgerRef getRequestRef() {
        return requestRef;
    }

    public void setRequestRef(LedgerRef requestRef) {
        this.requestRef = requestRef;
    }

    public String getFundingId() {
        return fundingId;
    }

    public void setFundingId(String fundingId) {
        this.fundingId = fundingId;
    }

    public BigDecimal getFundedAmount() {
        return fundedAmount;
    }

    public void setFundedAmount(BigDecimal fundedAmount) {
        this.fundedAmount = fundedAmount;
    }

    public String getReinsurer() {
        return reinsurer;
    }

    public void setReinsurer(String reinsurer) {
        this.reinsurer = reinsurer;
    }

    public String getFundingTxId() {
        return fundingTxId;
    }

    public void setFundingTxId(String fundingTxId) {
        this.fundingTxId = fundingTxId;
    }

    public LedgerRef getFundingRef() {
        return fundingRef;
    }

    public void setFundingRef(LedgerRef fundingRef) {
        this.fundingRef = fundingRef;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    public Instant getFundedAt() {
        return fundedAt;
    }

    public void setFundedAt(Instant fundedAt) {
        this.fundedAt = fundedAt;
    }
}
