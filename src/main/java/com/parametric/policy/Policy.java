package com.parametric.policy;

import com.parametric.ledger.LedgerRef;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class Policy {

    private String policyId;
    private String beneficiaryAccountId;
    private String poolId;
    private String productType;
    private PolicyStatus status;
    private List<TriggerCondition> triggerConditions = new ArrayList<>();
    private CoverageDetails coverageDetails;
    private PremiumStructure premiumStructure;
    private ReinsuranceDetails reinsuranceDetails;
    private Instant coverageStart;
    private Instant coverageEnd;
    private Instant createdAt;
    private LedgerRef registryRef;
    private LedgerRef ruleRef;
    private List<StatusChange> statusHistory = new ArrayList<>();

    public boolean hasReinsurance() {
        return reinsuranceDetails != null && reinsuranceDetails.retentionLimit() != null;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
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

    public String getProductType() {
        return productType;
    }

    public void setProductType(String productType) {
        this.productType = productType;
    }

    public PolicyStatus getStatus() {
        return status;
    }

    public void setStatus(PolicyStatus status) {
        this.status = status;
    }

    public List<TriggerCondition> getTriggerConditions() {
        return triggerConditions;
    }

    public void setTriggerConditions(List<TriggerCondition> triggerConditions) {
        this.triggerConditions = triggerConditions == null ? new ArrayList<>() : new ArrayList<>(triggerConditions);
    }

    public CoverageDetails getCoverageDetails() {
        return coverageDetails;
    }

    public void setCoverageDetails(CoverageDetails coverageDetails) {
        this.coverageDetails = coverageDetails;
    }

    public PremiumStructure getPremiumStructure() {
        return premiumStructure;
    }

    public void setPremiumStructure(PremiumStructure premiumStructure) {
        this.premiumStructure = premiumStructure;
    }

    public ReinsuranceDetails getReinsuranceDetails() {
        return reinsuranceDetails;
    }

    public void setReinsuranceDetails(ReinsuranceDetails reinsuranceDetails) {
        this.reinsuranceDetails = reinsuranceDetails;
    }

    public Instant getCoverageStart() {
        return coverageStart;
    }

    public void setCoverageStart(Instant coverageStart) {
        this.coverageStart = coverageStart;
    }

    public Instant getCoverageEnd() {
        return coverageEnd;
    }

    public void setCoverageEnd(Instant coverageEnd) {
        this.coverageEnd = coverageEnd;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public LedgerRef getRegistryRef() {
        return registryRef;
    }

    public void setRegistryRef(LedgerRef registryRef) {
        this.registryRef = registryRef;
    }

    public LedgerRef getRuleRef() {
        return ruleRef;
    }

    public void setRuleRef(LedgerRef ruleRef) {
        this.ruleRef = ruleRef;
    }

    public List<StatusChange> getStatusHistory() {
        return statusHistory;
    }

    public void setStatusHistory(List<StatusChange> statusHistory) {
        this.statusHistory = statusHistory == null ? new ArrayList<>() : new ArrayList<>(statusHistory);
    }
}
