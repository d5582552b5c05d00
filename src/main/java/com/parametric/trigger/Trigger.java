package com.parametric.trigger;

import com.parametric.ledger.LedgerRef;

import java.time.Instant;

public class Trigger {

    private String triggerId;
    private String policyId;
    private EventData eventData;
    private String source;
    private String dedupKey;
    private TriggerStatus status;
    private ConditionMatch triggerConditionMet;
    private RejectionReason rejectionReason;
    private LedgerRef triggerRef;
    private String payoutId;
    private String validationError;
    private Instant createdAt;
    private Instant validatedAt;
    private Instant closedAt;

    public String getTriggerId() {
        return triggerId;
    }

    public void setTriggerId(String triggerId) {
        this.triggerId = triggerId;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public EventData getEventData() {
        return eventData;
    }

    public void setEventData(EventData eventData) {
        this.eventData = eventData;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public void setDedupKey(String dedupKey) {
        this.dedupKey = dedupKey;
    }

    public TriggerStatus getStatus() {
        return status;
    }

    public void setStatus(TriggerStatus status) {
        this.status = status;
    }

    public ConditionMatch getTriggerConditionMet() {
        return triggerConditionMet;
    }

    public void setTriggerConditionMet(ConditionMatch triggerConditionMet) {
        this.triggerConditionMet = triggerConditionMet;
    }

    public RejectionReason getRejectionReason() {
        return rejectionReason;
    }

    public void setRejectionReason(RejectionReason rejectionReason) {
        this.rejectionReason = rejectionReason;
    }

    public LedgerRef getTriggerRef() {
        return triggerRef;
    }

    public void setTriggerRef(LedgerRef triggerRef) {
        this.triggerRef = triggerRef;
    }

    public String getPayoutId() {
        return payoutId;
    }

    public void setPayoutId(String payoutId) {
        this.payoutId = payoutId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public void setValidatedAt(Instant validatedAt) {
        this.validatedAt = validatedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    /** Set while a met condition could not yet move the policy to triggered. */
    public String getValidationError() {
        return validationError;
    }

    public void setValidationError(String validationError) {
        this.validationError = validationError;
    }
}
