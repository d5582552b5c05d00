package com.parametric.policy;

import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.ledger.LedgerReceipt;
import com.parametric.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Policy issuance and client-driven lifecycle.
 */
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);
    private static final int SCAN_LIMIT = 10_000;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final DocumentStore<Policy> policies;
    private final PolicyStateMachine stateMachine;
    private final LedgerPublisher ledger;
    private final Clock clock;

    public PolicyService(DocumentStore<Policy> policies, PolicyStateMachine stateMachine,
                         LedgerPublisher ledger, Clock clock) {
        this.policies = policies;
        this.stateMachine = stateMachine;
        this.ledger = ledger;
        this.clock = clock;
    }

    /**
     * Stores the policy as {@code draft} and registers it, its initial status and one
     * rule per trigger condition on the ledger. The first rule becomes the policy's rule ref.
     */
    public Policy issuePolicy(PolicyApplication application) {
        validate(application);

        Instant now = clock.instant();
        Policy policy = new Policy();
        policy.setPolicyId("POL-" + UUID.randomUUID());
        policy.setBeneficiaryAccountId(application.beneficiaryAccountId());
        policy.setPoolId(application.poolId());
        policy.setProductType(application.productType());
        policy.setStatus(PolicyStatus.DRAFT);
        policy.setTriggerConditions(application.triggerConditions());
        policy.setCoverageDetails(application.coverageDetails());
        policy.setPremiumStructure(application.premiumStructure());
        policy.setReinsuranceDetails(application.reinsuranceDetails());
        policy.setCoverageStart(application.coverageStart());
        policy.setCoverageEnd(application.coverageEnd());
        policy.setCreatedAt(now);
        policies.insert(policy);

        String policyId = policy.getPolicyId();
        CoverageDetails coverage = application.coverageDetails();
        LedgerReceipt registered = ledger.publish(LedgerChannel.POLICY_REGISTRY,
            LedgerMessage.of(LedgerMessage.POLICY_REGISTERED)
                .with("policyId", policyId)
                .with("beneficiaryAccountId", policy.getBeneficiaryAccountId())
                .with("poolId", policy.getPoolId())
                .with("productType", policy.getProductType())
                .with("maxPayout", coverage.maxPayout().toPlainString())
                .with("deductible", coverage.deductible().toPlainString())
                .with("currency", coverage.currency())
                .with("coverageStart", policy.getCoverageStart().toString())
                .with("coverageEnd", policy.getCoverageEnd().toString())
                .build());
        ledger.publish(LedgerChannel.POLICY_STATUS, LedgerMessage.of(LedgerMessage.POLICY_STATUS_INIT)
            .with("policyId", policyId)
            .with("status", PolicyStatus.DRAFT.getValue())
            .build());

        LedgerReceipt firstRule = null;
        List<TriggerCondition> conditions = policy.getTriggerConditions();
        for (int i = 0; i < conditions.size(); i++) {
            TriggerCondition condition = conditions.get(i);
            LedgerReceipt rule = ledger.publish(LedgerChannel.RULES, LedgerMessage.of(LedgerMessage.RULE_CREATED)
                .with("policyId", policyId)
                .with("conditionIndex", i)
                .with("parameter", condition.parameter())
                .with("operator", condition.operator().getValue())
                .with("threshold", condition.threshold())
                .with("unit", condition.unit())
                .with("measurementPeriod", condition.measurementPeriod())
                .build());
            if (firstRule == null) {
                firstRule = rule;
            }
        }

        LedgerReceipt ruleReceipt = firstRule;
        Policy stored = policies.update(policyId, p -> {
            p.setRegistryRef(registered.toRef());
            p.setRuleRef(ruleReceipt.toRef());
            return p;
        });
        log.info("Policy {} issued for beneficiary {} (max payout {} {}, {} conditions)",
            policyId, stored.getBeneficiaryAccountId(), coverage.maxPayout().toPlainString(),
            coverage.currency(), conditions.size());
        return stored;
    }

    public Policy activatePolicy(String policyId) {
        Policy policy = policies.require(policyId);
        if (policy.getCoverageEnd() != null && !clock.instant().isBefore(policy.getCoverageEnd())) {
            throw new ValidationException("policy " + policyId + " coverage ended at " + policy.getCoverageEnd());
        }
        return stateMachine.transition(policyId, PolicyStatus.ACTIVE, "activated");
    }

    public Policy cancelPolicy(String policyId, String reason) {
        return stateMachine.transition(policyId, PolicyStatus.CANCELLED,
            reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public Policy getPolicy(String policyId) {
        return policies.require(policyId);
    }

    /** Moves draft and active policies whose coverage has ended to {@code expired}. */
    public int expirePolicies() {
        Instant now = clock.instant();
        List<Policy> due = policies.find(p -> (p.getStatus() == PolicyStatus.DRAFT || p.getStatus() == PolicyStatus.ACTIVE)
            && p.getCoverageEnd() != null && !now.isBefore(p.getCoverageEnd()), SCAN_LIMIT);
        int expired = 0;
        for (Policy policy : due) {
            try {
                stateMachine.transition(policy.getPolicyId(), PolicyStatus.EXPIRED, "coverage period ended");
                expired++;
            } catch (InvalidStateTransitionException ex) {
                // triggered concurrently; the payout now owns the policy
                log.debug("Policy {} not expired: {}", policy.getPolicyId(), ex.getMessage());
            }
        }
        return expired;
    }

    private static void validate(PolicyApplication application) {
        if (application == null) {
            throw new ValidationException("policy application is required");
        }
        requireText(application.beneficiaryAccountId(), "beneficiary_account_id");
        requireText(application.poolId(), "pool_id");
        if (application.triggerConditions() == null || application.triggerConditions().isEmpty()) {
            throw new ValidationException("at least one trigger condition is required");
        }
        for (TriggerCondition condition : application.triggerConditions()) {
            if (condition == null) {
                throw new ValidationException("trigger condition must not be null");
            }
            requireText(condition.parameter(), "trigger_conditions.parameter");
            if (condition.operator() == null) {
                throw new ValidationException("trigger_conditions.operator is required");
            }
            if (!Double.isFinite(condition.threshold())) {
                throw new ValidationException("trigger_conditions.threshold must be a finite number");
            }
        }

        CoverageDetails coverage = application.coverageDetails();
        if (coverage == null || coverage.maxPayout() == null || coverage.deductible() == null) {
            throw new ValidationException("coverage_details with max_payout and deductible is required");
        }
        if (coverage.maxPayout().signum() <= 0) {
            throw new ValidationException("max_payout must be positive");
        }
        if (coverage.deductible().signum() < 0) {
            throw new ValidationException("deductible must not be negative");
        }
        requireText(coverage.currency(), "currency");

        if (application.coverageStart() == null || application.coverageEnd() == null
            || !application.coverageEnd().isAfter(application.coverageStart())) {
            throw new ValidationException("coverage_end must be after coverage_start");
        }

        ReinsuranceDetails reinsurance = application.reinsuranceDetails();
        if (reinsurance != null) {
            requireText(reinsurance.reinsurerId(), "reinsurer_id");
            if (reinsurance.retentionLimit() == null || reinsurance.retentionLimit().signum() <= 0) {
                throw new ValidationException("retention_limit must be positive");
            }
            BigDecimal share = reinsurance.cessionPercentage();
            if (share != null && (share.signum() < 0 || share.compareTo(HUNDRED) > 0)) {
                throw new ValidationException("cession_percentage must be within [0, 100]");
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
