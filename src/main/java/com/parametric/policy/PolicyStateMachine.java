package com.parametric.policy;

import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.LedgerPublishException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies policy status transitions atomically against the store and anchors each
 * change on the policy-status channel.
 *
 * <p>A change the ledger refuses is rolled back before the failure is rethrown, so a
 * caller may simply retry it.
 *
 * <p>{@code paid_out} is not reachable through {@link #transition}; only
 * {@link #markPaidOut} sets it, once every payout leg has completed.
 */
public class PolicyStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PolicyStateMachine.class);

    private final DocumentStore<Policy> policies;
    private final LedgerPublisher ledger;
    private final Clock clock;

    public PolicyStateMachine(DocumentStore<Policy> policies, LedgerPublisher ledger, Clock clock) {
        this.policies = policies;
        this.ledger = ledger;
        this.clock = clock;
    }

    public Policy transition(String policyId, PolicyStatus to, String reason) {
        if (to == PolicyStatus.PAID_OUT) {
            throw new ValidationException("paid_out is set by payout settlement only");
        }
        return apply(policyId, to, reason);
    }

    public Policy markPaidOut(String policyId, String payoutId) {
        return apply(policyId, PolicyStatus.PAID_OUT, "payout " + payoutId + " completed");
    }

    private Policy apply(String policyId, PolicyStatus to, String reason) {
        Instant now = clock.instant();
        AtomicReference<PolicyStatus> previous = new AtomicReference<>();
        Policy updated = policies.update(policyId, policy -> {
            PolicyStatus from = policy.getStatus();
            if (!from.canMoveTo(to)) {
                throw new InvalidStateTransitionException("policy", policyId, from.getValue(), to.getValue());
            }
            previous.set(from);
            policy.setStatus(to);
            policy.getStatusHistory().add(new StatusChange(from, to, reason, now));
            return policy;
        });

        try {
            ledger.publish(LedgerChannel.POLICY_STATUS, LedgerMessage.of(LedgerMessage.POLICY_STATUS_CHANGED)
                .with("policyId", policyId)
                .with("from", previous.get().getValue())
                .with("to", to.getValue())
                .with("reason", reason)
                .with("changedAt", now.toString())
                .build());
        } catch (LedgerPublishException ex) {
            rollBack(policyId, previous.get(), to);
            log.warn("Policy {} {} -> {} rolled back, status change not anchored: {}", policyId,
                previous.get().getValue(), to.getValue(), ex.getMessage());
            throw ex;
        }
        log.info("Policy {} {} -> {} ({})", policyId, previous.get().getValue(), to.getValue(), reason);
        return updated;
    }

    private void rollBack(String policyId, PolicyStatus from, PolicyStatus to) {
        policies.update(policyId, policy -> {
            if (policy.getStatus() == to) {
                policy.setStatus(from);
                List<StatusChange> history = policy.getStatusHistory();
                if (!history.isEmpty() && history.get(history.size() - 1).to() == to) {
                    history.remove(history.size() - 1);
                }
            }
            return policy;
        });
    }
}
