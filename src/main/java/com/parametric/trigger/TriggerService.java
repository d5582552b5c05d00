package com.parametric.trigger;

import com.parametric.bus.SettlementBus;
import com.parametric.bus.SettlementEvent;
import com.parametric.config.SettlementProperties;
import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.LedgerPublishException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.ledger.LedgerReceipt;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyStateMachine;
import com.parametric.policy.PolicyStatus;
import com.parametric.store.DocumentStore;
import com.parametric.store.StripedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trigger ingestion surface.
 *
 * <p>Ingestion for one policy is serialized, which makes the duplicate check and the
 * {@code active -> triggered} move a single step: at most one trigger per policy is
 * ever validated.
 */
public class TriggerService {

    private static final Logger log = LoggerFactory.getLogger(TriggerService.class);
    private static final int SCAN_LIMIT = 10_000;

    private final DocumentStore<Trigger> triggers;
    private final DocumentStore<Policy> policies;
    private final PolicyStateMachine policyStateMachine;
    private final TriggerEvaluator evaluator;
    private final LedgerPublisher ledger;
    private final SettlementBus bus;
    private final SettlementProperties properties;
    private final Clock clock;
    private final StripedLocks policyLocks = new StripedLocks();

    public TriggerService(DocumentStore<Trigger> triggers,
                          DocumentStore<Policy> policies,
                          PolicyStateMachine policyStateMachine,
                          TriggerEvaluator evaluator,
                          LedgerPublisher ledger,
                          SettlementBus bus,
                          SettlementProperties properties,
                          Clock clock) {
        this.triggers = triggers;
        this.policies = policies;
        this.policyStateMachine = policyStateMachine;
        this.evaluator = evaluator;
        this.ledger = ledger;
        this.bus = bus;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records an observed event against a policy and evaluates it. A second report for
     * the same (policy, parameter, location, window) returns the trigger already recorded.
     */
    public Trigger ingest(String policyId, EventData eventData, String source) {
        validate(eventData);
        if (source == null || source.isBlank()) {
            throw new ValidationException("source is required");
        }
        policies.require(policyId);

        List<SettlementEvent> outbox = new ArrayList<>();
        Trigger result;
        ReentrantLock lock = policyLocks.lockFor(policyId);
        lock.lock();
        try {
            result = ingestLocked(policyId, eventData, source, outbox);
        } finally {
            lock.unlock();
        }
        outbox.forEach(bus::publish);
        return result;
    }

    private Trigger ingestLocked(String policyId, EventData eventData, String source, List<SettlementEvent> outbox) {
        String dedupKey = dedupKey(policyId, eventData);
        Optional<Trigger> existing = triggers.find(t -> dedupKey.equals(t.getDedupKey()), 1).stream().findFirst();
        if (existing.isPresent()) {
            Trigger known = existing.get();
            if (awaitingValidation(known)) {
                log.info("Event for policy {} redelivered, re-evaluating trigger {}", policyId, known.getTriggerId());
                return evaluateLocked(known.getTriggerId(), outbox);
            }
            log.info("Duplicate event for policy {} ignored, returning trigger {}", policyId, known.getTriggerId());
            return known;
        }

        Instant now = clock.instant();
        String triggerId = "TRG-" + UUID.randomUUID();
        LedgerReceipt observed = ledger.publish(LedgerChannel.TRIGGERS, LedgerMessage.of(LedgerMessage.TRIGGER_OBSERVED)
            .with("triggerId", triggerId)
            .with("policyId", policyId)
            .with("parameter", eventData.parameter())
            .with("value", eventData.value())
            .with("unit", eventData.unit())
            .with("source", source)
            .with("observedAt", now.toString())
            .build());

        Trigger trigger = new Trigger();
        trigger.setTriggerId(triggerId);
        trigger.setPolicyId(policyId);
        trigger.setEventData(eventData);
        trigger.setSource(source);
        trigger.setDedupKey(dedupKey);
        trigger.setStatus(TriggerStatus.PENDING);
        trigger.setTriggerRef(observed.toRef());
        trigger.setCreatedAt(now);
        triggers.insert(trigger);
        log.info("Trigger {} recorded for policy {}: {}={} from {}", triggerId, policyId,
            eventData.parameter(), eventData.value(), source);
        return evaluateLocked(triggerId, outbox);
    }

    /**
     * Evaluates a pending trigger against its policy. When the policy move to
     * {@code triggered} cannot be anchored, the trigger stays pending with
     * {@code validationError} set and is evaluated again later.
     */
    private Trigger evaluateLocked(String triggerId, List<SettlementEvent> outbox) {
        Trigger trigger = triggers.require(triggerId);
        String policyId = trigger.getPolicyId();
        EventData eventData = trigger.getEventData();
        Policy policy = policies.require(policyId);
        Optional<ConditionMatch> match = evaluator.evaluate(eventData, policy.getTriggerConditions());
        if (match.isEmpty()) {
            log.debug("Trigger {} met no condition of policy {}, left pending", triggerId, policyId);
            return trigger;
        }

        Instant now = clock.instant();
        try {
            policyStateMachine.transition(policyId, PolicyStatus.TRIGGERED, "trigger " + triggerId + " validated");
        } catch (InvalidStateTransitionException ex) {
            Trigger rejected = close(triggerId, TriggerStatus.REJECTED, RejectionReason.POLICY_NOT_ACTIVE, match.get(), now);
            log.warn("Trigger {} met condition {} but policy {} is {}", triggerId,
                match.get().conditionIndex(), policyId, policy.getStatus().getValue());
            outbox.add(new SettlementEvent.TriggerRejected(triggerId, policyId, RejectionReason.POLICY_NOT_ACTIVE.name()));
            return rejected;
        } catch (LedgerPublishException ex) {
            Trigger waiting = triggers.update(triggerId, t -> {
                t.setTriggerConditionMet(match.get());
                t.setValidationError(ex.getMessage());
                return t;
            });
            log.warn("Trigger {} met condition {} but policy {} could not be marked triggered, will retry: {}",
                triggerId, match.get().conditionIndex(), policyId, ex.getMessage());
            return waiting;
        }

        Trigger validated = triggers.update(triggerId, t -> {
            t.setStatus(TriggerStatus.VALIDATED);
            t.setTriggerConditionMet(match.get());
            t.setValidationError(null);
            t.setValidatedAt(now);
            return t;
        });
        log.info("Trigger {} validated for policy {}: {} {} {} (condition {})", triggerId, policyId,
            eventData.value(), match.get().operator().getValue(), match.get().thresholdValue(),
            match.get().conditionIndex());
        outbox.add(new SettlementEvent.TriggerValidated(triggerId, policyId));
        return validated;
    }

    /** Re-evaluates pending triggers whose validation could not be anchored; returns how many left {@code pending}. */
    public int retryPendingValidations() {
        List<Trigger> waiting = triggers.find(TriggerService::awaitingValidation, SCAN_LIMIT);
        int resolved = 0;
        for (Trigger candidate : waiting) {
            List<SettlementEvent> outbox = new ArrayList<>();
            Trigger after;
            ReentrantLock lock = policyLocks.lockFor(candidate.getPolicyId());
            lock.lock();
            try {
                Trigger current = triggers.require(candidate.getTriggerId());
                after = awaitingValidation(current) ? evaluateLocked(current.getTriggerId(), outbox) : current;
            } finally {
                lock.unlock();
            }
            outbox.forEach(bus::publish);
            if (after.getStatus() != TriggerStatus.PENDING) {
                resolved++;
            }
        }
        return resolved;
    }

    private static boolean awaitingValidation(Trigger trigger) {
        return trigger.getStatus() == TriggerStatus.PENDING && trigger.getValidationError() != null;
    }

    /** Closes a validated trigger once its payout exists. */
    public Trigger markProcessed(String triggerId, String payoutId) {
        Instant now = clock.instant();
        return triggers.update(triggerId, t -> {
            if (t.getStatus() != TriggerStatus.VALIDATED) {
                throw new InvalidStateTransitionException("trigger", triggerId,
                    t.getStatus().getValue(), TriggerStatus.PROCESSED.getValue());
            }
            t.setStatus(TriggerStatus.PROCESSED);
            t.setPayoutId(payoutId);
            t.setClosedAt(now);
            return t;
        });
    }

    /**
     * Rejects triggers that stayed pending longer than the pending timeout. Triggers whose
     * condition was met and only await anchoring are left to {@link #retryPendingValidations}.
     */
    public int rejectStaleTriggers() {
        Instant cutoff = clock.instant().minus(properties.getTrigger().getPendingTimeout());
        List<Trigger> stale = triggers.find(t -> t.getStatus() == TriggerStatus.PENDING
            && !awaitingValidation(t)
            && !t.getCreatedAt().isAfter(cutoff), SCAN_LIMIT);
        int rejected = 0;
        for (Trigger candidate : stale) {
            ReentrantLock lock = policyLocks.lockFor(candidate.getPolicyId());
            boolean closed;
            lock.lock();
            try {
                Trigger current = triggers.require(candidate.getTriggerId());
                closed = current.getStatus() == TriggerStatus.PENDING && !awaitingValidation(current);
                if (closed) {
                    close(current.getTriggerId(), TriggerStatus.REJECTED, RejectionReason.NO_CONDITION_MET, null, clock.instant());
                }
            } finally {
                lock.unlock();
            }
            if (closed) {
                rejected++;
                log.warn("Trigger {} for policy {} rejected: no condition met within {}",
                    candidate.getTriggerId(), candidate.getPolicyId(), properties.getTrigger().getPendingTimeout());
                bus.publish(new SettlementEvent.TriggerRejected(candidate.getTriggerId(), candidate.getPolicyId(),
                    RejectionReason.NO_CONDITION_MET.name()));
            }
        }
        return rejected;
    }

    public Trigger getTrigger(String triggerId) {
        return triggers.require(triggerId);
    }

    public List<Trigger> triggersForPolicy(String policyId) {
        return triggers.find(t -> policyId.equals(t.getPolicyId()), SCAN_LIMIT);
    }

    private Trigger close(String triggerId, TriggerStatus status, RejectionReason reason, ConditionMatch match, Instant now) {
        return triggers.update(triggerId, t -> {
            t.setStatus(status);
            t.setRejectionReason(reason);
            t.setTriggerConditionMet(match);
            t.setClosedAt(now);
            return t;
        });
    }

    static String dedupKey(String policyId, EventData eventData) {
        return policyId
            + "|" + eventData.parameter()
            + "|" + (eventData.location() == null ? "-" : eventData.location().key())
            + "|" + (eventData.window() == null ? "-" : eventData.window().key());
    }

    private static void validate(EventData eventData) {
        if (eventData == null) {
            throw new ValidationException("event_data is required");
        }
        if (eventData.parameter() == null || eventData.parameter().isBlank()) {
            throw new ValidationException("event_data.parameter is required");
        }
        if (!Double.isFinite(eventData.value())) {
            throw new ValidationException("event_data.value must be a finite number");
        }
    }
}
