package com.parametric.trigger;

import com.parametric.bus.SettlementEvent;
import com.parametric.config.SettlementProperties;
import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.NotFoundException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyStatus;
import com.parametric.support.SettlementHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.parametric.support.SettlementHarness.application;
import static com.parametric.support.SettlementHarness.heatAbove;
import static com.parametric.support.SettlementHarness.heatReading;
import static org.junit.jupiter.api.Assertions.*;

class TriggerServiceTest {

    private SettlementHarness harness;
    private TriggerService triggers;

    @BeforeEach
    void setUp() {
        harness = new SettlementHarness(new SettlementProperties(), false);
        triggers = harness.triggerService;
    }

    @Test
    @DisplayName("A met condition validates the trigger and moves the policy to triggered")
    void metCondition_validatesTrigger() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);

        Trigger trigger = triggers.ingest(policy.getPolicyId(), heatReading(36.5), "station-feed");

        assertEquals(TriggerStatus.VALIDATED, trigger.getStatus());
        assertEquals(0, trigger.getTriggerConditionMet().conditionIndex());
        assertNotNull(trigger.getTriggerRef());
        assertNotNull(trigger.getValidatedAt());
        assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        assertEquals(1, harness.ledger.log().messages(LedgerChannel.TRIGGERS, LedgerMessage.TRIGGER_OBSERVED).size());
        assertEquals(1, harness.bus.query(SettlementEvent.TriggerValidated.class).size());
    }

    @Test
    void unmetCondition_leavesTriggerPending() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);

        Trigger trigger = triggers.ingest(policy.getPolicyId(), heatReading(34.999), "station-feed");

        assertEquals(TriggerStatus.PENDING, trigger.getStatus());
        assertNull(trigger.getTriggerConditionMet());
        assertEquals(PolicyStatus.ACTIVE, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        assertTrue(harness.bus.query(SettlementEvent.TriggerValidated.class).isEmpty());
    }

    @Test
    @DisplayName("The same event reported twice yields one trigger")
    void duplicateReport_returnsExistingTrigger() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);

        Trigger first = triggers.ingest(policy.getPolicyId(), heatReading(36.5), "station-feed");
        Trigger second = triggers.ingest(policy.getPolicyId(), heatReading(37.0), "satellite-feed");

        assertEquals(first.getTriggerId(), second.getTriggerId());
        assertEquals(1, triggers.triggersForPolicy(policy.getPolicyId()).size());
        assertEquals(1, harness.ledger.log().messages(LedgerChannel.TRIGGERS, LedgerMessage.TRIGGER_OBSERVED).size());
    }

    @Test
    void metConditionOnDraftPolicy_isRejected() {
        Policy draft = harness.policyService.issuePolicy(application("POOL-1", "10000", "0", null, heatAbove(35.0)));

        Trigger trigger = triggers.ingest(draft.getPolicyId(), heatReading(40.0), "station-feed");

        assertEquals(TriggerStatus.REJECTED, trigger.getStatus());
        assertEquals(RejectionReason.POLICY_NOT_ACTIVE, trigger.getRejectionReason());
        assertEquals(PolicyStatus.DRAFT, harness.policyService.getPolicy(draft.getPolicyId()).getStatus());
        assertEquals(1, harness.bus.query(SettlementEvent.TriggerRejected.class).size());
    }

    @Test
    @DisplayName("Triggers left pending past the timeout are rejected")
    void staleTriggers_areRejected() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);
        Trigger pending = triggers.ingest(policy.getPolicyId(), heatReading(20.0), "station-feed");

        harness.clock.advance(Duration.ofHours(23));
        assertEquals(0, triggers.rejectStaleTriggers());

        harness.clock.advance(Duration.ofHours(1));
        assertEquals(1, triggers.rejectStaleTriggers());

        Trigger rejected = triggers.getTrigger(pending.getTriggerId());
        assertEquals(TriggerStatus.REJECTED, rejected.getStatus());
        assertEquals(RejectionReason.NO_CONDITION_MET, rejected.getRejectionReason());
        assertNotNull(rejected.getClosedAt());
        assertEquals(0, triggers.rejectStaleTriggers());
    }

    @Test
    void markProcessed_requiresValidatedTrigger() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);
        Trigger pending = triggers.ingest(policy.getPolicyId(), heatReading(20.0), "station-feed");

        assertThrows(InvalidStateTransitionException.class, () -> triggers.markProcessed(pending.getTriggerId(), "PAY-1"));
    }

    @Test
    void invalidInput_isRejected() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);

        assertThrows(NotFoundException.class, () -> triggers.ingest("POL-missing", heatReading(40.0), "feed"));
        assertThrows(ValidationException.class, () -> triggers.ingest(policy.getPolicyId(), heatReading(Double.NaN), "feed"));
        assertThrows(ValidationException.class, () -> triggers.ingest(policy.getPolicyId(), heatReading(40.0), " "));
    }

    @Test
    @DisplayName("Concurrent reports of one event record a single trigger")
    void concurrentDuplicates_recordOneTrigger() throws Exception {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Trigger>> futures = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            String source = "feed-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                return triggers.ingest(policy.getPolicyId(), heatReading(36.5), source);
            }));
        }
        start.countDown();
        Set<String> triggerIds = new HashSet<>();
        for (Future<Trigger> future : futures) {
            triggerIds.add(future.get(30, TimeUnit.SECONDS).getTriggerId());
        }
        executor.shutdown();

        assertEquals(1, triggerIds.size());
        assertEquals(1, triggers.triggersForPolicy(policy.getPolicyId()).size());
        assertEquals(1, harness.ledger.log().messages(LedgerChannel.TRIGGERS, LedgerMessage.TRIGGER_OBSERVED).size());
        assertEquals(1, harness.bus.query(SettlementEvent.TriggerValidated.class).size());
        assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
    }

    @Test
    @DisplayName("A policy move the ledger refuses keeps the trigger pending until the retry sweep")
    void unanchoredPolicyMove_isRetried() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);
        harness.ledger.failMessages(LedgerMessage.POLICY_STATUS_CHANGED, 1);

        Trigger waiting = triggers.ingest(policy.getPolicyId(), heatReading(36.5), "station-feed");

        assertEquals(TriggerStatus.PENDING, waiting.getStatus());
        assertNotNull(waiting.getValidationError());
        assertNotNull(waiting.getTriggerConditionMet());
        Policy stillActive = harness.policyService.getPolicy(policy.getPolicyId());
        assertEquals(PolicyStatus.ACTIVE, stillActive.getStatus());
        assertEquals(1, stillActive.getStatusHistory().size());
        assertTrue(harness.bus.query(SettlementEvent.TriggerValidated.class).isEmpty());

        harness.clock.advance(Duration.ofHours(25));
        assertEquals(0, triggers.rejectStaleTriggers());

        assertEquals(1, triggers.retryPendingValidations());
        Trigger validated = triggers.getTrigger(waiting.getTriggerId());
        assertEquals(TriggerStatus.VALIDATED, validated.getStatus());
        assertNull(validated.getValidationError());
        assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        assertEquals(1, harness.bus.query(SettlementEvent.TriggerValidated.class).size());
        assertEquals(0, triggers.retryPendingValidations());
    }

    @Test
    void redeliveredEvent_retriesUnanchoredValidation() {
        Policy policy = harness.activePolicy("POOL-1", "10000", "0", null);
        harness.ledger.failMessages(LedgerMessage.POLICY_STATUS_CHANGED, 1);
        Trigger waiting = triggers.ingest(policy.getPolicyId(), heatReading(36.5), "station-feed");

        Trigger again = triggers.ingest(policy.getPolicyId(), heatReading(36.5), "station-feed");

        assertEquals(waiting.getTriggerId(), again.getTriggerId());
        assertEquals(TriggerStatus.VALIDATED, again.getStatus());
        assertEquals(1, triggers.triggersForPolicy(policy.getPolicyId()).size());
        assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
    }
}
