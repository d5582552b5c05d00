package com.parametric.payout;

import com.parametric.bus.SettlementEvent;
import com.parametric.cession.CessionRecord;
import com.parametric.cession.CessionRequest;
import com.parametric.cession.CessionStatus;
import com.parametric.config.SettlementProperties;
import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyStatus;
import com.parametric.policy.ReinsuranceDetails;
import com.parametric.pool.ReservationStatus;
import com.parametric.pool.RiskPool;
import com.parametric.support.SettlementHarness;
import com.parametric.trigger.Trigger;
import com.parametric.trigger.TriggerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
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

import static com.parametric.support.SettlementHarness.heatReading;
import static org.junit.jupiter.api.Assertions.*;

class PayoutOrchestratorTest {

    private SettlementHarness harness;
    private PayoutOrchestrator orchestrator;
    private RiskPool pool;

    @BeforeEach
    void setUp() {
        harness = new SettlementHarness();
        orchestrator = harness.orchestrator;
        pool = harness.fundedPool("200000");
    }

    @Nested
    @DisplayName("Pool-only payouts")
    class PoolOnly {

        @Test
        @DisplayName("A validated trigger settles through a single pool leg")
        void validatedTrigger_settlesFromPool() {
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "5000", null);

            Trigger trigger = harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            assertEquals(PayoutStatus.COMPLETED, payout.getStatus());
            assertEquals(0, new BigDecimal("45000").compareTo(payout.getCalculation().netPayout()));
            assertEquals(0, new BigDecimal("45000").compareTo(payout.getPoolAmount()));
            assertEquals(0, BigDecimal.ZERO.compareTo(payout.getCessionAmount()));
            assertNull(payout.getReinsuranceRecovery());
            assertNotNull(payout.getCompletedAt());
            assertEquals(1, payout.getRiskPoolDistributions().size());

            List<PayoutTransaction> legs = orchestrator.transactionsForPayout(payout.getPayoutId());
            assertEquals(1, legs.size());
            assertEquals(FundingSource.POOL, legs.get(0).getSource());
            assertEquals(TransactionStatus.COMPLETED, legs.get(0).getStatus());
            assertNotNull(legs.get(0).getLedgerTransactionId());

            RiskPool after = harness.liquidityLedger.getPool(pool.getPoolId());
            assertEquals(0, new BigDecimal("155000").compareTo(after.getAvailableLiquidity()));
            assertEquals(0, BigDecimal.ZERO.compareTo(after.getReservedLiquidity()));
            assertEquals(0, new BigDecimal("45000").compareTo(after.getCommittedOutflows()));

            Trigger processed = harness.triggerService.getTrigger(trigger.getTriggerId());
            assertEquals(TriggerStatus.PROCESSED, processed.getStatus());
            assertEquals(payout.getPayoutId(), processed.getPayoutId());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
            assertEquals(1, harness.bus.query(SettlementEvent.PayoutSettled.class).size());
            assertEquals(1, harness.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.PAYOUT_EXECUTED).size());
        }

        @Test
        void initiatingTwice_returnsTheSamePayout() {
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            Trigger trigger = harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout first = onlyPayout(policy);

            Payout again = orchestrator.initiatePayout(trigger.getTriggerId());

            assertEquals(first.getPayoutId(), again.getPayoutId());
            assertEquals(1, orchestrator.payoutsForPolicy(policy.getPolicyId()).size());
        }

        @Test
        void pendingTrigger_cannotStartPayout() {
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            Trigger pending = harness.triggerService.ingest(policy.getPolicyId(), heatReading(20.0), "station-feed");

            assertThrows(ValidationException.class, () -> orchestrator.initiatePayout(pending.getTriggerId()));
            assertTrue(orchestrator.payoutsForPolicy(policy.getPolicyId()).isEmpty());
        }

        @Test
        void zeroNetPayout_fails() {
            Policy policy = harness.activePolicy(pool.getPoolId(), "1000", "1000", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");

            Payout payout = onlyPayout(policy);
            assertEquals(PayoutStatus.FAILED, payout.getStatus());
            assertEquals(FailureReason.NON_POSITIVE_PAYOUT, payout.getFailureReason());
            assertTrue(orchestrator.transactionsForPayout(payout.getPayoutId()).isEmpty());
        }

        @Test
        @DisplayName("A pool that cannot cover its share fails the leg and the payout")
        void shortfall_failsPayout() {
            RiskPool small = harness.fundedPool("10000");
            Policy policy = harness.activePolicy(small.getPoolId(), "45000", "0", null);

            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            assertEquals(PayoutStatus.FAILED, payout.getStatus());
            assertEquals(FailureReason.INSUFFICIENT_LIQUIDITY, payout.getFailureReason());
            List<PayoutTransaction> failed = orchestrator.transactionsByStatus(TransactionStatus.FAILED);
            assertEquals(1, failed.size());
            assertEquals(FailureReason.INSUFFICIENT_LIQUIDITY, failed.get(0).getFailureReason());
            assertEquals(0, new BigDecimal("10000").compareTo(
                harness.liquidityLedger.getPool(small.getPoolId()).getAvailableLiquidity()));
            assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
            assertEquals(1, harness.bus.query(SettlementEvent.PayoutLegFailed.class).size());
        }
    }

    @Nested
    @DisplayName("Reinsurance waterfall")
    class Waterfall {

        private Policy policy;

        @BeforeEach
        void issueReinsuredPolicy() {
            policy = harness.activePolicy(pool.getPoolId(), "100000", "0",
                new ReinsuranceDetails("RE-SWISS", new BigDecimal("20"), new BigDecimal("80000")));
        }

        @Test
        @DisplayName("Pool pays the retention, the reinsurer the excess, and the policy is paid out after both")
        void poolThenCession() {
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout inFlight = onlyPayout(policy);

            assertEquals(PayoutStatus.PROCESSING, inFlight.getStatus());
            assertEquals(0, new BigDecimal("100000").compareTo(inFlight.getCalculation().netPayout()));
            assertEquals(0, new BigDecimal("80000").compareTo(inFlight.getPoolAmount()));
            assertEquals(0, new BigDecimal("20000").compareTo(inFlight.getCessionAmount()));
            assertEquals(TransactionStatus.COMPLETED, leg(inFlight, FundingSource.POOL).getStatus());
            assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());

            CessionRecord cession = harness.cessionService.getCession(inFlight.getReinsuranceRecovery().cessionId());
            assertEquals(CessionStatus.REQUESTED, cession.getStatus());
            assertEquals(0, new BigDecimal("20000").compareTo(cession.getExcessAmount()));
            assertEquals(inFlight.getPayoutId(), cession.getPayoutId());
            assertEquals(1, harness.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.STOP_LOSS_BREACHED).size());

            harness.cessionService.funded(policy.getPolicyId(), new BigDecimal("20000"), "RE-SWISS", "re-tx-1");

            Payout settled = orchestrator.getPayout(inFlight.getPayoutId());
            assertEquals(PayoutStatus.COMPLETED, settled.getStatus());
            assertNotNull(settled.getReinsuranceRecovery().fundingId());
            PayoutTransaction cessionLeg = leg(settled, FundingSource.CESSION);
            assertEquals(TransactionStatus.COMPLETED, cessionLeg.getStatus());
            assertEquals(0, new BigDecimal("20000").compareTo(cessionLeg.getAmount()));
            assertEquals(cessionLeg.getTransactionId(), settled.getReinsuranceRecovery().transactionId());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
            assertEquals(0, new BigDecimal("80000").compareTo(
                harness.liquidityLedger.getPool(pool.getPoolId()).getCommittedOutflows()));
            assertEquals(2, harness.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.PAYOUT_EXECUTED).size());
        }

        @Test
        @DisplayName("Funding that arrives before the pool leg is final waits for it")
        void earlyFunding_waitsForPoolLeg() {
            harness.ledger.reportConfirmations(0L);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout inFlight = onlyPayout(policy);
            assertEquals(TransactionStatus.EXECUTING, leg(inFlight, FundingSource.POOL).getStatus());

            harness.cessionService.funded(policy.getPolicyId(), new BigDecimal("20000"), "RE-SWISS", "re-tx-1");
            Payout waiting = orchestrator.getPayout(inFlight.getPayoutId());
            assertNotNull(waiting.getReinsuranceRecovery().fundingId());
            assertEquals(1, orchestrator.transactionsForPayout(inFlight.getPayoutId()).size());

            harness.ledger.reportConfirmations(null);
            assertEquals(1, orchestrator.confirmFinality());

            Payout settled = orchestrator.getPayout(inFlight.getPayoutId());
            assertEquals(PayoutStatus.COMPLETED, settled.getStatus());
            assertEquals(TransactionStatus.COMPLETED, leg(settled, FundingSource.CESSION).getStatus());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        }

        @Test
        @DisplayName("A manual cession request already open is bound to the payout and settles it")
        void openManualRequest_settlesThePayout() {
            CessionRecord manual = harness.cessionService.request(new CessionRequest(policy.getPolicyId(), null,
                new BigDecimal("20000"), new BigDecimal("100000"), new BigDecimal("80000"), null, null));

            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout inFlight = onlyPayout(policy);

            assertEquals(manual.getCessionId(), inFlight.getReinsuranceRecovery().cessionId());
            assertEquals(inFlight.getPayoutId(), harness.cessionService.getCession(manual.getCessionId()).getPayoutId());
            assertEquals(1, harness.cessionService.cessionsForPolicy(policy.getPolicyId()).size());

            harness.cessionService.funded(policy.getPolicyId(), new BigDecimal("20000"), "RE-SWISS", "re-tx-1");

            Payout settled = orchestrator.getPayout(inFlight.getPayoutId());
            assertEquals(PayoutStatus.COMPLETED, settled.getStatus());
            assertEquals(TransactionStatus.COMPLETED, leg(settled, FundingSource.CESSION).getStatus());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        }
    }

    @Nested
    @DisplayName("Ledger failures")
    class LedgerFailures {

        @Test
        @DisplayName("With three attempts allowed an always-failing leg fails after exactly three")
        void alwaysFailing_stopsAfterMaxRetries() {
            harness.ledger.failPayoutExecutions(-1);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            PayoutTransaction afterFirst = leg(payout, FundingSource.POOL);
            assertEquals(TransactionStatus.PENDING_EXECUTION, afterFirst.getStatus());
            assertEquals(1, afterFirst.getRetryMechanism().currentRetry());
            assertEquals(harness.clock.instant().plusSeconds(30), afterFirst.getRetryMechanism().nextRetryAt());
            assertEquals(0, orchestrator.retryDueTransactions());

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());
            assertEquals(2, harness.ledger.payoutExecutionAttempts());

            harness.clock.advance(Duration.ofSeconds(59));
            assertEquals(0, orchestrator.retryDueTransactions());
            harness.clock.advance(Duration.ofSeconds(1));
            assertEquals(1, orchestrator.retryDueTransactions());

            PayoutTransaction failed = leg(payout, FundingSource.POOL);
            assertEquals(TransactionStatus.FAILED, failed.getStatus());
            assertEquals(FailureReason.LEDGER_PUBLISH_FAILED, failed.getFailureReason());
            assertEquals(3, failed.getRetryMechanism().currentRetry());
            assertEquals(3, harness.ledger.payoutExecutionAttempts());

            harness.clock.advance(Duration.ofHours(1));
            assertEquals(0, orchestrator.retryDueTransactions());
            assertEquals(3, harness.ledger.payoutExecutionAttempts());

            assertEquals(PayoutStatus.FAILED, orchestrator.getPayout(payout.getPayoutId()).getStatus());
            RiskPool after = harness.liquidityLedger.getPool(pool.getPoolId());
            assertEquals(0, new BigDecimal("200000").compareTo(after.getAvailableLiquidity()));
            assertEquals(0, BigDecimal.ZERO.compareTo(after.getReservedLiquidity()));
        }

        @Test
        void transientFailure_recoversOnRetry() {
            harness.ledger.failPayoutExecutions(1);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());

            Payout payout = onlyPayout(policy);
            assertEquals(PayoutStatus.COMPLETED, payout.getStatus());
            assertEquals(2, harness.ledger.payoutExecutionAttempts());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        }

        @Test
        @DisplayName("A leg that never reaches finality fails and keeps its reservation")
        void finalityTimeout_holdsReservation() {
            harness.ledger.reportConfirmations(1L);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            assertEquals(0, orchestrator.confirmFinality());
            harness.clock.advance(Duration.ofMinutes(11));
            assertEquals(1, orchestrator.confirmFinality());

            PayoutTransaction failed = leg(payout, FundingSource.POOL);
            assertEquals(TransactionStatus.FAILED, failed.getStatus());
            assertEquals(FailureReason.FINALITY_TIMEOUT, failed.getFailureReason());
            assertEquals(ReservationStatus.ACTIVE, harness.liquidityLedger
                .findReservation(failed.getLiquidityDetails().reservationId()).orElseThrow().getStatus());
            assertEquals(0, new BigDecimal("50000").compareTo(
                harness.liquidityLedger.getPool(pool.getPoolId()).getReservedLiquidity()));
            assertEquals(PayoutStatus.FAILED, orchestrator.getPayout(payout.getPayoutId()).getStatus());
        }

        @Test
        @DisplayName("A refused stop-loss breach is raised again by the retry sweep")
        void refusedBreach_isRetried() {
            harness.ledger.failMessages(LedgerMessage.STOP_LOSS_BREACHED, 1);
            Policy policy = reinsuredPolicy();
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");

            Payout waiting = onlyPayout(policy);
            assertEquals(PayoutStatus.PROCESSING, waiting.getStatus());
            assertNull(waiting.getReinsuranceRecovery().cessionId());
            assertEquals(1, waiting.getFollowUpRetry().currentRetry());
            assertEquals(harness.clock.instant().plusSeconds(30), waiting.getFollowUpRetry().nextRetryAt());
            assertTrue(harness.cessionService.cessionsForPolicy(policy.getPolicyId()).isEmpty());
            assertEquals(0, orchestrator.retryDueTransactions());

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());

            Payout raised = orchestrator.getPayout(waiting.getPayoutId());
            assertNotNull(raised.getReinsuranceRecovery().cessionId());
            assertNotNull(raised.getStopLossRef());
            assertNull(raised.getFollowUpRetry());
            assertEquals(1, harness.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.STOP_LOSS_BREACHED).size());

            harness.cessionService.funded(policy.getPolicyId(), new BigDecimal("20000"), "RE-SWISS", "re-tx-1");
            assertEquals(PayoutStatus.COMPLETED, orchestrator.getPayout(waiting.getPayoutId()).getStatus());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        }

        @Test
        void refusedCessionRequest_doesNotRepeatTheBreach() {
            harness.ledger.failMessages(LedgerMessage.CESSION_REQUESTED, 1);
            Policy policy = reinsuredPolicy();
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");

            Payout waiting = onlyPayout(policy);
            assertNotNull(waiting.getStopLossRef());
            assertNull(waiting.getReinsuranceRecovery().cessionId());

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());

            assertNotNull(orchestrator.getPayout(waiting.getPayoutId()).getReinsuranceRecovery().cessionId());
            assertEquals(1, harness.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.STOP_LOSS_BREACHED).size());
            assertEquals(1, harness.ledger.log().messages(LedgerChannel.CESSION, LedgerMessage.CESSION_REQUESTED).size());
        }

        @Test
        @DisplayName("A refused paid-out change leaves the payout processing until the retry sweep settles it")
        void refusedSettlement_isRetried() {
            Policy policy = executingPoolOnlyPayout();
            harness.ledger.failMessages(LedgerMessage.POLICY_STATUS_CHANGED, 1);
            harness.ledger.reportConfirmations(null);
            assertEquals(1, orchestrator.confirmFinality());

            Payout waiting = onlyPayout(policy);
            assertEquals(PayoutStatus.PROCESSING, waiting.getStatus());
            assertEquals(TransactionStatus.COMPLETED, leg(waiting, FundingSource.POOL).getStatus());
            assertEquals(1, waiting.getFollowUpRetry().currentRetry());
            assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
            assertTrue(harness.bus.query(SettlementEvent.PayoutSettled.class).isEmpty());

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());

            Payout settled = orchestrator.getPayout(waiting.getPayoutId());
            assertEquals(PayoutStatus.COMPLETED, settled.getStatus());
            assertNull(settled.getFollowUpRetry());
            assertEquals(PolicyStatus.PAID_OUT, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
            assertEquals(1, harness.bus.query(SettlementEvent.PayoutSettled.class).size());
            long paidOutChanges = harness.ledger.log().messages(LedgerChannel.POLICY_STATUS, LedgerMessage.POLICY_STATUS_CHANGED)
                .stream()
                .filter(m -> "paid_out".equals(m.body().get("to")))
                .count();
            assertEquals(1, paidOutChanges);
        }

        @Test
        void settlementRetries_stopAfterMaxRetries() {
            Policy policy = executingPoolOnlyPayout();
            harness.ledger.failMessages(LedgerMessage.POLICY_STATUS_CHANGED, -1);
            harness.ledger.reportConfirmations(null);
            orchestrator.confirmFinality();

            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, orchestrator.retryDueTransactions());
            harness.clock.advance(Duration.ofSeconds(60));
            assertEquals(1, orchestrator.retryDueTransactions());

            Payout stuck = onlyPayout(policy);
            assertEquals(PayoutStatus.PROCESSING, stuck.getStatus());
            assertEquals(3, stuck.getFollowUpRetry().currentRetry());
            assertNull(stuck.getFollowUpRetry().nextRetryAt());

            harness.clock.advance(Duration.ofHours(1));
            assertEquals(0, orchestrator.retryDueTransactions());
            assertEquals(PolicyStatus.TRIGGERED, harness.policyService.getPolicy(policy.getPolicyId()).getStatus());
        }

        private Policy reinsuredPolicy() {
            return harness.activePolicy(pool.getPoolId(), "100000", "0",
                new ReinsuranceDetails("RE-SWISS", new BigDecimal("20"), new BigDecimal("80000")));
        }

        private Policy executingPoolOnlyPayout() {
            harness.ledger.reportConfirmations(0L);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            assertEquals(TransactionStatus.EXECUTING, leg(onlyPayout(policy), FundingSource.POOL).getStatus());
            return policy;
        }
    }

    @Nested
    @DisplayName("Operator actions")
    class OperatorActions {

        @Test
        void cancel_beforeExecution_releasesReservation() {
            harness.ledger.failPayoutExecutions(1);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            Payout cancelled = orchestrator.cancelPayout(payout.getPayoutId());

            assertEquals(PayoutStatus.CANCELLED, cancelled.getStatus());
            assertEquals(TransactionStatus.CANCELLED, leg(payout, FundingSource.POOL).getStatus());
            assertEquals(0, new BigDecimal("200000").compareTo(
                harness.liquidityLedger.getPool(pool.getPoolId()).getAvailableLiquidity()));

            harness.clock.advance(Duration.ofMinutes(5));
            assertEquals(0, orchestrator.retryDueTransactions());
        }

        @Test
        void cancel_whileExecuting_isRefused() {
            harness.ledger.reportConfirmations(0L);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);

            assertThrows(InvalidStateTransitionException.class, () -> orchestrator.cancelPayout(payout.getPayoutId()));
            assertEquals(PayoutStatus.PROCESSING, orchestrator.getPayout(payout.getPayoutId()).getStatus());
        }

        @Test
        void dispute_marksLegAndPayout() {
            harness.ledger.reportConfirmations(0L);
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            Payout payout = onlyPayout(policy);
            String txId = leg(payout, FundingSource.POOL).getTransactionId();

            assertThrows(ValidationException.class, () -> orchestrator.disputeTransaction(txId, " "));
            PayoutTransaction disputed = orchestrator.disputeTransaction(txId, "beneficiary reports non-receipt");

            assertEquals(TransactionStatus.DISPUTED, disputed.getStatus());
            assertEquals("beneficiary reports non-receipt", disputed.getDisputeReason());
            assertEquals(PayoutStatus.DISPUTED, orchestrator.getPayout(payout.getPayoutId()).getStatus());
            assertEquals(0, orchestrator.confirmFinality());
        }

        @Test
        void dispute_ofCompletedLeg_isRefused() {
            Policy policy = harness.activePolicy(pool.getPoolId(), "50000", "0", null);
            harness.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
            String txId = leg(onlyPayout(policy), FundingSource.POOL).getTransactionId();

            assertThrows(InvalidStateTransitionException.class, () -> orchestrator.disputeTransaction(txId, "late claim"));
        }
    }

    @Test
    @DisplayName("Concurrent initiation for one trigger creates one payout and breaches stop-loss once")
    void concurrentInitiation_raisesOneCession() throws Exception {
        SettlementHarness unwired = new SettlementHarness(new SettlementProperties(), false);
        RiskPool funded = unwired.fundedPool("200000");
        Policy policy = unwired.activePolicy(funded.getPoolId(), "100000", "0",
            new ReinsuranceDetails("RE-SWISS", new BigDecimal("20"), new BigDecimal("80000")));
        Trigger trigger = unwired.triggerService.ingest(policy.getPolicyId(), heatReading(36.0), "station-feed");
        assertEquals(TriggerStatus.VALIDATED, trigger.getStatus());

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Payout>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return unwired.orchestrator.initiatePayout(trigger.getTriggerId());
            }));
        }
        start.countDown();
        Set<String> payoutIds = new HashSet<>();
        for (Future<Payout> future : futures) {
            payoutIds.add(future.get(30, TimeUnit.SECONDS).getPayoutId());
        }
        executor.shutdown();

        assertEquals(1, payoutIds.size());
        Payout payout = unwired.orchestrator.getPayout(payoutIds.iterator().next());
        assertNotNull(payout.getReinsuranceRecovery().cessionId());
        assertEquals(1, unwired.ledger.log().messages(LedgerChannel.PAYOUTS, LedgerMessage.STOP_LOSS_BREACHED).size());
        assertEquals(1, unwired.ledger.log().messages(LedgerChannel.CESSION, LedgerMessage.CESSION_REQUESTED).size());
        assertEquals(1, unwired.cessionService.cessionsForPolicy(policy.getPolicyId()).size());
    }

    private Payout onlyPayout(Policy policy) {
        List<Payout> payouts = orchestrator.payoutsForPolicy(policy.getPolicyId());
        assertEquals(1, payouts.size());
        return payouts.get(0);
    }

    private PayoutTransaction leg(Payout payout, FundingSource source) {
        return orchestrator.transactionsForPayout(payout.getPayoutId()).stream()
            .filter(t -> t.getSource() == source)
            .findFirst()
            .orElseThrow(() -> new AssertionError("no " + source + " leg on " + payout.getPayoutId()));
    }
}
