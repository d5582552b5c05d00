package com.parametric.payout;

import com.parametric.bus.SettlementBus;
import com.parametric.bus.SettlementEvent;
import com.parametric.cession.CessionRecord;
import com.parametric.cession.CessionRequest;
import com.parametric.cession.CessionService;
import com.parametric.config.SettlementProperties;
import com.parametric.error.FinalityTimeoutException;
import com.parametric.error.InsufficientLiquidityException;
import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.LedgerPublishException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.FinalityMonitor;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.ledger.LedgerReceipt;
import com.parametric.ledger.LedgerRef;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyStateMachine;
import com.parametric.pool.LiquidityLedger;
import com.parametric.pool.LiquidityReservation;
import com.parametric.pool.ReservationStatus;
import com.parametric.store.DocumentStore;
import com.parametric.store.StripedLocks;
import com.parametric.trigger.Trigger;
import com.parametric.trigger.TriggerService;
import com.parametric.trigger.TriggerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Drives a validated trigger to a settled payout.
 *
 * <p>Waterfall: the pool pays up to the policy's retention (all of it without
 * reinsurance); anything above retention raises a cession request and is paid by a
 * second leg once the reinsurer funds it. Each leg runs
 * {@code initiated -> [liquidity_reserved] -> pending_execution -> executing -> completed},
 * looping back to {@code pending_execution} on transient ledger failures until the
 * attempts run out. The policy is marked paid out only when every planned leg
 * has completed.
 *
 * <p>Work on one payout is serialized by a per-payout lock; payout creation is
 * serialized per policy. Workflow events are published after the locks are released.
 * Raising the cession and settling the policy retry on their own backoff when the
 * ledger refuses them.
 */
public class PayoutOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PayoutOrchestrator.class);
    private static final int SCAN_LIMIT = 10_000;
    private static final String CESSION_STEP = "Cession request";
    private static final String SETTLEMENT_STEP = "Settlement";

    private final DocumentStore<Payout> payouts;
    private final DocumentStore<PayoutTransaction> transactions;
    private final DocumentStore<Policy> policies;
    private final TriggerService triggerService;
    private final PolicyStateMachine policyStateMachine;
    private final PayoutCalculator calculator;
    private final LiquidityLedger liquidityLedger;
    private final CessionService cessionService;
    private final LedgerPublisher ledger;
    private final FinalityMonitor finalityMonitor;
    private final SettlementBus bus;
    private final SettlementProperties.Payout settings;
    private final Clock clock;
    private final StripedLocks policyLocks = new StripedLocks();
    private final StripedLocks payoutLocks = new StripedLocks();

    public PayoutOrchestrator(DocumentStore<Payout> payouts,
                              DocumentStore<PayoutTransaction> transactions,
                              DocumentStore<Policy> policies,
                              TriggerService triggerService,
                              PolicyStateMachine policyStateMachine,
                              PayoutCalculator calculator,
                              LiquidityLedger liquidityLedger,
                              CessionService cessionService,
                              LedgerPublisher ledger,
                              FinalityMonitor finalityMonitor,
                              SettlementBus bus,
                              SettlementProperties properties,
                              Clock clock) {
        this.payouts = payouts;
        this.transactions = transactions;
        this.policies = policies;
        this.triggerService = triggerService;
        this.policyStateMachine = policyStateMachine;
        this.calculator = calculator;
        this.liquidityLedger = liquidityLedger;
        this.cessionService = cessionService;
        this.ledger = ledger;
        this.finalityMonitor = finalityMonitor;
        this.bus = bus;
        this.settings = properties.getPayout();
        this.clock = clock;
    }

    // --- initiation ---

    /**
     * Creates the payout for a validated trigger and starts the pool leg. Calling it again
     * for the same trigger returns the payout already created.
     */
    public Payout initiatePayout(String triggerId) {
        Trigger trigger = triggerService.getTrigger(triggerId);
        List<SettlementEvent> outbox = new ArrayList<>();
        Payout payout;
        try {
            payout = policyLocks.withLock(trigger.getPolicyId(), () -> initiateLocked(triggerId, outbox));
        } finally {
            outbox.forEach(bus::publish);
        }
        if (needsCession(payout)) {
            payout = raiseCession(payout.getPayoutId());
        }
        return payout;
    }

    private Payout initiateLocked(String triggerId, List<SettlementEvent> outbox) {
        Optional<Payout> existing = payouts.find(p -> triggerId.equals(p.getTriggerId()), 1).stream().findFirst();
        if (existing.isPresent()) {
            log.info("Payout {} already exists for trigger {}", existing.get().getPayoutId(), triggerId);
            return existing.get();
        }

        Trigger trigger = triggerService.getTrigger(triggerId);
        if (trigger.getStatus() != TriggerStatus.VALIDATED) {
            throw new ValidationException("trigger " + triggerId + " is " + trigger.getStatus().getValue()
                + "; payouts start from validated triggers");
        }
        Policy policy = policies.require(trigger.getPolicyId());
        liquidityLedger.getPool(policy.getPoolId());

        PayoutCalculation calculation = calculator.calculate(policy.getCoverageDetails());
        Instant now = clock.instant();
        Payout payout = new Payout();
        payout.setPayoutId("PAY-" + UUID.randomUUID());
        payout.setPolicyId(policy.getPolicyId());
        payout.setTriggerId(triggerId);
        payout.setBeneficiaryAccountId(policy.getBeneficiaryAccountId());
        payout.setPoolId(policy.getPoolId());
        payout.setCalculation(calculation);
        payout.setStatus(PayoutStatus.CALCULATED);
        payout.setPoolAmount(BigDecimal.ZERO);
        payout.setCessionAmount(BigDecimal.ZERO);
        payout.setTriggerRef(trigger.getTriggerRef());
        payout.setRuleRef(policy.getRuleRef());
        payout.setCreatedAt(now);
        payout.setUpdatedAt(now);
        payouts.insert(payout);
        String payoutId = payout.getPayoutId();
        triggerService.markProcessed(triggerId, payoutId);
        outbox.add(new SettlementEvent.PayoutInitiated(payoutId, policy.getPolicyId(), triggerId, calculation.netPayout()));
        log.info("Payout {} calculated for policy {}: base {} - deductible {} = net {} {}", payoutId,
            policy.getPolicyId(), calculation.basePayout().toPlainString(), calculation.deductible().toPlainString(),
            calculation.netPayout().toPlainString(), calculation.currency());

        return payoutLocks.withLock(payoutId, () -> {
            BigDecimal net = calculation.netPayout();
            if (net.signum() <= 0) {
                return failPayout(payoutId, FailureReason.NON_POSITIVE_PAYOUT);
            }
            BigDecimal poolAmount = policy.hasReinsurance()
                ? net.min(policy.getReinsuranceDetails().retentionLimit())
                : net;
            BigDecimal excess = net.subtract(poolAmount);
            movePayout(payoutId, PayoutStatus.APPROVED, p -> {
                p.setPoolAmount(poolAmount);
                p.setCessionAmount(excess);
                if (excess.signum() > 0) {
                    p.setReinsuranceRecovery(new ReinsuranceRecovery(
                        policy.getReinsuranceDetails().reinsurerId(), excess, null, null, null, null));
                }
            });

            String poolTxId = startPoolLeg(payoutId, outbox);
            if (poolTxId != null) {
                attemptExecution(poolTxId, outbox);
            }
            return payouts.require(payoutId);
        });
    }

    /**
     * Publishes the stop-loss breach and asks the reinsurer for the excess above retention.
     * A ledger failure leaves the payout without a cession and schedules another attempt.
     */
    private Payout raiseCession(String payoutId) {
        List<SettlementEvent> outbox = new ArrayList<>();
        try {
            return payoutLocks.withLock(payoutId, () -> {
                Payout payout = payouts.require(payoutId);
                if (!needsCession(payout)) {
                    return payout;
                }
                try {
                    return raiseCessionLocked(payout, outbox);
                } catch (LedgerPublishException ex) {
                    return onFollowUpFailure(payoutId, CESSION_STEP, ex);
                }
            });
        } finally {
            outbox.forEach(bus::publish);
        }
    }

    private Payout raiseCessionLocked(Payout payout, List<SettlementEvent> outbox) {
        String payoutId = payout.getPayoutId();
        BigDecimal net = payout.getCalculation().netPayout();
        BigDecimal retention = payout.getPoolAmount();
        if (payout.getStopLossRef() == null) {
            Policy policy = policies.require(payout.getPolicyId());
            LedgerReceipt breach = ledger.publish(LedgerChannel.PAYOUTS, LedgerMessage.of(LedgerMessage.STOP_LOSS_BREACHED)
                .with("policyId", payout.getPolicyId())
                .with("payoutId", payoutId)
                .with("lossCum", net.toPlainString())
                .with("retention", policy.getReinsuranceDetails().retentionLimit().toPlainString())
                .with("triggerRef", LedgerRef.toWire(payout.getTriggerRef()))
                .with("ruleRef", LedgerRef.toWire(payout.getRuleRef()))
                .build());
            payouts.update(payoutId, p -> {
                p.setStopLossRef(breach.toRef());
                return p;
            });
            log.warn("Stop-loss breached on policy {}: loss {} above retention {}, ceding {}", payout.getPolicyId(),
                net.toPlainString(), retention.toPlainString(), payout.getCessionAmount().toPlainString());
        }

        CessionRecord cession = cessionService.request(new CessionRequest(
            payout.getPolicyId(),
            payoutId,
            payout.getCessionAmount(),
            net,
            retention,
            payout.getTriggerRef(),
            payout.getRuleRef()), outbox);
        return payouts.update(payoutId, p -> {
            p.setReinsuranceRecovery(p.getReinsuranceRecovery().withCession(cession.getCessionId()));
            p.setFollowUpRetry(null);
            p.setUpdatedAt(clock.instant());
            return p;
        });
    }

    /**
     * Books a failed cession request or settlement against the payout's follow-up retry.
     * Once the attempts run out the payout is left as it is for an operator.
     */
    private Payout onFollowUpFailure(String payoutId, String step, LedgerPublishException ex) {
        Payout payout = payouts.require(payoutId);
        RetryMechanism retry = payout.getFollowUpRetry() != null
            ? payout.getFollowUpRetry()
            : RetryMechanism.initial(settings.getMaxRetries(), settings.getBackoffMultiplier());
        Instant now = clock.instant();
        if (retry.exhaustedAfterFailure()) {
            Payout stuck = payouts.update(payoutId, p -> {
                p.setFollowUpRetry(retry.exhausted());
                p.setUpdatedAt(now);
                return p;
            });
            log.error("{} for payout {} failed after {} attempts, operator action required", step, payoutId,
                stuck.getFollowUpRetry().currentRetry(), ex);
            return stuck;
        }
        RetryMechanism next = retry.afterFailure(now, settings.getRetryDelay());
        Payout waiting = payouts.update(payoutId, p -> {
            p.setFollowUpRetry(next);
            p.setUpdatedAt(now);
            return p;
        });
        log.warn("{} for payout {} attempt {}/{} failed ({}), retry at {}", step, payoutId,
            next.currentRetry(), next.maxRetries(), ex.getMessage(), next.nextRetryAt());
        return waiting;
    }

    /** Creates and reserves the pool leg; returns its id, or null when the pool could not cover it. */
    private String startPoolLeg(String payoutId, List<SettlementEvent> outbox) {
        Payout payout = payouts.require(payoutId);
        PayoutTransaction tx = newTransaction(payout, FundingSource.POOL, payout.getPoolAmount());
        String txId = tx.getTransactionId();
        transactions.insert(tx);
        payouts.update(payoutId, p -> {
            p.getRiskPoolDistributions().add(new PoolDistribution(p.getPoolId(), p.getPoolAmount(), txId));
            return p;
        });

        LiquidityReservation reservation;
        try {
            reservation = liquidityLedger.reserve(payout.getPoolId(), payout.getPoolAmount(), txId);
        } catch (InsufficientLiquidityException ex) {
            moveTransaction(txId, TransactionStatus.FAILED, t -> {
                t.setFailureReason(FailureReason.INSUFFICIENT_LIQUIDITY);
                t.setFailureDetail(ex.getMessage());
            });
            log.warn("Pool leg {} of payout {} failed: {}", txId, payoutId, ex.getMessage());
            outbox.add(new SettlementEvent.PayoutLegFailed(txId, payoutId, payout.getPolicyId(),
                FailureReason.INSUFFICIENT_LIQUIDITY.name()));
            failPayout(payoutId, FailureReason.INSUFFICIENT_LIQUIDITY);
            return null;
        }

        moveTransaction(txId, TransactionStatus.LIQUIDITY_RESERVED, t -> {
            t.setSourceRef(reservation.getReservationId());
            t.setLiquidityDetails(new LiquidityDetails(payout.getPoolId(), reservation.getReservationId(),
                reservation.getAmount()));
        });
        moveTransaction(txId, TransactionStatus.PENDING_EXECUTION, t -> { });
        return txId;
    }

    private void startCessionLeg(String payoutId, List<SettlementEvent> outbox) {
        Payout payout = payouts.require(payoutId);
        ReinsuranceRecovery recovery = payout.getReinsuranceRecovery();
        PayoutTransaction tx = newTransaction(payout, FundingSource.CESSION, payout.getCessionAmount());
        tx.setSourceRef(recovery.fundingId());
        String txId = tx.getTransactionId();
        transactions.insert(tx);
        payouts.update(payoutId, p -> {
            p.setReinsuranceRecovery(p.getReinsuranceRecovery().withTransaction(txId));
            return p;
        });
        moveTransaction(txId, TransactionStatus.PENDING_EXECUTION, t -> { });
        log.info("Cession leg {} of payout {} started for {} (funding {})", txId, payoutId,
            payout.getCessionAmount().toPlainString(), recovery.fundingId());
        attemptExecution(txId, outbox);
    }

    private PayoutTransaction newTransaction(Payout payout, FundingSource source, BigDecimal amount) {
        Instant now = clock.instant();
        PayoutTransaction tx = new PayoutTransaction();
        tx.setTransactionId("PTX-" + UUID.randomUUID());
        tx.setPayoutId(payout.getPayoutId());
        tx.setPolicyId(payout.getPolicyId());
        tx.setSource(source);
        tx.setAmount(amount);
        tx.setBeneficiaryAccountId(payout.getBeneficiaryAccountId());
        tx.setStatus(TransactionStatus.INITIATED);
        tx.setRetryMechanism(RetryMechanism.initial(settings.getMaxRetries(), settings.getBackoffMultiplier()));
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        return tx;
    }

    // --- execution ---

    private PayoutTransaction attemptExecution(String txId, List<SettlementEvent> outbox) {
        PayoutTransaction pending = transactions.require(txId);
        if (pending.getStatus() != TransactionStatus.PENDING_EXECUTION) {
            return pending;
        }
        Instant now = clock.instant();
        PayoutTransaction tx = moveTransaction(txId, TransactionStatus.EXECUTING, t -> t.setExecutionStartedAt(now));
        Payout payout = payouts.require(tx.getPayoutId());
        if (payout.getStatus() == PayoutStatus.APPROVED) {
            movePayout(payout.getPayoutId(), PayoutStatus.PROCESSING, p -> { });
        }

        LedgerReceipt receipt;
        try {
            receipt = ledger.publish(LedgerChannel.PAYOUTS, LedgerMessage.of(LedgerMessage.PAYOUT_EXECUTED)
                .with("policyId", tx.getPolicyId())
                .with("payoutId", tx.getPayoutId())
                .with("beneficiary", tx.getBeneficiaryAccountId())
                .with("amount", tx.getAmount().toPlainString())
                .with("source", tx.getSource().name())
                .with("triggerRef", LedgerRef.toWire(payout.getTriggerRef()))
                .with("ruleRef", LedgerRef.toWire(payout.getRuleRef()))
                .with("sourceRef", tx.getSourceRef())
                .with("txId", txId)
                .build());
        } catch (LedgerPublishException ex) {
            return onPublishFailure(tx, ex, outbox);
        }

        transactions.update(txId, t -> {
            t.setLedgerTransactionId(receipt.transactionId());
            t.setConsensusTimestamp(receipt.consensusTimestamp());
            t.setUpdatedAt(clock.instant());
            return t;
        });
        log.info("{} leg {} of payout {} executed: {} to {} (ledger tx {})", tx.getSource(), txId, tx.getPayoutId(),
            tx.getAmount().toPlainString(), tx.getBeneficiaryAccountId(), receipt.transactionId());
        return checkFinality(txId, outbox);
    }

    private PayoutTransaction onPublishFailure(PayoutTransaction tx, LedgerPublishException ex, List<SettlementEvent> outbox) {
        RetryMechanism retry = tx.getRetryMechanism();
        String txId = tx.getTransactionId();
        if (retry.exhaustedAfterFailure()) {
            PayoutTransaction failed = moveTransaction(txId, TransactionStatus.FAILED, t -> {
                t.setRetryMechanism(retry.exhausted());
                t.setFailureReason(FailureReason.LEDGER_PUBLISH_FAILED);
                t.setFailureDetail(ex.getMessage());
            });
            releaseUnused(failed);
            log.error("Leg {} of payout {} failed permanently after {} attempts, operator action required",
                txId, tx.getPayoutId(), failed.getRetryMechanism().currentRetry(), ex);
            outbox.add(new SettlementEvent.PayoutLegFailed(txId, tx.getPayoutId(), tx.getPolicyId(),
                FailureReason.LEDGER_PUBLISH_FAILED.name()));
            failPayout(tx.getPayoutId(), FailureReason.LEDGER_PUBLISH_FAILED);
            return failed;
        }

        RetryMechanism next = retry.afterFailure(clock.instant(), settings.getRetryDelay());
        PayoutTransaction requeued = moveTransaction(txId, TransactionStatus.PENDING_EXECUTION, t -> {
            t.setRetryMechanism(next);
            t.setFailureDetail(ex.getMessage());
        });
        log.warn("Leg {} of payout {} attempt {}/{} failed ({}), retry at {}", txId, tx.getPayoutId(),
            next.currentRetry(), next.maxRetries(), ex.getMessage(), next.nextRetryAt());
        return requeued;
    }

    /**
     * Completes an executing leg once the ledger reports enough confirmations. Past the
     * finality timeout the leg fails and its reservation stays held for an operator.
     */
    private PayoutTransaction checkFinality(String txId, List<SettlementEvent> outbox) {
        PayoutTransaction tx = transactions.require(txId);
        if (tx.getStatus() != TransactionStatus.EXECUTING) {
            return tx;
        }
        long threshold = settings.getFinalityThreshold();
        long confirmations = tx.getLedgerTransactionId() == null ? 0 : finalityMonitor.confirmations(tx.getLedgerTransactionId());
        Instant now = clock.instant();

        if (confirmations >= threshold) {
            PayoutTransaction completed = moveTransaction(txId, TransactionStatus.COMPLETED, t -> t.setCompletedAt(now));
            LiquidityDetails liquidity = completed.getLiquidityDetails();
            if (liquidity != null) {
                liquidityLedger.release(liquidity.poolId(), liquidity.reservedAmount(), txId, true);
            }
            log.info("{} leg {} of payout {} final with {} confirmations", completed.getSource(), txId,
                completed.getPayoutId(), confirmations);
            outbox.add(new SettlementEvent.PayoutLegCompleted(txId, completed.getPayoutId(), completed.getPolicyId(),
                completed.getSource().name()));
            return completed;
        }

        Instant started = tx.getExecutionStartedAt();
        if (started != null && now.isAfter(started.plus(settings.getFinalityTimeout()))) {
            FinalityTimeoutException timeout = new FinalityTimeoutException(txId, confirmations, threshold);
            PayoutTransaction failed = moveTransaction(txId, TransactionStatus.FAILED, t -> {
                t.setFailureReason(FailureReason.FINALITY_TIMEOUT);
                t.setFailureDetail(timeout.getMessage());
            });
            log.error("Leg {} of payout {} not final, reservation {} held for operator review", txId,
                tx.getPayoutId(), tx.getLiquidityDetails() == null ? "-" : tx.getLiquidityDetails().reservationId(), timeout);
            outbox.add(new SettlementEvent.PayoutLegFailed(txId, tx.getPayoutId(), tx.getPolicyId(),
                FailureReason.FINALITY_TIMEOUT.name()));
            failPayout(tx.getPayoutId(), FailureReason.FINALITY_TIMEOUT);
            return failed;
        }

        log.debug("Leg {} awaiting finality: {}/{} confirmations", txId, confirmations, threshold);
        return tx;
    }

    // --- follow-up stages ---

    /** Starts the cession leg when its funding is in, and settles the payout once every leg completed. */
    public Payout onLegCompleted(String payoutId) {
        List<SettlementEvent> outbox = new ArrayList<>();
        try {
            return payoutLocks.withLock(payoutId, () -> {
                Payout payout = payouts.require(payoutId);
                if (payout.getStatus().isTerminal()) {
                    return payout;
                }
                List<PayoutTransaction> legs = transactionsForPayout(payoutId);
                ReinsuranceRecovery recovery = payout.getReinsuranceRecovery();
                if (recovery != null && recovery.fundingId() != null && recovery.transactionId() == null
                    && legCompleted(legs, FundingSource.POOL)) {
                    startCessionLeg(payoutId, outbox);
                    return payouts.require(payoutId);
                }
                if (!allLegsCompleted(payout, legs)) {
                    return payout;
                }
                try {
                    policyStateMachine.markPaidOut(payout.getPolicyId(), payoutId);
                } catch (LedgerPublishException ex) {
                    return onFollowUpFailure(payoutId, SETTLEMENT_STEP, ex);
                }
                Payout settled = movePayout(payoutId, PayoutStatus.COMPLETED, p -> {
                    p.setCompletedAt(clock.instant());
                    p.setFollowUpRetry(null);
                });
                log.info("Payout {} settled: {} paid to {} for policy {}", payoutId,
                    settled.getCalculation().netPayout().toPlainString(), settled.getBeneficiaryAccountId(),
                    settled.getPolicyId());
                outbox.add(new SettlementEvent.PayoutSettled(payoutId, settled.getPolicyId()));
                return settled;
            });
        } finally {
            outbox.forEach(bus::publish);
        }
    }

    /**
     * Attaches reinsurer funding to the payout that raised the cession. The cession leg
     * starts now if the pool leg has completed, otherwise when it does.
     */
    public Optional<Payout> onCessionFunded(String cessionId, String fundingId, BigDecimal amount) {
        CessionRecord cession = cessionService.getCession(cessionId);
        if (cession.getPayoutId() == null) {
            log.info("Cession {} for policy {} funded without a payout to settle", cessionId, cession.getPolicyId());
            return Optional.empty();
        }
        String payoutId = cession.getPayoutId();
        List<SettlementEvent> outbox = new ArrayList<>();
        try {
            return Optional.of(payoutLocks.withLock(payoutId, () -> {
                Payout payout = payouts.require(payoutId);
                ReinsuranceRecovery recovery = payout.getReinsuranceRecovery();
                if (payout.getStatus().isTerminal() || recovery == null) {
                    log.warn("Funding {} for cession {} arrived for payout {} in status {}, not applied",
                        fundingId, cessionId, payoutId, payout.getStatus().getValue());
                    return payout;
                }
                if (recovery.fundingId() != null) {
                    return payout;
                }
                payouts.update(payoutId, p -> {
                    p.setReinsuranceRecovery(p.getReinsuranceRecovery().withFunding(fundingId, amount, cession.getReinsurer()));
                    p.setUpdatedAt(clock.instant());
                    return p;
                });
                if (legCompleted(transactionsForPayout(payoutId), FundingSource.POOL)) {
                    startCessionLeg(payoutId, outbox);
                } else {
                    log.info("Funding {} recorded for payout {}, cession leg waits for the pool leg", fundingId, payoutId);
                }
                return payouts.require(payoutId);
            }));
        } finally {
            outbox.forEach(bus::publish);
        }
    }

    // --- operator actions and sweeps ---

    /** Cancels a payout none of whose legs is executing or done; held reservations are returned. */
    public Payout cancelPayout(String payoutId) {
        return payoutLocks.withLock(payoutId, () -> {
            Payout payout = payouts.require(payoutId);
            List<PayoutTransaction> legs = transactionsForPayout(payoutId);
            boolean inFlight = legs.stream().anyMatch(t -> t.getStatus() == TransactionStatus.EXECUTING
                || t.getStatus() == TransactionStatus.COMPLETED
                || t.getStatus() == TransactionStatus.DISPUTED);
            if (inFlight || !payout.getStatus().canMoveTo(PayoutStatus.CANCELLED)) {
                throw new InvalidStateTransitionException("payout", payoutId, payout.getStatus().getValue(),
                    PayoutStatus.CANCELLED.getValue());
            }
            for (PayoutTransaction leg : legs) {
                if (!leg.getStatus().isTerminal()) {
                    releaseUnused(moveTransaction(leg.getTransactionId(), TransactionStatus.CANCELLED, t -> { }));
                }
            }
            Payout cancelled = movePayout(payoutId, PayoutStatus.CANCELLED, p -> { });
            log.info("Payout {} cancelled before execution", payoutId);
            return cancelled;
        });
    }

    /** Marks an executing leg and its payout disputed; the reservation stays held. */
    public PayoutTransaction disputeTransaction(String transactionId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason is required");
        }
        PayoutTransaction tx = transactions.require(transactionId);
        return payoutLocks.withLock(tx.getPayoutId(), () -> {
            PayoutTransaction disputed = moveTransaction(transactionId, TransactionStatus.DISPUTED,
                t -> t.setDisputeReason(reason));
            Payout payout = payouts.require(disputed.getPayoutId());
            if (payout.getStatus().canMoveTo(PayoutStatus.DISPUTED)) {
                movePayout(payout.getPayoutId(), PayoutStatus.DISPUTED, p -> { });
            }
            log.warn("Leg {} of payout {} disputed: {}", transactionId, disputed.getPayoutId(), reason);
            return disputed;
        });
    }

    /**
     * Re-executes legs waiting in {@code pending_execution} whose backoff has elapsed, then
     * retries due cession requests and settlements of payouts whose ledger step failed.
     */
    public int retryDueTransactions() {
        Instant now = clock.instant();
        List<PayoutTransaction> due = transactions.find(t -> t.getStatus() == TransactionStatus.PENDING_EXECUTION
            && t.getRetryMechanism() != null
            && t.getRetryMechanism().nextRetryAt() != null
            && !now.isBefore(t.getRetryMechanism().nextRetryAt()), SCAN_LIMIT);
        for (PayoutTransaction tx : due) {
            List<SettlementEvent> outbox = new ArrayList<>();
            try {
                payoutLocks.withLock(tx.getPayoutId(), () -> attemptExecution(tx.getTransactionId(), outbox));
            } finally {
                outbox.forEach(bus::publish);
            }
        }

        List<Payout> followUps = payouts.find(p -> !p.getStatus().isTerminal()
            && p.getFollowUpRetry() != null
            && p.getFollowUpRetry().nextRetryAt() != null
            && !now.isBefore(p.getFollowUpRetry().nextRetryAt()), SCAN_LIMIT);
        for (Payout payout : followUps) {
            if (needsCession(payout)) {
                raiseCession(payout.getPayoutId());
            } else {
                onLegCompleted(payout.getPayoutId());
            }
        }
        return due.size() + followUps.size();
    }

    /** Re-checks every executing leg for finality; returns how many left {@code executing}. */
    public int confirmFinality() {
        List<PayoutTransaction> executing = transactions.find(t -> t.getStatus() == TransactionStatus.EXECUTING, SCAN_LIMIT);
        int resolved = 0;
        for (PayoutTransaction tx : executing) {
            List<SettlementEvent> outbox = new ArrayList<>();
            try {
                PayoutTransaction after = payoutLocks.withLock(tx.getPayoutId(),
                    () -> checkFinality(tx.getTransactionId(), outbox));
                if (after.getStatus() != TransactionStatus.EXECUTING) {
                    resolved++;
                }
            } finally {
                outbox.forEach(bus::publish);
            }
        }
        return resolved;
    }

    // --- queries ---

    public Payout getPayout(String payoutId) {
        return payouts.require(payoutId);
    }

    public List<Payout> payoutsForPolicy(String policyId) {
        return payouts.find(p -> policyId.equals(p.getPolicyId()), SCAN_LIMIT);
    }

    public PayoutTransaction getTransaction(String transactionId) {
        return transactions.require(transactionId);
    }

    public List<PayoutTransaction> transactionsByStatus(TransactionStatus status) {
        return transactions.find(t -> t.getStatus() == status, SCAN_LIMIT);
    }

    public List<PayoutTransaction> transactionsForPayout(String payoutId) {
        return transactions.find(t -> payoutId.equals(t.getPayoutId()), SCAN_LIMIT);
    }

    // --- helpers ---

    private static boolean needsCession(Payout payout) {
        return !payout.getStatus().isTerminal()
            && payout.getReinsuranceRecovery() != null
            && payout.getReinsuranceRecovery().cessionId() == null;
    }

    private boolean allLegsCompleted(Payout payout, List<PayoutTransaction> legs) {
        if (!legCompleted(legs, FundingSource.POOL)) {
            return false;
        }
        return payout.getCessionAmount().signum() == 0 || legCompleted(legs, FundingSource.CESSION);
    }

    private static boolean legCompleted(List<PayoutTransaction> legs, FundingSource source) {
        return legs.stream().anyMatch(t -> t.getSource() == source && t.getStatus() == TransactionStatus.COMPLETED);
    }

    private void releaseUnused(PayoutTransaction tx) {
        LiquidityDetails liquidity = tx.getLiquidityDetails();
        if (liquidity == null) {
            return;
        }
        boolean held = liquidityLedger.findReservation(liquidity.reservationId())
            .map(r -> r.getStatus() == ReservationStatus.ACTIVE)
            .orElse(false);
        if (held) {
            liquidityLedger.release(liquidity.poolId(), liquidity.reservedAmount(), tx.getTransactionId(), false);
        }
    }

    private Payout failPayout(String payoutId, FailureReason reason) {
        Payout current = payouts.require(payoutId);
        if (!current.getStatus().canMoveTo(PayoutStatus.FAILED)) {
            return current;
        }
        Payout failed = movePayout(payoutId, PayoutStatus.FAILED, p -> p.setFailureReason(reason));
        log.error("Payout {} for policy {} failed: {}", payoutId, failed.getPolicyId(), reason);
        return failed;
    }

    private Payout movePayout(String payoutId, PayoutStatus to, Consumer<Payout> mutation) {
        Instant now = clock.instant();
        AtomicReference<PayoutStatus> from = new AtomicReference<>();
        Payout updated = payouts.update(payoutId, p -> {
            if (!p.getStatus().canMoveTo(to)) {
                throw new InvalidStateTransitionException("payout", payoutId, p.getStatus().getValue(), to.getValue());
            }
            from.set(p.getStatus());
            p.setStatus(to);
            mutation.accept(p);
            p.setUpdatedAt(now);
            return p;
        });
        log.info("Payout {} {} -> {}", payoutId, from.get().getValue(), to.getValue());
        return updated;
    }

    private PayoutTransaction moveTransaction(String txId, TransactionStatus to, Consumer<PayoutTransaction> mutation) {
        Instant now = clock.instant();
        AtomicReference<TransactionStatus> from = new AtomicReference<>();
        PayoutTransaction updated = transactions.update(txId, t -> {
            if (!t.getStatus().canMoveTo(to)) {
                throw new InvalidStateTransitionException("payout transaction", txId, t.getStatus().getValue(), to.getValue());
            }
            from.set(t.getStatus());
            t.setStatus(to);
            mutation.accept(t);
            t.setUpdatedAt(now);
            return t;
        });
        log.info("Transaction {} {} -> {}", txId, from.get().getValue(), to.getValue());
        return updated;
    }
}
