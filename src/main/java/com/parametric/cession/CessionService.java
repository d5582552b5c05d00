package com.parametric.cession;

import com.parametric.bus.SettlementBus;
import com.parametric.bus.SettlementEvent;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.ledger.LedgerReceipt;
import com.parametric.ledger.LedgerRef;
import com.parametric.store.DocumentStore;
import com.parametric.store.StripedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cession surface: {@link #request} and {@link #funded} are independent calls that
 * correlate on the policy id.
 */
public class CessionService {

    private static final Logger log = LoggerFactory.getLogger(CessionService.class);
    private static final int SCAN_LIMIT = 10_000;

    private final DocumentStore<CessionRecord> cessions;
    private final LedgerPublisher ledger;
    private final SettlementBus bus;
    private final Clock clock;
    private final StripedLocks policyLocks = new StripedLocks();

    public CessionService(DocumentStore<CessionRecord> cessions, LedgerPublisher ledger, SettlementBus bus, Clock clock) {
        this.cessions = cessions;
        this.ledger = ledger;
        this.bus = bus;
        this.clock = clock;
    }

    /** Raises a cession request; while one is open for the policy, returns that one. */
    public CessionRecord request(CessionRequest request) {
        List<SettlementEvent> outbox = new ArrayList<>();
        CessionRecord result = request(request, outbox);
        outbox.forEach(bus::publish);
        return result;
    }

    /**
     * As {@link #request(CessionRequest)}, but the workflow event is left in {@code outbox}
     * for a caller that publishes once its own locks are released.
     *
     * <p>An open request raised without a payout is bound to the first payout that asks;
     * its excess is raised to the payout's when that is larger.
     */
    public CessionRecord request(CessionRequest request, List<SettlementEvent> outbox) {
        validate(request);
        return policyLocks.withLock(request.policyId(), () -> {
            Optional<CessionRecord> open = openRequest(request.policyId());
            if (open.isEmpty()) {
                CessionRecord created = createRequest(request);
                outbox.add(requested(created));
                return created;
            }
            CessionRecord current = open.get();
            if (current.getPayoutId() == null && request.payoutId() != null) {
                CessionRecord bound = bindToPayout(current, request);
                outbox.add(requested(bound));
                return bound;
            }
            if (request.payoutId() != null && !request.payoutId().equals(current.getPayoutId())) {
                throw new ValidationException("cession " + current.getCessionId() + " for policy " + request.policyId()
                    + " is open for payout " + current.getPayoutId());
            }
            log.info("Cession request for policy {} already open as {}", request.policyId(), current.getCessionId());
            return current;
        });
    }

    private CessionRecord bindToPayout(CessionRecord open, CessionRequest request) {
        BigDecimal excess = open.getExcessAmount().max(request.excessAmount());
        LedgerReceipt receipt = ledger.publish(LedgerChannel.CESSION, LedgerMessage.of(LedgerMessage.CESSION_REQUESTED)
            .with("cessionId", open.getCessionId())
            .with("policyId", open.getPolicyId())
            .with("payoutId", request.payoutId())
            .with("excessAmount", excess.toPlainString())
            .with("lossCum", request.lossCum().toPlainString())
            .with("retention", request.retention().toPlainString())
            .with("triggerRef", LedgerRef.toWire(request.triggerRef()))
            .with("ruleRef", LedgerRef.toWire(request.ruleRef()))
            .build());
        CessionRecord bound = cessions.update(open.getCessionId(), c -> {
            c.setPayoutId(request.payoutId());
            c.setExcessAmount(excess);
            c.setLossCum(request.lossCum());
            c.setRetention(request.retention());
            if (request.triggerRef() != null) {
                c.setTriggerRef(request.triggerRef());
            }
            if (request.ruleRef() != null) {
                c.setRuleRef(request.ruleRef());
            }
            c.setRequestRef(receipt.toRef());
            return c;
        });
        log.info("Open cession {} for policy {} bound to payout {}: excess {}", open.getCessionId(), open.getPolicyId(),
            request.payoutId(), excess.toPlainString());
        return bound;
    }

    private static SettlementEvent.CessionRequested requested(CessionRecord record) {
        return new SettlementEvent.CessionRequested(record.getCessionId(), record.getPolicyId(),
            record.getPayoutId(), record.getExcessAmount());
    }

    private CessionRecord createRequest(CessionRequest request) {
        String cessionId = "CES-" + UUID.randomUUID();
        LedgerReceipt receipt = ledger.publish(LedgerChannel.CESSION, LedgerMessage.of(LedgerMessage.CESSION_REQUESTED)
            .with("cessionId", cessionId)
            .with("policyId", request.policyId())
            .with("excessAmount", request.excessAmount().toPlainString())
            .with("lossCum", request.lossCum().toPlainString())
            .with("retention", request.retention().toPlainString())
            .with("triggerRef", LedgerRef.toWire(request.triggerRef()))
            .with("ruleRef", LedgerRef.toWire(request.ruleRef()))
            .build());

        CessionRecord record = new CessionRecord();
        record.setCessionId(cessionId);
        record.setPolicyId(request.policyId());
        record.setPayoutId(request.payoutId());
        record.setExcessAmount(request.excessAmount());
        record.setLossCum(request.lossCum());
        record.setRetention(request.retention());
        record.setTriggerRef(request.triggerRef());
        record.setRuleRef(request.ruleRef());
        record.setStatus(CessionStatus.REQUESTED);
        record.setRequestRef(receipt.toRef());
        record.setRequestedAt(clock.instant());
        CessionRecord stored = cessions.insert(record);
        log.info("Cession {} requested for policy {}: excess {} over retention {}", cessionId, request.policyId(),
            request.excessAmount().toPlainString(), request.retention().toPlainString());
        return stored;
    }

    /**
     * Records reinsurer funding against the open request of the policy. A repeated
     * confirmation with the same {@code txId} returns the recorded funding.
     */
    public CessionRecord funded(String policyId, BigDecimal amount, String reinsurer, String txId) {
        if (policyId == null || policyId.isBlank()) {
            throw new ValidationException("policy_id is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("funded amount must be positive");
        }
        if (reinsurer == null || reinsurer.isBlank()) {
            throw new ValidationException("reinsurer is required");
        }
        if (txId == null || txId.isBlank()) {
            throw new ValidationException("tx_id is required");
        }

        CessionRecord result;
        boolean fundedNow = false;
        ReentrantLock lock = policyLocks.lockFor(policyId);
        lock.lock();
        try {
            Optional<CessionRecord> already = cessions.find(c -> txId.equals(c.getFundingTxId()), 1).stream().findFirst();
            if (already.isPresent()) {
                if (!policyId.equals(already.get().getPolicyId())) {
                    throw new ValidationException("tx_id " + txId + " already funded policy " + already.get().getPolicyId());
                }
                return already.get();
            }
            CessionRecord open = openRequest(policyId)
                .orElseThrow(() -> new ValidationException("no open cession request for policy " + policyId));
            if (amount.compareTo(open.getExcessAmount()) < 0) {
                throw new ValidationException("funding " + amount.toPlainString() + " is below the requested excess "
                    + open.getExcessAmount().toPlainString());
            }
            result = recordFunding(open, amount, reinsurer, txId);
            fundedNow = true;
        } finally {
            lock.unlock();
        }
        if (fundedNow) {
            bus.publish(new SettlementEvent.CessionFunded(result.getCessionId(), policyId, result.getFundingId(), amount));
        }
        return result;
    }

    private CessionRecord recordFunding(CessionRecord open, BigDecimal amount, String reinsurer, String txId) {
        String fundingId = "FND-" + UUID.randomUUID();
        LedgerReceipt receipt = ledger.publish(LedgerChannel.CESSION, LedgerMessage.of(LedgerMessage.CESSION_FUNDED)
            .with("cessionId", open.getCessionId())
            .with("policyId", open.getPolicyId())
            .with("amount", amount.toPlainString())
            .with("reinsurer", reinsurer)
            .with("txId", txId)
            .with("ruleRef", LedgerRef.toWire(open.getRuleRef()))
            .with("cessionRef", open.getRequestRef() == null ? null : open.getRequestRef().transactionId())
            .build());
        Instant now = clock.instant();
        CessionRecord funded = cessions.update(open.getCessionId(), c -> {
            c.setStatus(CessionStatus.FUNDED);
            c.setFundingId(fundingId);
            c.setFundedAmount(amount);
            c.setReinsurer(reinsurer);
            c.setFundingTxId(txId);
            c.setFundingRef(receipt.toRef());
            c.setFundedAt(now);
            return c;
        });
        log.info("Cession {} for policy {} funded by {}: {} (tx {})", open.getCessionId(), open.getPolicyId(),
            reinsurer, amount.toPlainString(), txId);
        return funded;
    }

    public CessionRecord getCession(String cessionId) {
        return cessions.require(cessionId);
    }

    public List<CessionRecord> cessionsForPolicy(String policyId) {
        return cessions.find(c -> policyId.equals(c.getPolicyId()), SCAN_LIMIT);
    }

    private Optional<CessionRecord> openRequest(String policyId) {
        return cessions.find(c -> policyId.equals(c.getPolicyId()) && c.getStatus() == CessionStatus.REQUESTED, 1)
            .stream()
            .findFirst();
    }

    private static void validate(CessionRequest request) {
        if (request == null || request.policyId() == null || request.policyId().isBlank()) {
            throw new ValidationException("policy_id is required");
        }
        if (request.excessAmount() == null || request.excessAmount().signum() <= 0) {
            throw new ValidationException("excess_amount must be positive");
        }
        if (request.lossCum() == null || request.lossCum().signum() <= 0) {
            throw new ValidationException("loss_cum must be positive");
        }
        if (request.retention() == null || request.retention().signum() < 0) {
            throw new ValidationException("retention must not be negative");
        }
    }
}
