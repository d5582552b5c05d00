package com.parametric.workflow;

import com.parametric.bus.SettlementBus;
import com.parametric.bus.SettlementEvent;
import com.parametric.oracle.DataAttestation;
import com.parametric.oracle.DataRequest;
import com.parametric.oracle.OracleCommitteeService;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.trigger.EventData;
import com.parametric.trigger.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each stage's output event to the stage that consumes it:
 *
 * <pre>
 * ConsensusReached   -> trigger ingestion (rounds opened for a policy)
 * TriggerValidated   -> payout initiation
 * CessionFunded      -> cession leg
 * PayoutLegCompleted -> next leg or settlement
 * </pre>
 */
public class SettlementWorkflow {

    private static final Logger log = LoggerFactory.getLogger(SettlementWorkflow.class);

    static final String ORACLE_SOURCE_PREFIX = "oracle-committee:";

    private final OracleCommitteeService oracleCommittee;
    private final TriggerService triggerService;
    private final PayoutOrchestrator payoutOrchestrator;

    public SettlementWorkflow(SettlementBus bus,
                              OracleCommitteeService oracleCommittee,
                              TriggerService triggerService,
                              PayoutOrchestrator payoutOrchestrator) {
        this.oracleCommittee = oracleCommittee;
        this.triggerService = triggerService;
        this.payoutOrchestrator = payoutOrchestrator;

        bus.subscribe(SettlementEvent.ConsensusReached.class, this::onConsensusReached);
        bus.subscribe(SettlementEvent.AttestationDisputed.class, e ->
            log.warn("Attestation {} disputed, no trigger raised (outliers {})", e.attestationId(), e.outlierOracleIds()));
        bus.subscribe(SettlementEvent.TriggerValidated.class, e -> payoutOrchestrator.initiatePayout(e.triggerId()));
        bus.subscribe(SettlementEvent.TriggerRejected.class, e ->
            log.info("Trigger {} for policy {} closed without payout: {}", e.triggerId(), e.policyId(), e.reason()));
        bus.subscribe(SettlementEvent.CessionFunded.class, e ->
            payoutOrchestrator.onCessionFunded(e.cessionId(), e.fundingId(), e.amount()));
        bus.subscribe(SettlementEvent.PayoutLegCompleted.class, e -> payoutOrchestrator.onLegCompleted(e.payoutId()));
        bus.subscribe(SettlementEvent.PayoutLegFailed.class, e ->
            log.warn("Leg {} of payout {} failed: {}", e.transactionId(), e.payoutId(), e.failureReason()));
        bus.subscribe(SettlementEvent.PayoutSettled.class, e ->
            log.info("Policy {} settled by payout {}", e.policyId(), e.payoutId()));
    }

    void onConsensusReached(SettlementEvent.ConsensusReached event) {
        DataAttestation attestation = oracleCommittee.getAttestation(event.attestationId());
        DataRequest request = attestation.getDataRequest();
        if (request.policyId() == null) {
            log.debug("Attestation {} is not tied to a policy", event.attestationId());
            return;
        }
        EventData eventData = new EventData(
            request.parameter(),
            event.finalValue(),
            request.unit(),
            request.location(),
            request.window());
        triggerService.ingest(request.policyId(), eventData, ORACLE_SOURCE_PREFIX + event.attestationId());
    }
}
