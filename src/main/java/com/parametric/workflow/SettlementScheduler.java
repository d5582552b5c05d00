package com.parametric.workflow;

import com.parametric.oracle.OracleCommitteeService;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.policy.PolicyService;
import com.parametric.trigger.TriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.function.IntSupplier;

/**
 * Periodic sweeps: expiry of rounds and policies, stale trigger rejection, payout
 * retries and finality checks. A failing sweep does not stop the others.
 */
public class SettlementScheduler {

    private static final Logger log = LoggerFactory.getLogger(SettlementScheduler.class);

    private final OracleCommitteeService oracleCommittee;
    private final PolicyService policyService;
    private final TriggerService triggerService;
    private final PayoutOrchestrator payoutOrchestrator;

    public SettlementScheduler(OracleCommitteeService oracleCommittee,
                               PolicyService policyService,
                               TriggerService triggerService,
                               PayoutOrchestrator payoutOrchestrator) {
        this.oracleCommittee = oracleCommittee;
        this.policyService = policyService;
        this.triggerService = triggerService;
        this.payoutOrchestrator = payoutOrchestrator;
    }

    @Scheduled(fixedDelayString = "${settlement.scheduling.sweep-interval-ms:30000}")
    public void sweep() {
        run("attestation expiry", oracleCommittee::expireAttestations);
        run("policy expiry", policyService::expirePolicies);
        run("stale trigger rejection", triggerService::rejectStaleTriggers);
        run("trigger validation retry", triggerService::retryPendingValidations);
        run("payout retry", payoutOrchestrator::retryDueTransactions);
        run("finality confirmation", payoutOrchestrator::confirmFinality);
    }

    private void run(String name, IntSupplier task) {
        try {
            int affected = task.getAsInt();
            if (affected > 0) {
                log.info("Sweep '{}' affected {} records", name, affected);
            }
        } catch (RuntimeException ex) {
            log.error("Sweep '{}' failed", name, ex);
        }
    }
}
