package com.parametric.config;

import com.parametric.bus.SettlementBus;
import com.parametric.cession.CessionRecord;
import com.parametric.cession.CessionService;
import com.parametric.ledger.FinalityMonitor;
import com.parametric.ledger.InMemoryLedgerPublisher;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.oracle.ConsensusEngine;
import com.parametric.oracle.DataAttestation;
import com.parametric.oracle.DataSource;
import com.parametric.oracle.FormatSignatureVerifier;
import com.parametric.oracle.MedianDeviationOutlierDetector;
import com.parametric.oracle.Oracle;
import com.parametric.oracle.OracleCommitteeService;
import com.parametric.oracle.OutlierDetector;
import com.parametric.oracle.SignatureVerifier;
import com.parametric.oracle.StandardScoreOutlierDetector;
import com.parametric.payout.Payout;
import com.parametric.payout.PayoutCalculator;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.payout.PayoutTransaction;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyService;
import com.parametric.policy.PolicyStateMachine;
import com.parametric.pool.LiquidityLedger;
import com.parametric.pool.LiquidityReservation;
import com.parametric.pool.PremiumAllocator;
import com.parametric.pool.RiskPool;
import com.parametric.store.DocumentStore;
import com.parametric.trigger.Trigger;
import com.parametric.trigger.TriggerEvaluator;
import com.parametric.trigger.TriggerService;
import com.parametric.workflow.SettlementScheduler;
import com.parametric.workflow.SettlementWorkflow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SettlementProperties.class)
public class SettlementConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Process-local ledger. Every accepted message is reported with exactly the
     * finality threshold of confirmations, so legs complete on first check.
     */
    @Bean
    public InMemoryLedgerPublisher ledgerPublisher(Clock clock, SettlementProperties properties) {
        return new InMemoryLedgerPublisher(clock, properties.getPayout().getFinalityThreshold());
    }

    @Bean
    public OutlierDetector outlierDetector(SettlementProperties properties) {
        String method = properties.getConsensus().getOutlierMethod();
        if (StandardScoreOutlierDetector.METHOD.equalsIgnoreCase(method)) {
            return new StandardScoreOutlierDetector();
        }
        if (MedianDeviationOutlierDetector.METHOD.equalsIgnoreCase(method)) {
            return new MedianDeviationOutlierDetector();
        }
        throw new IllegalArgumentException("Unknown settlement.consensus.outlier-method: " + method);
    }

    @Bean
    public ConsensusEngine consensusEngine(SettlementProperties properties, OutlierDetector outlierDetector) {
        return new ConsensusEngine(properties.getConsensus(), outlierDetector);
    }

    @Bean
    public SignatureVerifier signatureVerifier() {
        return new FormatSignatureVerifier();
    }

    @Bean
    public OracleCommitteeService oracleCommitteeService(DocumentStore<Oracle> oracles,
                                                         DocumentStore<DataSource> dataSources,
                                                         DocumentStore<DataAttestation> attestations,
                                                         ConsensusEngine consensusEngine,
                                                         SignatureVerifier signatureVerifier,
                                                         SettlementBus bus,
                                                         SettlementProperties properties,
                                                         Clock clock) {
        return new OracleCommitteeService(oracles, dataSources, attestations, consensusEngine,
            signatureVerifier, bus, properties, clock);
    }

    @Bean
    public PolicyStateMachine policyStateMachine(DocumentStore<Policy> policies, LedgerPublisher ledger, Clock clock) {
        return new PolicyStateMachine(policies, ledger, clock);
    }

    @Bean
    public PolicyService policyService(DocumentStore<Policy> policies, PolicyStateMachine stateMachine,
                                       LedgerPublisher ledger, Clock clock) {
        return new PolicyService(policies, stateMachine, ledger, clock);
    }

    @Bean
    public TriggerService triggerService(DocumentStore<Trigger> triggers,
                                         DocumentStore<Policy> policies,
                                         PolicyStateMachine policyStateMachine,
                                         LedgerPublisher ledger,
                                         SettlementBus bus,
                                         SettlementProperties properties,
                                         Clock clock) {
        return new TriggerService(triggers, policies, policyStateMachine, new TriggerEvaluator(),
            ledger, bus, properties, clock);
    }

    @Bean
    public LiquidityLedger liquidityLedger(DocumentStore<RiskPool> pools,
                                           DocumentStore<LiquidityReservation> reservations,
                                           LedgerPublisher ledger,
                                           SettlementProperties properties,
                                           Clock clock) {
        return new LiquidityLedger(pools, reservations, new PremiumAllocator(properties.getPremium()), ledger, clock);
    }

    @Bean
    public CessionService cessionService(DocumentStore<CessionRecord> cessions, LedgerPublisher ledger,
                                         SettlementBus bus, Clock clock) {
        return new CessionService(cessions, ledger, bus, clock);
    }

    @Bean
    public PayoutOrchestrator payoutOrchestrator(DocumentStore<Payout> payouts,
                                                 DocumentStore<PayoutTransaction> transactions,
                                                 DocumentStore<Policy> policies,
                                                 TriggerService triggerService,
                                                 PolicyStateMachine policyStateMachine,
                                                 LiquidityLedger liquidityLedger,
                                                 CessionService cessionService,
                                                 LedgerPublisher ledger,
                                                 FinalityMonitor finalityMonitor,
                                                 SettlementBus bus,
                                                 SettlementProperties properties,
                                                 Clock clock) {
        return new PayoutOrchestrator(payouts, transactions, policies, triggerService, policyStateMachine,
            new PayoutCalculator(), liquidityLedger, cessionService, ledger, finalityMonitor, bus, properties, clock);
    }

    @Bean
    public SettlementWorkflow settlementWorkflow(SettlementBus bus,
                                                 OracleCommitteeService oracleCommittee,
                                                 TriggerService triggerService,
                                                 PayoutOrchestrator payoutOrchestrator) {
        return new SettlementWorkflow(bus, oracleCommittee, triggerService, payoutOrchestrator);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "settlement.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {

        @Bean
        public SettlementScheduler settlementScheduler(OracleCommitteeService oracleCommittee,
                                                       PolicyService policyService,
                                                       TriggerService triggerService,
                                                       PayoutOrchestrator payoutOrchestrator) {
            return new SettlementScheduler(oracleCommittee, policyService, triggerService, payoutOrchestrator);
        }
    }
}
