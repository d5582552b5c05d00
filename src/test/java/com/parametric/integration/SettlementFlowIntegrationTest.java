package com.parametric.integration;

import com.parametric.cession.CessionRecord;
import com.parametric.cession.CessionService;
import com.parametric.cession.CessionStatus;
import com.parametric.oracle.AttestationStatus;
import com.parametric.oracle.DataAttestation;
import com.parametric.oracle.DataRequest;
import com.parametric.oracle.GeoLocation;
import com.parametric.oracle.Oracle;
import com.parametric.oracle.OracleCommitteeService;
import com.parametric.oracle.OracleRegistration;
import com.parametric.oracle.TimeWindow;
import com.parametric.payout.FundingSource;
import com.parametric.payout.Payout;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.payout.PayoutStatus;
import com.parametric.payout.PayoutTransaction;
import com.parametric.payout.TransactionStatus;
import com.parametric.trigger.ComparisonOperator;
import com.parametric.policy.CoverageDetails;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyApplication;
import com.parametric.policy.PolicyService;
import com.parametric.policy.PolicyStatus;
import com.parametric.policy.PremiumStructure;
import com.parametric.policy.ReinsuranceDetails;
import com.parametric.policy.TriggerCondition;
import com.parametric.pool.LiquidityLedger;
import com.parametric.pool.LiquidityTier;
import com.parametric.pool.RiskPool;
import com.parametric.trigger.Trigger;
import com.parametric.trigger.TriggerService;
import com.parametric.trigger.TriggerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end through the wired application context:
 *
 * oracle round -> consensus -> trigger validated -> pool leg -> stop-loss cession
 * -> reinsurer funding -> cession leg -> policy paid out
 */
@SpringBootTest(properties = "settlement.scheduling.enabled=false")
class SettlementFlowIntegrationTest {

    private static final String RAINFALL = "rainfall_deficit_pct";

    @Autowired OracleCommitteeService committee;
    @Autowired PolicyService policyService;
    @Autowired TriggerService triggerService;
    @Autowired LiquidityLedger liquidityLedger;
    @Autowired CessionService cessionService;
    @Autowired PayoutOrchestrator orchestrator;

    @Test
    @DisplayName("Oracle consensus above threshold pays the policy out through pool and reinsurer")
    void consensusToPaidOut() {
        GeoLocation site = new GeoLocation(12.5, 40.5, "afar");
        RiskPool pool = liquidityLedger.createPool("horn-drought", "USD");
        liquidityLedger.deposit(pool.getPoolId(), new BigDecimal("150000"), LiquidityTier.TIER_1, "seed-capital");

        Policy policy = activePolicy(pool.getPoolId(), site,
            new ReinsuranceDetails("RE-MUNICH", new BigDecimal("25"), new BigDecimal("60000")));
        List<Oracle> oracles = activeOracles(site, "afar", 3);

        DataAttestation round = committee.requestAttestation(new DataRequest(
            RAINFALL, site, lastDay(), 0.5, "percent", policy.getPolicyId()));
        assertEquals(3, round.getQualifiedOracles().size());

        double[] readings = {42.0, 41.8, 42.2};
        for (int i = 0; i < oracles.size(); i++) {
            Oracle oracle = oracles.get(i);
            committee.submitSignature(round.getAttestationId(), oracle.getOracleId(), "sig-" + oracle.getOracleId(), readings[i]);
        }

        DataAttestation finalized = committee.getAttestation(round.getAttestationId());
        assertEquals(AttestationStatus.CONSENSUS_REACHED, finalized.getStatus());
        assertEquals(42.0, finalized.getConsensusResult().finalValue(), 1e-9);

        List<Trigger> triggers = triggerService.triggersForPolicy(policy.getPolicyId());
        assertEquals(1, triggers.size());
        assertEquals(TriggerStatus.PROCESSED, triggers.get(0).getStatus());
        assertTrue(triggers.get(0).getSource().endsWith(round.getAttestationId()));

        Payout inFlight = orchestrator.payoutsForPolicy(policy.getPolicyId()).get(0);
        assertEquals(PayoutStatus.PROCESSING, inFlight.getStatus());
        assertEquals(0, new BigDecimal("60000").compareTo(inFlight.getPoolAmount()));
        assertEquals(0, new BigDecimal("35000").compareTo(inFlight.getCessionAmount()));
        assertEquals(PolicyStatus.TRIGGERED, policyService.getPolicy(policy.getPolicyId()).getStatus());

        CessionRecord cession = cessionService.getCession(inFlight.getReinsuranceRecovery().cessionId());
        assertEquals(CessionStatus.REQUESTED, cession.getStatus());

        cessionService.funded(policy.getPolicyId(), new BigDecimal("35000"), "RE-MUNICH", "munich-wire-77");

        Payout settled = orchestrator.getPayout(inFlight.getPayoutId());
        assertEquals(PayoutStatus.COMPLETED, settled.getStatus());
        List<PayoutTransaction> legs = orchestrator.transactionsForPayout(settled.getPayoutId());
        assertEquals(2, legs.size());
        assertTrue(legs.stream().allMatch(t -> t.getStatus() == TransactionStatus.COMPLETED));
        assertTrue(legs.stream().anyMatch(t -> t.getSource() == FundingSource.CESSION));
        assertEquals(PolicyStatus.PAID_OUT, policyService.getPolicy(policy.getPolicyId()).getStatus());

        RiskPool after = liquidityLedger.getPool(pool.getPoolId());
        assertEquals(0, new BigDecimal("90000").compareTo(after.getAvailableLiquidity()));
        assertEquals(0, BigDecimal.ZERO.compareTo(after.getReservedLiquidity()));
    }

    @Test
    @DisplayName("Consensus below the threshold leaves the trigger pending and pays nothing")
    void consensusBelowThreshold_noPayout() {
        GeoLocation site = new GeoLocation(-20.5, 30.5, "masvingo");
        RiskPool pool = liquidityLedger.createPool("zim-drought", "USD");
        liquidityLedger.deposit(pool.getPoolId(), new BigDecimal("100000"), LiquidityTier.TIER_1, "seed-capital");
        Policy policy = activePolicy(pool.getPoolId(), site, null);
        List<Oracle> oracles = activeOracles(site, "masvingo", 3);

        DataAttestation round = committee.requestAttestation(new DataRequest(
            RAINFALL, site, lastDay(), 0.5, "percent", policy.getPolicyId()));
        for (Oracle oracle : oracles) {
            committee.submitSignature(round.getAttestationId(), oracle.getOracleId(), "sig-" + oracle.getOracleId(), 18.5);
        }

        List<Trigger> triggers = triggerService.triggersForPolicy(policy.getPolicyId());
        assertEquals(1, triggers.size());
        assertEquals(TriggerStatus.PENDING, triggers.get(0).getStatus());
        assertTrue(orchestrator.payoutsForPolicy(policy.getPolicyId()).isEmpty());
        assertEquals(PolicyStatus.ACTIVE, policyService.getPolicy(policy.getPolicyId()).getStatus());
    }

    private Policy activePolicy(String poolId, GeoLocation site, ReinsuranceDetails reinsurance) {
        Instant now = Instant.now();
        Policy issued = policyService.issuePolicy(new PolicyApplication(
            "ACC-COOP-" + site.region(),
            poolId,
            "drought-index",
            List.of(new TriggerCondition(RAINFALL, ComparisonOperator.GT, 40.0, "percent", site, "seasonal")),
            new CoverageDetails(new BigDecimal("100000"), new BigDecimal("5000"), "USD"),
            new PremiumStructure(new BigDecimal("4200"), "annual", "USD"),
            reinsurance,
            now.minus(Duration.ofDays(30)),
            now.plus(Duration.ofDays(335))));
        return policyService.activatePolicy(issued.getPolicyId());
    }

    private List<Oracle> activeOracles(GeoLocation site, String prefix, int count) {
        List<Oracle> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Oracle registered = committee.registerOracle(new OracleRegistration(
                prefix + "-gauge-" + i, "national-met", "pk-" + prefix + "-" + i, List.of(RAINFALL), site,
                new BigDecimal("2500")));
            result.add(committee.approveOracle(registered.getOracleId()));
        }
        return result;
    }

    private static TimeWindow lastDay() {
        Instant now = Instant.now();
        return new TimeWindow(now.minus(Duration.ofDays(1)), now);
    }
}
