package com.parametric.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parametric.cession.CessionRecord;
import com.parametric.oracle.DataAttestation;
import com.parametric.oracle.DataSource;
import com.parametric.oracle.Oracle;
import com.parametric.payout.Payout;
import com.parametric.payout.PayoutTransaction;
import com.parametric.policy.Policy;
import com.parametric.pool.LiquidityReservation;
import com.parametric.pool.RiskPool;
import com.parametric.store.DocumentStore;
import com.parametric.store.InMemoryDocumentStore;
import com.parametric.trigger.Trigger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One document store per entity, keyed by business id.
 */
@Configuration
public class StoreConfiguration {

    @Bean
    public DocumentStore<Oracle> oracleStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("oracle", Oracle.class, Oracle::getOracleId, mapper);
    }

    @Bean
    public DocumentStore<DataSource> dataSourceStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("data source", DataSource.class, DataSource::getSourceId, mapper);
    }

    @Bean
    public DocumentStore<DataAttestation> attestationStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("attestation", DataAttestation.class, DataAttestation::getAttestationId, mapper);
    }

    @Bean
    public DocumentStore<Policy> policyStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("policy", Policy.class, Policy::getPolicyId, mapper);
    }

    @Bean
    public DocumentStore<Trigger> triggerStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("trigger", Trigger.class, Trigger::getTriggerId, mapper);
    }

    @Bean
    public DocumentStore<Payout> payoutStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("payout", Payout.class, Payout::getPayoutId, mapper);
    }

    @Bean
    public DocumentStore<PayoutTransaction> payoutTransactionStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("payout transaction", PayoutTransaction.class,
            PayoutTransaction::getTransactionId, mapper);
    }

    @Bean
    public DocumentStore<RiskPool> riskPoolStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("risk pool", RiskPool.class, RiskPool::getPoolId, mapper);
    }

    @Bean
    public DocumentStore<LiquidityReservation> reservationStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("liquidity reservation", LiquidityReservation.class,
            LiquidityReservation::getReservationId, mapper);
    }

    @Bean
    public DocumentStore<CessionRecord> cessionStore(ObjectMapper mapper) {
        return new InMemoryDocumentStore<>("cession", CessionRecord.class, CessionRecord::getCessionId, mapper);
    }
}
