package com.parametric.bus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Typed hand-off between settlement stages. Each record is the output of one
 * stage and the required input of the next:
 *
 * <pre>
 * SignatureSubmitted -> ConsensusReached | AttestationDisputed
 * ConsensusReached   -> TriggerValidated | TriggerRejected
 * TriggerValidated   -> PayoutInitiated (+ CessionRequested above retention)
 * CessionFunded      -> cession leg
 * PayoutLegCompleted -> PayoutSettled once every planned leg completed
 * </pre>
 */
public sealed interface SettlementEvent {

    record AttestationRequested(String attestationId, List<String> qualifiedOracleIds) implements SettlementEvent {}

    record SignatureSubmitted(String attestationId, String oracleId, double value) implements SettlementEvent {}

    record ConsensusReached(String attestationId, double finalValue, double confidence) implements SettlementEvent {}

    record AttestationDisputed(String attestationId, List<String> outlierOracleIds) implements SettlementEvent {}

    record AttestationExpired(String attestationId) implements SettlementEvent {}

    record TriggerValidated(String triggerId, String policyId) implements SettlementEvent {}

    record TriggerRejected(String triggerId, String policyId, String reason) implements SettlementEvent {}

    record PayoutInitiated(String payoutId, String policyId, String triggerId, BigDecimal netPayout)
        implements SettlementEvent {}

    record CessionRequested(String cessionId, String policyId, String payoutId, BigDecimal excessAmount)
        implements SettlementEvent {}

    record CessionFunded(String cessionId, String policyId, String fundingId, BigDecimal amount)
        implements SettlementEvent {}

    record PayoutLegCompleted(String transactionId, String payoutId, String policyId, String source)
        implements SettlementEvent {}

    record PayoutLegFailed(String transactionId, String payoutId, String policyId, String failureReason)
        implements SettlementEvent {}

    record PayoutSettled(String payoutId, String policyId) implements SettlementEvent {}
}
