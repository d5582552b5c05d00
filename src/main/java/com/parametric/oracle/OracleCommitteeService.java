package com.parametric.oracle;

import com.parametric.bus.SettlementBus;
import com.parametric.bus.SettlementEvent;
import com.parametric.config.SettlementProperties;
import com.parametric.error.InvalidSignatureException;
import com.parametric.error.InvalidStateTransitionException;
import com.parametric.error.ValidationException;
import com.parametric.store.DocumentStore;
import com.parametric.store.StripedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Oracle committee: membership, attestation rounds and consensus.
 *
 * <p>All mutations of one attestation run under that attestation's lock, so two
 * concurrent submissions cannot both complete the quorum. Workflow events are
 * published only after the lock is released.
 */
public class OracleCommitteeService {

    private static final Logger log = LoggerFactory.getLogger(OracleCommitteeService.class);

    static final double COVERAGE_DEGREES = 1.0;
    static final int TARGET_ACTIVE_ORACLES = 10;
    static final double RESPONSE_BASELINE_MINUTES = 60.0;
    private static final int SCAN_LIMIT = 10_000;

    private final DocumentStore<Oracle> oracles;
    private final DocumentStore<DataSource> dataSources;
    private final DocumentStore<DataAttestation> attestations;
    private final ConsensusEngine consensusEngine;
    private final SignatureVerifier signatureVerifier;
    private final SettlementBus bus;
    private final SettlementProperties properties;
    private final Clock clock;
    private final StripedLocks attestationLocks = new StripedLocks();

    public OracleCommitteeService(DocumentStore<Oracle> oracles,
                                  DocumentStore<DataSource> dataSources,
                                  DocumentStore<DataAttestation> attestations,
                                  ConsensusEngine consensusEngine,
                                  SignatureVerifier signatureVerifier,
                                  SettlementBus bus,
                                  SettlementProperties properties,
                                  Clock clock) {
        this.oracles = oracles;
        this.dataSources = dataSources;
        this.attestations = attestations;
        this.consensusEngine = consensusEngine;
        this.signatureVerifier = signatureVerifier;
        this.bus = bus;
        this.properties = properties;
        this.clock = clock;
    }

    // --- membership ---

    public Oracle registerOracle(OracleRegistration registration) {
        requireText(registration.name(), "name");
        requireText(registration.publicKey(), "public_key");
        if (registration.supportedParameters() == null || registration.supportedParameters().isEmpty()) {
            throw new ValidationException("supported_parameters must not be empty");
        }
        if (registration.location() == null) {
            throw new ValidationException("location is required");
        }
        if (registration.stakingAmount() != null && registration.stakingAmount().signum() < 0) {
            throw new ValidationException("staking_amount must not be negative");
        }

        Oracle oracle = new Oracle();
        oracle.setOracleId("ORC-" + UUID.randomUUID());
        oracle.setName(registration.name());
        oracle.setOperator(registration.operator());
        oracle.setPublicKey(registration.publicKey());
        oracle.setSupportedParameters(registration.supportedParameters());
        oracle.setLocation(registration.location());
        oracle.setStatus(OracleStatus.PENDING_APPROVAL);
        oracle.setReputation(OracleReputation.initial(registration.stakingAmount()));
        oracle.setRegisteredAt(clock.instant());

        Oracle stored = oracles.insert(oracle);
        log.info("Oracle {} registered ({}), awaiting approval", stored.getOracleId(), stored.getName());
        return stored;
    }

    public Oracle approveOracle(String oracleId) {
        return transition(oracleId, OracleStatus.PENDING_APPROVAL, OracleStatus.ACTIVE);
    }

    public Oracle suspendOracle(String oracleId) {
        return transition(oracleId, OracleStatus.ACTIVE, OracleStatus.SUSPENDED);
    }

    public Oracle reinstateOracle(String oracleId) {
        return transition(oracleId, OracleStatus.SUSPENDED, OracleStatus.ACTIVE);
    }

    public Oracle deactivateOracle(String oracleId) {
        Oracle updated = oracles.update(oracleId, oracle -> {
            if (oracle.getStatus() == OracleStatus.DEACTIVATED) {
                throw new InvalidStateTransitionException("oracle", oracleId,
                    oracle.getStatus().getValue(), OracleStatus.DEACTIVATED.getValue());
            }
            oracle.setStatus(OracleStatus.DEACTIVATED);
            return oracle;
        });
        log.info("Oracle {} deactivated", oracleId);
        return updated;
    }

    public Oracle slashOracle(String oracleId, BigDecimal amount, String reason) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("slash amount must be positive");
        }
        requireText(reason, "reason");
        Instant now = clock.instant();
        Oracle updated = oracles.update(oracleId, oracle -> {
            OracleReputation reputation = oracle.getReputation();
            BigDecimal remaining = reputation.getStakingAmount().subtract(amount).max(BigDecimal.ZERO);
            reputation.setStakingAmount(remaining);
            reputation.getSlashingHistory().add(new SlashingEvent(amount, reason, now));
            return oracle;
        });
        log.warn("Oracle {} slashed by {} ({}), remaining stake {}",
            oracleId, amount.toPlainString(), reason,
            updated.getReputation().getStakingAmount().toPlainString());
        return updated;
    }

    public DataSource registerDataSource(DataSourceRegistration registration) {
        requireText(registration.name(), "name");
        if (registration.type() == null) {
            throw new ValidationException("type is required");
        }
        if (registration.qualityScore() < 0.0 || registration.qualityScore() > 1.0) {
            throw new ValidationException("quality_score must be within [0, 1]");
        }
        if (registration.slaUptime() < 0.0 || registration.slaUptime() > 1.0) {
            throw new ValidationException("sla_uptime must be within [0, 1]");
        }

        DataSource source = new DataSource();
        source.setSourceId("SRC-" + UUID.randomUUID());
        source.setName(registration.name());
        source.setType(registration.type());
        source.setProvider(registration.provider());
        source.setParameters(registration.parameters());
        source.setQualityScore(registration.qualityScore());
        source.setSlaUptime(registration.slaUptime());
        source.setRegisteredAt(clock.instant());
        DataSource stored = dataSources.insert(source);
        log.info("Data source {} registered ({} via {})", stored.getSourceId(), stored.getType().getValue(), stored.getProvider());
        return stored;
    }

    public Oracle getOracle(String oracleId) {
        return oracles.require(oracleId);
    }

    public DataSource getDataSource(String sourceId) {
        return dataSources.require(sourceId);
    }

    // --- attestation rounds ---

    public DataAttestation requestAttestation(DataRequest request) {
        if (request == null) {
            throw new ValidationException("data_request is required");
        }
        requireText(request.parameter(), "parameter");
        if (request.location() == null) {
            throw new ValidationException("location is required");
        }
        if (request.window() == null || request.window().start() == null || request.window().end() == null
            || request.window().end().isBefore(request.window().start())) {
            throw new ValidationException("window must have a start before its end");
        }

        List<String> qualified = oracles.find(o -> o.getStatus() == OracleStatus.ACTIVE
                && o.supports(request.parameter())
                && request.location().within(o.getLocation(), COVERAGE_DEGREES), SCAN_LIMIT)
            .stream()
            .map(Oracle::getOracleId)
            .toList();

        Instant now = clock.instant();
        DataAttestation attestation = new DataAttestation();
        attestation.setAttestationId("ATT-" + UUID.randomUUID());
        attestation.setDataRequest(request);
        attestation.setQualifiedOracles(qualified);
        attestation.setStatus(AttestationStatus.PENDING);
        attestation.setRequestedAt(now);
        attestation.setExpirationDate(now.plus(properties.getAttestation().getTtl()));

        DataAttestation stored = attestations.insert(attestation);
        if (qualified.size() < properties.getConsensus().getRequiredSignatures()) {
            log.warn("Attestation {} for {} has only {} qualified oracles",
                stored.getAttestationId(), request.parameter(), qualified.size());
        }
        log.info("Attestation {} requested for {} at {}", stored.getAttestationId(), request.parameter(),
            request.location().key());
        bus.publish(new SettlementEvent.AttestationRequested(stored.getAttestationId(), qualified));
        return stored;
    }

    /**
     * Records one oracle's value. A repeated submission by the same oracle replaces its
     * earlier entry. Consensus is evaluated once the quorum is present; the round then
     * becomes terminal either way.
     */
    public DataAttestation submitSignature(String attestationId, String oracleId, String signature, double value) {
        List<SettlementEvent> outbox = new ArrayList<>();
        DataAttestation result;
        ReentrantLock lock = attestationLocks.lockFor(attestationId);
        try {
            lock.lock();
            try {
                result = submitLocked(attestationId, oracleId, signature, value, outbox);
            } finally {
                lock.unlock();
            }
        } finally {
            // an expiry detected on submission is announced even though the submission fails
            outbox.forEach(bus::publish);
        }
        return result;
    }

    private DataAttestation submitLocked(String attestationId, String oracleId, String signature, double value,
                                         List<SettlementEvent> outbox) {
        DataAttestation attestation = attestations.require(attestationId);
        Instant now = clock.instant();

        if (attestation.getStatus() == AttestationStatus.PENDING && now.isAfter(attestation.getExpirationDate())) {
            markExpired(attestationId, now);
            outbox.add(new SettlementEvent.AttestationExpired(attestationId));
            throw new ValidationException("attestation " + attestationId + " expired at " + attestation.getExpirationDate());
        }
        if (!attestation.getStatus().acceptsSubmissions()) {
            throw new ValidationException("attestation " + attestationId + " is "
                + attestation.getStatus().getValue() + " and accepts no submissions");
        }

        Oracle oracle = oracles.require(oracleId);
        if (oracle.getStatus() != OracleStatus.ACTIVE) {
            throw new ValidationException("oracle " + oracleId + " is not active");
        }
        if (!signatureVerifier.verify(oracle, attestationId, signature, value)) {
            throw new InvalidSignatureException(oracleId, attestationId);
        }

        double weight = ReputationModel.weight(oracle.getReputation());
        boolean firstSubmission = attestation.putSignature(new OracleSignature(oracleId, signature, value, weight, now));
        oracles.update(oracleId, o -> {
            if (firstSubmission) {
                o.getReputation().recordParticipation();
            }
            o.setLastActiveAt(now);
            return o;
        });
        outbox.add(new SettlementEvent.SignatureSubmitted(attestationId, oracleId, value));
        log.debug("Oracle {} submitted {} to attestation {} (weight {}, {})",
            oracleId, value, attestationId, weight, firstSubmission ? "new" : "replaced");

        int received = attestation.getOracleSignatures().size();
        if (!consensusEngine.quorumMet(received)) {
            return attestations.save(attestation);
        }

        ConsensusEvaluation evaluation = consensusEngine.evaluate(attestation.getOracleSignatures());
        ConsensusResult consensus = evaluation.result();
        attestation.setConsensusResult(consensus);
        attestation.setAggregatedData(evaluation.aggregatedData());
        attestation.setFinalizedAt(now);

        if (consensus.reached()) {
            attestation.setStatus(AttestationStatus.CONSENSUS_REACHED);
            DataAttestation saved = attestations.save(attestation);
            creditAccurateOracles(saved.getOracleSignatures(), Set.copyOf(consensus.outliers()));
            log.info("Attestation {} reached consensus: value={} confidence={} outliers={}",
                attestationId, consensus.finalValue(), consensus.confidence(), consensus.outliers());
            outbox.add(new SettlementEvent.ConsensusReached(attestationId, consensus.finalValue(), consensus.confidence()));
            return saved;
        }

        attestation.setStatus(AttestationStatus.DISPUTED);
        DataAttestation saved = attestations.save(attestation);
        log.warn("Attestation {} disputed: agreement {}/{} below {}, outliers={}",
            attestationId, consensus.consensusWeight(), consensus.totalWeight(), consensus.threshold(),
            consensus.outliers());
        outbox.add(new SettlementEvent.AttestationDisputed(attestationId, consensus.outliers()));
        return saved;
    }

    private void creditAccurateOracles(List<OracleSignature> signatures, Set<String> outliers) {
        for (OracleSignature signature : signatures) {
            if (outliers.contains(signature.oracleId())) {
                continue;
            }
            oracles.update(signature.oracleId(), o -> {
                o.getReputation().recordAccurate();
                return o;
            });
        }
    }

    public DataAttestation getAttestation(String attestationId) {
        return attestations.require(attestationId);
    }

    /** Moves pending rounds past their expiration date to {@code expired}. */
    public int expireAttestations() {
        Instant now = clock.instant();
        List<DataAttestation> due = attestations.find(a -> a.getStatus() == AttestationStatus.PENDING
            && now.isAfter(a.getExpirationDate()), SCAN_LIMIT);
        int expired = 0;
        for (DataAttestation candidate : due) {
            List<SettlementEvent> outbox = new ArrayList<>();
            ReentrantLock lock = attestationLocks.lockFor(candidate.getAttestationId());
            lock.lock();
            try {
                DataAttestation current = attestations.require(candidate.getAttestationId());
                if (current.getStatus() == AttestationStatus.PENDING) {
                    markExpired(current.getAttestationId(), now);
                    outbox.add(new SettlementEvent.AttestationExpired(current.getAttestationId()));
                    expired++;
                }
            } finally {
                lock.unlock();
            }
            outbox.forEach(bus::publish);
        }
        if (expired > 0) {
            log.info("Expired {} pending attestations", expired);
        }
        return expired;
    }

    private void markExpired(String attestationId, Instant now) {
        attestations.update(attestationId, a -> {
            a.setStatus(AttestationStatus.EXPIRED);
            a.setFinalizedAt(now);
            return a;
        });
        log.info("Attestation {} expired", attestationId);
    }

    public CommitteeHealth committeeHealth() {
        Instant now = clock.instant();
        long total = oracles.count(o -> true);
        long active = oracles.count(o -> o.getStatus() == OracleStatus.ACTIVE);
        Instant dayAgo = now.minus(Duration.ofHours(24));
        long recent = attestations.count(a -> !a.getRequestedAt().isBefore(dayAgo));
        long allRounds = attestations.count(a -> true);
        long reached = attestations.count(a -> a.getStatus() == AttestationStatus.CONSENSUS_REACHED);
        double successRate = allRounds == 0 ? 0.0 : (double) reached / allRounds;
        double avgResponse = averageResponseMinutes();

        double score = Math.min((double) active / TARGET_ACTIVE_ORACLES, 1.0) * 0.4
            + successRate * 0.4
            + Math.max(0.0, 1.0 - avgResponse / RESPONSE_BASELINE_MINUTES) * 0.2;

        return new CommitteeHealth(
            total,
            active,
            total == 0 ? 0.0 : (double) active / total,
            recent,
            successRate,
            avgResponse,
            score,
            now);
    }

    /** Mean of (signature time - request time) over every recorded signature, in minutes. */
    private double averageResponseMinutes() {
        long count = 0;
        double totalMinutes = 0.0;
        for (DataAttestation attestation : attestations.find(a -> true, SCAN_LIMIT)) {
            for (OracleSignature signature : attestation.getOracleSignatures()) {
                Duration elapsed = Duration.between(attestation.getRequestedAt(), signature.timestamp());
                totalMinutes += Math.max(0L, elapsed.toMillis()) / 60_000.0;
                count++;
            }
        }
        return count == 0 ? 0.0 : totalMinutes / count;
    }

    private Oracle transition(String oracleId, OracleStatus from, OracleStatus to) {
        Instant now = clock.instant();
        Oracle updated = oracles.update(oracleId, oracle -> {
            if (oracle.getStatus() != from) {
                throw new InvalidStateTransitionException("oracle", oracleId,
                    oracle.getStatus().getValue(), to.getValue());
            }
            oracle.setStatus(to);
            if (to == OracleStatus.ACTIVE && oracle.getApprovedAt() == null) {
                oracle.setApprovedAt(now);
            }
            return oracle;
        });
        log.info("Oracle {} {} -> {}", oracleId, from.getValue(), to.getValue());
        return updated;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
