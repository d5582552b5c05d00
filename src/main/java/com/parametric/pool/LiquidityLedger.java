package com.parametric.pool;

import com.parametric.error.InsufficientLiquidityException;
import com.parametric.error.ValidationException;
import com.parametric.ledger.LedgerChannel;
import com.parametric.ledger.LedgerMessage;
import com.parametric.ledger.LedgerPublisher;
import com.parametric.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Risk pool balances and claim reservations.
 *
 * <p>Every balance change is one conditional update of the pool document: the check
 * and the move happen inside the same atomic mutation, so racing reservations can
 * never overdraw a pool.
 */
public class LiquidityLedger {

    private static final Logger log = LoggerFactory.getLogger(LiquidityLedger.class);

    private final DocumentStore<RiskPool> pools;
    private final DocumentStore<LiquidityReservation> reservations;
    private final PremiumAllocator premiumAllocator;
    private final LedgerPublisher ledger;
    private final Clock clock;

    public LiquidityLedger(DocumentStore<RiskPool> pools,
                           DocumentStore<LiquidityReservation> reservations,
                           PremiumAllocator premiumAllocator,
                           LedgerPublisher ledger,
                           Clock clock) {
        this.pools = pools;
        this.reservations = reservations;
        this.premiumAllocator = premiumAllocator;
        this.ledger = ledger;
        this.clock = clock;
    }

    public RiskPool createPool(String name, String currency) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (currency == null || currency.isBlank()) {
            throw new ValidationException("currency is required");
        }
        Instant now = clock.instant();
        RiskPool pool = new RiskPool();
        pool.setPoolId("POOL-" + UUID.randomUUID());
        pool.setName(name);
        pool.setCurrency(currency);
        pool.setCurrentCapacity(BigDecimal.ZERO);
        pool.setAvailableLiquidity(BigDecimal.ZERO);
        pool.setReservedLiquidity(BigDecimal.ZERO);
        pool.setCommittedOutflows(BigDecimal.ZERO);
        pool.setTier1Balance(BigDecimal.ZERO);
        pool.setTier2Balance(BigDecimal.ZERO);
        pool.setTier3Balance(BigDecimal.ZERO);
        pool.setTotalPremiums(BigDecimal.ZERO);
        pool.setReinsurerPremiums(BigDecimal.ZERO);
        pool.setSystemFees(BigDecimal.ZERO);
        pool.setCreatedAt(now);
        pool.setUpdatedAt(now);
        RiskPool stored = pools.insert(pool);
        log.info("Risk pool {} created ({}, {})", stored.getPoolId(), name, currency);
        return stored;
    }

    public RiskPool getPool(String poolId) {
        return pools.require(poolId);
    }

    public RiskPool deposit(String poolId, BigDecimal amount, LiquidityTier tier, String reference) {
        requirePositive(amount, "deposit amount");
        LiquidityTier target = tier == null ? LiquidityTier.TIER_1 : tier;
        Instant now = clock.instant();
        RiskPool updated = pools.update(poolId, pool -> {
            credit(pool, target, amount);
            pool.setCurrentCapacity(pool.getCurrentCapacity().add(amount));
            pool.setAvailableLiquidity(pool.getAvailableLiquidity().add(amount));
            pool.setUpdatedAt(now);
            verifyInvariant(pool);
            return pool;
        });
        ledger.publish(LedgerChannel.POOL_EVENTS, LedgerMessage.of(LedgerMessage.POOL_DEPOSIT)
            .with("poolId", poolId)
            .with("amount", amount.toPlainString())
            .with("tier", target.getValue())
            .with("reference", reference)
            .build());
        log.info("Pool {} deposit {} into {} (available {})", poolId, amount.toPlainString(),
            target.getValue(), updated.getAvailableLiquidity().toPlainString());
        return updated;
    }

    /** Applies the premium split; only the pool share becomes pool liquidity. */
    public PremiumAllocation contributePremium(String poolId, String policyId, BigDecimal premium) {
        PremiumAllocation allocation = premiumAllocator.allocate(premium);
        Instant now = clock.instant();
        pools.update(poolId, pool -> {
            credit(pool, LiquidityTier.TIER_1, allocation.poolShare());
            pool.setCurrentCapacity(pool.getCurrentCapacity().add(allocation.poolShare()));
            pool.setAvailableLiquidity(pool.getAvailableLiquidity().add(allocation.poolShare()));
            pool.setTotalPremiums(pool.getTotalPremiums().add(allocation.poolShare()));
            pool.setReinsurerPremiums(pool.getReinsurerPremiums().add(allocation.reinsurerShare()));
            pool.setSystemFees(pool.getSystemFees().add(allocation.systemFee()));
            pool.setUpdatedAt(now);
            verifyInvariant(pool);
            return pool;
        });
        ledger.publish(LedgerChannel.POOL_EVENTS, LedgerMessage.of(LedgerMessage.PREMIUM_PAID)
            .with("poolId", poolId)
            .with("policyId", policyId)
            .with("premium", allocation.premium().toPlainString())
            .with("poolShare", allocation.poolShare().toPlainString())
            .with("reinsurerShare", allocation.reinsurerShare().toPlainString())
            .with("systemFee", allocation.systemFee().toPlainString())
            .build());
        log.info("Premium {} for policy {} allocated: pool {} / reinsurer {} / fee {}", premium.toPlainString(),
            policyId, allocation.poolShare().toPlainString(), allocation.reinsurerShare().toPlainString(),
            allocation.systemFee().toPlainString());
        return allocation;
    }

    public LiquidityCheck checkSufficiency(String poolId, BigDecimal amount) {
        requirePositive(amount, "amount");
        RiskPool pool = pools.require(poolId);
        BigDecimal available = pool.getAvailableLiquidity();
        BigDecimal tier1 = pool.getTier1Balance();
        BigDecimal tier12 = tier1.add(pool.getTier2Balance());

        int days;
        if (tier1.compareTo(amount) >= 0) {
            days = 0;
        } else if (tier12.compareTo(amount) >= 0) {
            days = 3;
        } else if (available.compareTo(amount) >= 0) {
            days = 15;
        } else {
            days = 30;
        }
        return new LiquidityCheck(
            poolId,
            amount,
            available.compareTo(amount) >= 0,
            tier1.compareTo(amount) >= 0,
            amount.subtract(available).max(BigDecimal.ZERO),
            days);
    }

    /**
     * Moves {@code amount} from available to reserved liquidity for {@code claimId},
     * drawing Tier-1 first, then Tier-2, then Tier-3. Reserving again for a claim that
     * already holds an active reservation on the pool returns that reservation.
     *
     * @throws InsufficientLiquidityException if available liquidity is below {@code amount};
     *                                        the pool is left unchanged
     */
    public LiquidityReservation reserve(String poolId, BigDecimal amount, String claimId) {
        requirePositive(amount, "reservation amount");
        if (claimId == null || claimId.isBlank()) {
            throw new ValidationException("claim_id is required");
        }
        Optional<LiquidityReservation> existing = activeReservation(poolId, claimId);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = clock.instant();
        BigDecimal[] drawn = new BigDecimal[3];
        pools.update(poolId, pool -> {
            if (pool.getAvailableLiquidity().compareTo(amount) < 0) {
                throw new InsufficientLiquidityException(poolId, amount, pool.getAvailableLiquidity());
            }
            BigDecimal remaining = amount;
            drawn[0] = remaining.min(pool.getTier1Balance());
            remaining = remaining.subtract(drawn[0]);
            drawn[1] = remaining.min(pool.getTier2Balance());
            remaining = remaining.subtract(drawn[1]);
            drawn[2] = remaining;
            pool.setTier1Balance(pool.getTier1Balance().subtract(drawn[0]));
            pool.setTier2Balance(pool.getTier2Balance().subtract(drawn[1]));
            pool.setTier3Balance(pool.getTier3Balance().subtract(drawn[2]));
            pool.setAvailableLiquidity(pool.getAvailableLiquidity().subtract(amount));
            pool.setReservedLiquidity(pool.getReservedLiquidity().add(amount));
            pool.setUpdatedAt(now);
            verifyInvariant(pool);
            return pool;
        });

        LiquidityReservation reservation = new LiquidityReservation();
        reservation.setReservationId("RSV-" + UUID.randomUUID());
        reservation.setPoolId(poolId);
        reservation.setClaimId(claimId);
        reservation.setAmount(amount);
        reservation.setTier1Drawn(drawn[0]);
        reservation.setTier2Drawn(drawn[1]);
        reservation.setTier3Drawn(drawn[2]);
        reservation.setStatus(ReservationStatus.ACTIVE);
        reservation.setCreatedAt(now);
        LiquidityReservation stored = reservations.insert(reservation);
        log.info("Pool {} reserved {} for claim {} as {}", poolId, amount.toPlainString(), claimId,
            stored.getReservationId());
        return stored;
    }

    /**
     * Closes the active reservation of {@code claimId}. Used funds leave the pool as a
     * committed outflow; unused funds return to Tier-1.
     */
    public LiquidityReservation release(String poolId, BigDecimal amount, String claimId, boolean wasUsed) {
        requirePositive(amount, "release amount");
        LiquidityReservation reservation = activeReservation(poolId, claimId)
            .orElseThrow(() -> new ValidationException("no active reservation on pool " + poolId + " for claim " + claimId));
        if (reservation.getAmount().compareTo(amount) != 0) {
            throw new ValidationException("release of " + amount.toPlainString() + " does not match reservation "
                + reservation.getReservationId() + " of " + reservation.getAmount().toPlainString());
        }

        Instant now = clock.instant();
        LiquidityReservation closed = reservations.update(reservation.getReservationId(), r -> {
            if (r.getStatus() != ReservationStatus.ACTIVE) {
                throw new ValidationException("reservation " + r.getReservationId() + " is already " + r.getStatus().getValue());
            }
            r.setStatus(wasUsed ? ReservationStatus.UTILIZED : ReservationStatus.RELEASED);
            r.setClosedAt(now);
            return r;
        });

        RiskPool updated = pools.update(poolId, pool -> {
            pool.setReservedLiquidity(pool.getReservedLiquidity().subtract(amount));
            if (wasUsed) {
                pool.setCommittedOutflows(pool.getCommittedOutflows().add(amount));
            } else {
                credit(pool, LiquidityTier.TIER_1, amount);
                pool.setAvailableLiquidity(pool.getAvailableLiquidity().add(amount));
            }
            pool.setUpdatedAt(now);
            verifyInvariant(pool);
            return pool;
        });

        if (wasUsed) {
            ledger.publish(LedgerChannel.POOL_EVENTS, LedgerMessage.of(LedgerMessage.PAYOUT_DEBITED)
                .with("poolId", poolId)
                .with("claimId", claimId)
                .with("reservationId", closed.getReservationId())
                .with("amount", amount.toPlainString())
                .build());
        }
        log.info("Pool {} {} {} for claim {} (available {}, reserved {})", poolId,
            wasUsed ? "consumed" : "released", amount.toPlainString(), claimId,
            updated.getAvailableLiquidity().toPlainString(), updated.getReservedLiquidity().toPlainString());
        return closed;
    }

    public Optional<LiquidityReservation> findReservation(String reservationId) {
        return reservations.findById(reservationId);
    }

    private Optional<LiquidityReservation> activeReservation(String poolId, String claimId) {
        return reservations.find(r -> poolId.equals(r.getPoolId())
                && claimId.equals(r.getClaimId())
                && r.getStatus() == ReservationStatus.ACTIVE, 1)
            .stream()
            .findFirst();
    }

    private static void credit(RiskPool pool, LiquidityTier tier, BigDecimal amount) {
        switch (tier) {
            case TIER_1 -> pool.setTier1Balance(pool.getTier1Balance().add(amount));
            case TIER_2 -> pool.setTier2Balance(pool.getTier2Balance().add(amount));
            case TIER_3 -> pool.setTier3Balance(pool.getTier3Balance().add(amount));
        }
    }

    static void verifyInvariant(RiskPool pool) {
        BigDecimal tiers = pool.getTier1Balance().add(pool.getTier2Balance()).add(pool.getTier3Balance());
        BigDecimal net = pool.getCurrentCapacity().subtract(pool.getCommittedOutflows());
        boolean holds = pool.getAvailableLiquidity().signum() >= 0
            && pool.getReservedLiquidity().signum() >= 0
            && pool.getAvailableLiquidity().compareTo(tiers) == 0
            && pool.getAvailableLiquidity().add(pool.getReservedLiquidity()).compareTo(net) == 0;
        if (!holds) {
            log.error("Liquidity invariant broken on pool {}: available={} reserved={} capacity={} committed={} tiers={}",
                pool.getPoolId(), pool.getAvailableLiquidity(), pool.getReservedLiquidity(),
                pool.getCurrentCapacity(), pool.getCommittedOutflows(), tiers);
            throw new IllegalStateException("liquidity invariant broken on pool " + pool.getPoolId());
        }
    }

    private static void requirePositive(BigDecimal amount, String field) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
    }
}
