package com.parametric.pool;

import com.parametric.config.SettlementProperties;
import com.parametric.error.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits a premium into pool, reinsurer and system-fee shares. The system fee takes
 * the rounding remainder so the three parts always add up to the premium.
 */
public class PremiumAllocator {

    private static final int MONEY_SCALE = 2;

    private final BigDecimal poolShare;
    private final BigDecimal reinsurerShare;

    public PremiumAllocator(SettlementProperties.Premium shares) {
        BigDecimal total = shares.getPoolShare().add(shares.getReinsurerShare()).add(shares.getSystemFeeShare());
        if (total.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("premium shares must add up to 1, got " + total.toPlainString());
        }
        this.poolShare = shares.getPoolShare();
        this.reinsurerShare = shares.getReinsurerShare();
    }

    public PremiumAllocation allocate(BigDecimal premium) {
        if (premium == null || premium.signum() <= 0) {
            throw new ValidationException("premium must be positive");
        }
        BigDecimal pool = premium.multiply(poolShare).setScale(MONEY_SCALE, RoundingMode.HALF_EVEN);
        BigDecimal reinsurer = premium.multiply(reinsurerShare).setScale(MONEY_SCALE, RoundingMode.HALF_EVEN);
        BigDecimal fee = premium.subtract(pool).subtract(reinsurer);
        return new PremiumAllocation(premium, pool, reinsurer, fee);
    }
}
