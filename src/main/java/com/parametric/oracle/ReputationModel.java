package com.parametric.oracle;

import java.math.BigDecimal;

/**
 * Maps an oracle's track record to its voting weight:
 * {@code 1.0 + 0.5 * accuracy + 0.3 * uptime + min(stake / 100000, 0.2)}.
 * Weights therefore always fall in [1.0, 2.0].
 */
public final class ReputationModel {

    public static final double BASE_WEIGHT = 1.0;
    static final double ACCURACY_FACTOR = 0.5;
    static final double UPTIME_FACTOR = 0.3;
    static final BigDecimal STAKE_DIVISOR = new BigDecimal("100000");
    static final double MAX_STAKE_BONUS = 0.2;

    private ReputationModel() {
    }

    public static double weight(OracleReputation reputation) {
        if (reputation == null
            || !Double.isFinite(reputation.getAccuracyRate())
            || !Double.isFinite(reputation.getUptime())) {
            return BASE_WEIGHT;
        }
        double accuracy = clamp(reputation.getAccuracyRate());
        double uptime = clamp(reputation.getUptime());
        return BASE_WEIGHT
            + ACCURACY_FACTOR * accuracy
            + UPTIME_FACTOR * uptime
            + stakeBonus(reputation.getStakingAmount());
    }

    static double stakeBonus(BigDecimal stake) {
        if (stake == null || stake.signum() <= 0) {
            return 0.0;
        }
        return Math.min(stake.doubleValue() / STAKE_DIVISOR.doubleValue(), MAX_STAKE_BONUS);
    }

    private static double clamp(double fraction) {
        return Math.max(0.0, Math.min(1.0, fraction));
    }
}
