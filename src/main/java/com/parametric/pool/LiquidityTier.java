package com.parametric.pool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parametric.error.ValidationException;

import java.util.Arrays;

/**
 * How quickly pool capital can be turned into cash. Reservations draw tiers in declaration order.
 */
public enum LiquidityTier {
    TIER_1("tier_1", 0),
    TIER_2("tier_2", 7),
    TIER_3("tier_3", 30);

    private final String value;
    private final int maxLiquidationDays;

    LiquidityTier(String value, int maxLiquidationDays) {
        this.value = value;
        this.maxLiquidationDays = maxLiquidationDays;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int maxLiquidationDays() {
        return maxLiquidationDays;
    }

    @JsonCreator
    public static LiquidityTier fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown liquidity tier: " + raw));
    }
}
