package com.parametric.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * One logical append-only channel per message family.
 */
public enum LedgerChannel {
    POLICY_REGISTRY("policy-registry"),
    RULES("rules"),
    TRIGGERS("triggers"),
    POLICY_STATUS("policy-status"),
    PAYOUTS("payouts"),
    POOL_EVENTS("pool-events"),
    CESSION("cession");

    private final String value;

    LedgerChannel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LedgerChannel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown ledger channel: " + raw));
    }
}
