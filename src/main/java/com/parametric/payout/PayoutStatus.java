package com.parametric.payout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum PayoutStatus {
    CALCULATED("calculated"),
    APPROVED("approved"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    DISPUTED("disputed"),
    CANCELLED("cancelled");

    private final String value;

    PayoutStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canMoveTo(PayoutStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public Set<PayoutStatus> successors() {
        return switch (this) {
            case CALCULATED -> EnumSet.of(APPROVED, FAILED, CANCELLED);
            case APPROVED -> EnumSet.of(PROCESSING, FAILED, CANCELLED);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, DISPUTED, CANCELLED);
            case COMPLETED, FAILED, DISPUTED, CANCELLED -> EnumSet.noneOf(PayoutStatus.class);
        };
    }

    @JsonCreator
    public static PayoutStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown payout status: " + raw));
    }
}
