package com.parametric.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum PolicyStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    TRIGGERED("triggered"),
    PAID_OUT("paid_out"),
    EXPIRED("expired"),
    CANCELLED("cancelled");

    private final String value;

    PolicyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<PolicyStatus> successors() {
        return switch (this) {
            case DRAFT -> EnumSet.of(ACTIVE, EXPIRED, CANCELLED);
            case ACTIVE -> EnumSet.of(TRIGGERED, EXPIRED, CANCELLED);
            case TRIGGERED -> EnumSet.of(PAID_OUT);
            case PAID_OUT, EXPIRED, CANCELLED -> EnumSet.noneOf(PolicyStatus.class);
        };
    }

    public boolean canMoveTo(PolicyStatus next) {
        return successors().contains(next);
    }

    @JsonCreator
    public static PolicyStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown policy status: " + raw));
    }
}
