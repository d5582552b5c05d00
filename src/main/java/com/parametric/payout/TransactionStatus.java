package com.parametric.payout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum TransactionStatus {
    INITIATED("initiated"),
    LIQUIDITY_RESERVED("liquidity_reserved"),
    PENDING_EXECUTION("pending_execution"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    DISPUTED("disputed");

    private final String value;

    TransactionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canMoveTo(TransactionStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /** {@code executing -> pending_execution} is the retry loop; every other move is forward only. */
    public Set<TransactionStatus> successors() {
        return switch (this) {
            case INITIATED -> EnumSet.of(LIQUIDITY_RESERVED, PENDING_EXECUTION, FAILED, CANCELLED);
            case LIQUIDITY_RESERVED -> EnumSet.of(PENDING_EXECUTION, FAILED, CANCELLED);
            case PENDING_EXECUTION -> EnumSet.of(EXECUTING, FAILED, CANCELLED);
            case EXECUTING -> EnumSet.of(PENDING_EXECUTION, COMPLETED, FAILED, DISPUTED);
            case COMPLETED, FAILED, CANCELLED, DISPUTED -> EnumSet.noneOf(TransactionStatus.class);
        };
    }

    @JsonCreator
    public static TransactionStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown transaction status: " + raw));
    }
}
