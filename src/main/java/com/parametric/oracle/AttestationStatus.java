package com.parametric.oracle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of one consensus round. Only {@link #PENDING} accepts submissions.
 */
public enum AttestationStatus {
    PENDING("pending"),
    CONSENSUS_REACHED("consensus_reached"),
    DISPUTED("disputed"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String value;

    AttestationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean acceptsSubmissions() {
        return this == PENDING;
    }

    @JsonCreator
    public static AttestationStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown attestation status: " + raw));
    }
}
