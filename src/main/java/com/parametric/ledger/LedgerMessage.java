package com.parametric.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A plain structured record tagged with a {@code type} discriminator,
 * e.g. {@code PayoutExecuted} or {@code CessionRequested}.
 */
public record LedgerMessage(String type, Map<String, Object> body) {

    public static final String POLICY_REGISTERED = "PolicyRegistered";
    public static final String POLICY_STATUS_INIT = "PolicyStatusInit";
    public static final String POLICY_STATUS_CHANGED = "PolicyStatusChanged";
    public static final String RULE_CREATED = "RuleCreated";
    public static final String TRIGGER_OBSERVED = "TriggerObserved";
    public static final String PAYOUT_EXECUTED = "PayoutExecuted";
    public static final String STOP_LOSS_BREACHED = "StopLossBreached";
    public static final String POOL_DEPOSIT = "PoolDeposit";
    public static final String PREMIUM_PAID = "PremiumPaid";
    public static final String PAYOUT_DEBITED = "PayoutDebited";
    public static final String CESSION_REQUESTED = "CessionRequested";
    public static final String CESSION_FUNDED = "CessionFunded";

    public LedgerMessage {
        Objects.requireNonNull(type, "type is required");
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public static Builder of(String type) {
        return new Builder(type);
    }

    /** Flattened wire form with {@code type} as the first field. */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type);
        wire.putAll(body);
        return wire;
    }

    public static final class Builder {
        private final String type;
        private final Map<String, Object> body = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        /** Null values are omitted from the message. */
        public Builder with(String key, Object value) {
            if (value != null) {
                body.put(key, value);
            }
            return this;
        }

        public LedgerMessage build() {
            return new LedgerMessage(type, body);
        }
    }
}
