package com.parametric.ledger;

import java.time.Instant;

/**
 * Pointer to a published ledger message, carried as {@code triggerRef},
 * {@code ruleRef} or {@code sourceRef} by later messages.
 */
public record LedgerRef(
    LedgerChannel channel,
    String transactionId,
    Instant consensusTimestamp
) {

    /** {@code channel/transactionId}, the form embedded in other messages. */
    public String toWire() {
        return channel.getValue() + "/" + transactionId;
    }

    public static String toWire(LedgerRef ref) {
        return ref == null ? null : ref.toWire();
    }
}
