package com.parametric.ledger;

import java.time.Instant;

/**
 * Result of a successful publish. The consensus timestamp is the finality anchor
 * of whatever the message records.
 */
public record LedgerReceipt(
    String transactionId,
    Instant consensusTimestamp,
    LedgerChannel channel,
    long sequenceNumber
) {

    public LedgerRef toRef() {
        return new LedgerRef(channel, transactionId, consensusTimestamp);
    }
}
