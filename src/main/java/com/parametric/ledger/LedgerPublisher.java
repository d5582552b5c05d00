package com.parametric.ledger;

/**
 * Append-only publication of typed messages to a ledger channel.
 *
 * @throws com.parametric.error.LedgerPublishException when the append fails transiently
 */
@FunctionalInterface
public interface LedgerPublisher {

    LedgerReceipt publish(LedgerChannel channel, LedgerMessage message);
}
