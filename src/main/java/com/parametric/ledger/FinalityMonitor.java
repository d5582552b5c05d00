package com.parametric.ledger;

/**
 * Reports how many confirmations the ledger has accumulated for a published transaction.
 */
@FunctionalInterface
public interface FinalityMonitor {

    long confirmations(String ledgerTransactionId);
}
