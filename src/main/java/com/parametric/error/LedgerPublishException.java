package com.parametric.error;

/**
 * Transient failure to append a message to a ledger channel. Callers retry with backoff.
 */
public class LedgerPublishException extends SettlementException {

    public LedgerPublishException(String message) {
        super("LEDGER_PUBLISH_FAILED", message);
    }

    public LedgerPublishException(String message, Throwable cause) {
        super("LEDGER_PUBLISH_FAILED", message, cause);
    }
}
