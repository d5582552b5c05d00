package com.parametric.error;

public class FinalityTimeoutException extends SettlementException {

    public FinalityTimeoutException(String transactionId, long confirmations, long threshold) {
        super("FINALITY_TIMEOUT",
            "transaction " + transactionId + " reached " + confirmations
                + " of " + threshold + " confirmations before the finality timeout");
    }
}
