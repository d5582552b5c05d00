package com.parametric.error;

public class InvalidSignatureException extends SettlementException {

    public InvalidSignatureException(String oracleId, String attestationId) {
        super("INVALID_SIGNATURE",
            "signature from oracle " + oracleId + " failed verification for attestation " + attestationId);
    }
}
