package com.parametric.oracle;

/**
 * Shape-only check: a present, non-trivial signature, a registered public key and a
 * finite value. Performs no cryptography.
 */
public class FormatSignatureVerifier implements SignatureVerifier {

    static final int MIN_SIGNATURE_LENGTH = 11;

    @Override
    public boolean verify(Oracle oracle, String attestationId, String signature, double value) {
        if (oracle == null || signature == null || attestationId == null) {
            return false;
        }
        if (oracle.getPublicKey() == null || oracle.getPublicKey().isBlank()) {
            return false;
        }
        return signature.strip().length() >= MIN_SIGNATURE_LENGTH && Double.isFinite(value);
    }
}
