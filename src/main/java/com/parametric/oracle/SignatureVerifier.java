package com.parametric.oracle;

/**
 * Decides whether a submission really comes from the oracle it names.
 * Implementations plug in a real signature scheme.
 */
@FunctionalInterface
public interface SignatureVerifier {

    boolean verify(Oracle oracle, String attestationId, String signature, double value);
}
