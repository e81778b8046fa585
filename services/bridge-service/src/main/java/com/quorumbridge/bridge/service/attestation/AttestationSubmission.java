package com.quorumbridge.bridge.service.attestation;

/**
 * Validator-supplied attestation material.
 *
 * @param signature 65-byte {@code r ‖ s ‖ v} signature, hex encoded
 * @param salt      32-byte reveal salt, hex encoded; only used in commit-reveal mode
 */
public record AttestationSubmission(String signature, String salt) {

    public static AttestationSubmission direct(String signature) {
        return new AttestationSubmission(signature, null);
    }
}
