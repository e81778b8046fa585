package com.quorumbridge.bridge.service.attestation;

import com.quorumbridge.bridge.domain.AttestationMode;
import com.quorumbridge.bridge.domain.BridgeTransaction;

import java.time.Instant;

/**
 * Proof check for one attestation mode. Implementations throw a bridge exception when
 * the submission does not prove that {@code validator} agrees with the transfer.
 */
public interface AttestationStrategy {

    AttestationMode mode();

    /**
     * @return the hex hash the accepted signature was made over
     */
    String verify(BridgeTransaction transaction, String validator, AttestationSubmission submission, Instant now);
}
