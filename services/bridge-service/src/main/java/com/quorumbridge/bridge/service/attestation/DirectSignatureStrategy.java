package com.quorumbridge.bridge.service.attestation;

import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.CanonicalMessage;
import com.quorumbridge.bridge.crypto.SignatureVerifier;
import com.quorumbridge.bridge.domain.AttestationMode;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * The validator signs the canonical transfer hash directly.
 */
@Component
@Slf4j
public class DirectSignatureStrategy implements AttestationStrategy {

    @Override
    public AttestationMode mode() {
        return AttestationMode.DIRECT;
    }

    @Override
    public String verify(BridgeTransaction transaction, String validator, AttestationSubmission submission, Instant now) {
        byte[] messageHash = CanonicalMessage.fromHex(transaction.getMessageHash());
        String signer = SignatureVerifier.recoverSigner(messageHash, submission.signature());
        if (!Addresses.same(signer, validator)) {
            log.warn("Signature for nonce {} recovers to {}, submitted by {}", transaction.getNonce(), signer, validator);
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE,
                    "Signature was not made by " + validator + " over transaction " + transaction.getNonce());
        }
        return transaction.getMessageHash();
    }
}
