package com.quorumbridge.bridge.service.attestation;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.CanonicalMessage;
import com.quorumbridge.bridge.crypto.SignatureVerifier;
import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.AttestationMode;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.CommitmentStatus;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.repository.AttestationCommitmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Two-phase attestation. The validator first publishes
 * {@code keccak256(messageHash ‖ salt)}, then reveals the salt together with a
 * signature over that commitment before the reveal window closes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CommitRevealStrategy implements AttestationStrategy {

    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final AttestationCommitmentRepository commitmentRepository;
    private final BridgeProperties properties;

    @Override
    public AttestationMode mode() {
        return AttestationMode.COMMIT_REVEAL;
    }

    /**
     * Records a commitment. An expired commitment by the same validator is replaced.
     */
    public AttestationCommitment commit(BridgeTransaction transaction, String validator, String commitment, Instant now) {
        if (commitment == null || !BYTES32.matcher(commitment).matches()) {
            throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "Commitment must be a 32-byte hex hash");
        }
        AttestationCommitment existing = commitmentRepository.findForUpdate(transaction.getNonce(), validator).orElse(null);
        if (existing != null && existing.getStatus() == CommitmentStatus.REVEALED) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_ATTESTATION,
                    validator + " already revealed for transaction " + transaction.getNonce());
        }
        if (existing != null && existing.isLive(now)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_COMMITMENT,
                    validator + " already has a live commitment for transaction " + transaction.getNonce());
        }

        AttestationCommitment record = existing != null ? existing : AttestationCommitment.builder()
                .transactionNonce(transaction.getNonce())
                .validatorAddress(validator)
                .build();
        record.setCommitment(commitment.toLowerCase(Locale.ROOT));
        record.setCommittedAt(now);
        record.setRevealDeadline(now.plus(properties.getAttestation().getRevealWindow()));
        record.setStatus(CommitmentStatus.PENDING);
        return commitmentRepository.save(record);
    }

    @Override
    public String verify(BridgeTransaction transaction, String validator, AttestationSubmission submission, Instant now) {
        if (submission.salt() == null || !BYTES32.matcher(submission.salt()).matches()) {
            throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "Reveal requires a 32-byte hex salt");
        }
        AttestationCommitment commitment = commitmentRepository.findForUpdate(transaction.getNonce(), validator)
                .orElseThrow(() -> new BridgeStateException(ErrorCode.COMMITMENT_NOT_FOUND,
                        "No commitment by " + validator + " for transaction " + transaction.getNonce()));
        if (commitment.getStatus() == CommitmentStatus.REVEALED) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_ATTESTATION,
                    validator + " already revealed for transaction " + transaction.getNonce());
        }
        if (!commitment.isLive(now)) {
            throw new BridgeStateException(ErrorCode.ATTESTATION_WINDOW_EXPIRED,
                    "Reveal window for " + validator + " on transaction " + transaction.getNonce()
                            + " closed at " + commitment.getRevealDeadline());
        }

        byte[] expected = CanonicalMessage.commitment(
                CanonicalMessage.fromHex(transaction.getMessageHash()), CanonicalMessage.fromHex(submission.salt()));
        String expectedHex = CanonicalMessage.toHex(expected);
        if (!expectedHex.equalsIgnoreCase(commitment.getCommitment())) {
            throw new ValidationException(ErrorCode.INVALID_COMMITMENT,
                    "Revealed salt does not match the commitment for transaction " + transaction.getNonce());
        }
        String signer = SignatureVerifier.recoverSigner(expected, submission.signature());
        if (!Addresses.same(signer, validator)) {
            log.warn("Reveal signature for nonce {} recovers to {}, submitted by {}",
                    transaction.getNonce(), signer, validator);
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE,
                    "Reveal signature was not made by " + validator);
        }

        commitment.setStatus(CommitmentStatus.REVEALED);
        commitmentRepository.save(commitment);
        return expectedHex;
    }
}
