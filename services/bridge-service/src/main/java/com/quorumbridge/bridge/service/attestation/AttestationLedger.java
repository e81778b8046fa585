package com.quorumbridge.bridge.service.attestation;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.SignatureVerifier;
import com.quorumbridge.bridge.domain.Attestation;
import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.AttestationMode;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.CommitmentStatus;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.repository.AttestationCommitmentRepository;
import com.quorumbridge.bridge.repository.AttestationRepository;
import com.quorumbridge.bridge.repository.ValidatorRepository;
import com.quorumbridge.bridge.service.ReputationPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-transaction attestation records with replay protection.
 *
 * <p>The configured {@link AttestationMode} selects the {@link AttestationStrategy}
 * that checks each submission. A validator attests a transaction at most once and a
 * signature is accepted at most once across all transactions.</p>
 */
@Service
@Slf4j
public class AttestationLedger {

    private final AttestationRepository attestationRepository;
    private final AttestationCommitmentRepository commitmentRepository;
    private final ValidatorRepository validatorRepository;
    private final ReputationPolicy reputationPolicy;
    private final CommitRevealStrategy commitRevealStrategy;
    private final BridgeProperties properties;
    private final Map<AttestationMode, AttestationStrategy> strategies;

    public AttestationLedger(AttestationRepository attestationRepository,
                             AttestationCommitmentRepository commitmentRepository,
                             ValidatorRepository validatorRepository,
                             ReputationPolicy reputationPolicy,
                             CommitRevealStrategy commitRevealStrategy,
                             List<AttestationStrategy> strategies,
                             BridgeProperties properties) {
        this.attestationRepository = attestationRepository;
        this.commitmentRepository = commitmentRepository;
        this.validatorRepository = validatorRepository;
        this.reputationPolicy = reputationPolicy;
        this.commitRevealStrategy = commitRevealStrategy;
        this.properties = properties;
        this.strategies = new EnumMap<>(strategies.stream()
                .collect(Collectors.toMap(AttestationStrategy::mode, Function.identity())));
    }

    public AttestationMode activeMode() {
        return properties.getAttestation().getMode();
    }

    /**
     * Verifies and stores an attestation. Duplicate checks run before the signature is
     * verified, so a replayed signature is reported as a duplicate.
     */
    @Transactional
    public Attestation record(BridgeTransaction transaction, String validator,
                              AttestationSubmission submission, Instant now) {
        Long nonce = transaction.getNonce();
        if (attestationRepository.existsByTransactionNonceAndValidatorAddress(nonce, validator)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_ATTESTATION,
                    validator + " already attested transaction " + nonce);
        }
        String signatureHash = SignatureVerifier.signatureHash(submission.signature());
        if (attestationRepository.existsBySignatureHash(signatureHash)) {
            log.warn("Replayed signature {} submitted by {} for nonce {}", signatureHash, validator, nonce);
            throw new BridgeStateException(ErrorCode.DUPLICATE_ATTESTATION,
                    "Signature already used by another attestation");
        }

        AttestationMode mode = activeMode();
        AttestationStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No attestation strategy registered for mode " + mode);
        }
        String signedHash = strategy.verify(transaction, validator, submission, now);

        Attestation attestation = Attestation.builder()
                .transactionNonce(nonce)
                .validatorAddress(validator)
                .signature(submission.signature().toLowerCase(Locale.ROOT))
                .signatureHash(signatureHash)
                .signedHash(signedHash)
                .mode(mode)
                .attestedAt(now)
                .invalidated(false)
                .build();
        return attestationRepository.save(attestation);
    }

    /**
     * First phase of a commit-reveal attestation.
     */
    @Transactional
    public AttestationCommitment commit(BridgeTransaction transaction, String validator, String commitment, Instant now) {
        if (activeMode() != AttestationMode.COMMIT_REVEAL) {
            throw new BridgeStateException(ErrorCode.ATTESTATION_MODE_MISMATCH,
                    "Commitments are not used in " + activeMode() + " mode");
        }
        if (attestationRepository.existsByTransactionNonceAndValidatorAddress(transaction.getNonce(), validator)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_ATTESTATION,
                    validator + " already attested transaction " + transaction.getNonce());
        }
        return commitRevealStrategy.commit(transaction, validator, commitment, now);
    }

    public Optional<Attestation> findAttestation(Long nonce, String validator) {
        return attestationRepository.findByTransactionNonceAndValidatorAddress(nonce, validator);
    }

    public boolean hasAttested(Long nonce, String validator) {
        return attestationRepository.existsByTransactionNonceAndValidatorAddress(nonce, validator);
    }

    /**
     * Attesters that count toward quorum now: attestation not invalidated and the
     * validator currently eligible.
     */
    @Transactional(readOnly = true)
    public List<String> quorumAttesters(Long nonce, Instant now) {
        List<String> attesters = attestationRepository.findByTransactionNonceOrderByAttestedAtAsc(nonce).stream()
                .filter(a -> !a.isInvalidated())
                .map(Attestation::getValidatorAddress)
                .toList();
        return eligibleAmong(attesters, now);
    }

    /**
     * Filters {@code addresses} down to validators eligible at {@code now}.
     */
    public List<String> eligibleAmong(List<String> addresses, Instant now) {
        if (addresses.isEmpty()) {
            return List.of();
        }
        Map<String, Validator> validators = validatorRepository.findByAddressIn(addresses).stream()
                .collect(Collectors.toMap(Validator::getAddress, Function.identity()));
        return addresses.stream()
                .filter(a -> validators.containsKey(a) && reputationPolicy.isEligible(validators.get(a), now))
                .toList();
    }

    /**
     * Marks a validator's attestation of a transaction as no longer trusted.
     */
    @Transactional
    public void invalidate(Long nonce, String validator, Instant now) {
        attestationRepository.findByTransactionNonceAndValidatorAddress(nonce, validator).ifPresent(a -> {
            a.setInvalidated(true);
            a.setInvalidatedAt(now);
            attestationRepository.save(a);
            log.warn("Attestation of transaction {} by {} invalidated", nonce, validator);
        });
    }

    @Transactional(readOnly = true)
    public List<Attestation> listAttestations(Long nonce) {
        return attestationRepository.findByTransactionNonceOrderByAttestedAtAsc(nonce);
    }

    /**
     * Voids unrevealed commitments whose reveal window has closed.
     *
     * @return number of commitments expired
     */
    @Transactional
    public int expireStaleCommitments(Instant now) {
        List<AttestationCommitment> stale =
                commitmentRepository.findByStatusAndRevealDeadlineLessThanEqual(CommitmentStatus.PENDING, now);
        stale.forEach(c -> c.setStatus(CommitmentStatus.EXPIRED));
        commitmentRepository.saveAll(stale);
        return stale.size();
    }
}
