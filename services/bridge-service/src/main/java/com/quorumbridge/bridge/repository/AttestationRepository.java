package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.Attestation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AttestationRepository extends JpaRepository<Attestation, Long> {

    boolean existsByTransactionNonceAndValidatorAddress(Long transactionNonce, String validatorAddress);

    /**
     * Replay guard: a signature is accepted at most once across all transactions
     */
    boolean existsBySignatureHash(String signatureHash);

    Optional<Attestation> findByTransactionNonceAndValidatorAddress(Long transactionNonce, String validatorAddress);

    List<Attestation> findByTransactionNonceOrderByAttestedAtAsc(Long transactionNonce);

    long countByTransactionNonce(Long transactionNonce);
}
