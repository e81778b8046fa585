package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.Challenge;
import com.quorumbridge.bridge.domain.ChallengeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChallengeRepository extends JpaRepository<Challenge, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Challenge c WHERE c.id = :id")
    Optional<Challenge> findByIdForUpdate(@Param("id") Long id);

    /**
     * At most one open or upheld challenge may exist per (validator, nonce)
     */
    boolean existsByValidatorAddressAndTransactionNonceAndStatus(
            String validatorAddress, Long transactionNonce, ChallengeStatus status);

    long countByValidatorAddressAndStatus(String validatorAddress, ChallengeStatus status);

    Page<Challenge> findByStatus(ChallengeStatus status, Pageable pageable);
}
