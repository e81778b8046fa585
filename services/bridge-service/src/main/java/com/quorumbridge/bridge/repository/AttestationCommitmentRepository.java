package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.CommitmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttestationCommitmentRepository extends JpaRepository<AttestationCommitment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM AttestationCommitment c " +
            "WHERE c.transactionNonce = :nonce AND c.validatorAddress = :validator")
    Optional<AttestationCommitment> findForUpdate(@Param("nonce") Long nonce,
                                                  @Param("validator") String validator);

    /**
     * Find unrevealed commitments whose reveal window has closed
     */
    List<AttestationCommitment> findByStatusAndRevealDeadlineLessThanEqual(CommitmentStatus status, Instant now);
}
