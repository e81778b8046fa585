package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.FailureVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FailureVoteRepository extends JpaRepository<FailureVote, Long> {

    boolean existsByTransactionNonceAndValidatorAddress(Long transactionNonce, String validatorAddress);

    List<FailureVote> findByTransactionNonce(Long transactionNonce);
}
